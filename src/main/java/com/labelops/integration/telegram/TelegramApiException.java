package com.labelops.integration.telegram;

/**
 * Telegram Bot API call failed. Messages never include the bot token.
 */
public class TelegramApiException extends Exception {

    public TelegramApiException(String message) {
        super(message);
    }

    public TelegramApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
