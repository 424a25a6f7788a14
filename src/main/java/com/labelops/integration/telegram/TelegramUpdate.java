package com.labelops.integration.telegram;

/**
 * One entry of a {@code getUpdates} answer.
 *
 * @param message {@code null} for update kinds the bot does not handle
 */
public record TelegramUpdate(long updateId, InboundMessage message) {
}
