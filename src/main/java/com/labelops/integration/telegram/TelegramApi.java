package com.labelops.integration.telegram;

import java.util.List;

/**
 * The two Bot API calls the ingest bot needs.
 */
public interface TelegramApi {

    List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) throws TelegramApiException;

    void sendMessage(long chatId, String text) throws TelegramApiException;
}
