package com.labelops.integration.telegram;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bot API over {@link HttpClient} with long polling.
 */
public final class TelegramHttpApi implements TelegramApi {
    static final String DEFAULT_BASE_URL = "https://api.telegram.org";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String token;

    public TelegramHttpApi(String token) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(20)).build(), DEFAULT_BASE_URL, token);
    }

    public TelegramHttpApi(HttpClient httpClient, String baseUrl, String token) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = baseUrl == null ? DEFAULT_BASE_URL : baseUrl.replaceAll("/+$", "");
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Telegram bot token is required");
        }
        this.token = token.trim();
    }

    @Override
    public List<TelegramUpdate> getUpdates(long offset, int timeoutSeconds) throws TelegramApiException {
        JSONObject body = new JSONObject()
            .put("offset", offset)
            .put("timeout", timeoutSeconds)
            .put("allowed_updates", new JSONArray(List.of("message")));
        JSONObject answer = call("getUpdates", body, Duration.ofSeconds(timeoutSeconds + 10L));
        JSONArray result = answer.optJSONArray("result");
        List<TelegramUpdate> updates = new ArrayList<>();
        if (result == null) {
            return updates;
        }
        for (int i = 0; i < result.length(); i++) {
            JSONObject update = result.optJSONObject(i);
            if (update != null) {
                updates.add(toUpdate(update));
            }
        }
        return updates;
    }

    @Override
    public void sendMessage(long chatId, String text) throws TelegramApiException {
        call("sendMessage", new JSONObject().put("chat_id", chatId).put("text", text), Duration.ofSeconds(30));
    }

    static TelegramUpdate toUpdate(JSONObject update) {
        long updateId = update.getLong("update_id");
        JSONObject message = update.optJSONObject("message");
        if (message == null) {
            return new TelegramUpdate(updateId, null);
        }
        JSONObject chat = message.optJSONObject("chat");
        if (chat == null) {
            return new TelegramUpdate(updateId, null);
        }
        boolean media = message.has("photo") || message.has("document");
        String text = message.has("text") ? message.getString("text") : null;
        return new TelegramUpdate(updateId, new InboundMessage(chat.getLong("id"), text, media));
    }

    private JSONObject call(String method, JSONObject body, Duration timeout) throws TelegramApiException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/bot" + token + "/" + method))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new TelegramApiException("%s failed: %s".formatted(method, ex.getClass().getSimpleName()), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TelegramApiException(method + " interrupted", ex);
        }
        try {
            JSONObject answer = new JSONObject(response.body());
            if (response.statusCode() / 100 != 2 || !answer.optBoolean("ok", false)) {
                throw new TelegramApiException("%s returned HTTP %d: %s".formatted(
                    method, response.statusCode(), answer.optString("description", "no description")));
            }
            return answer;
        } catch (JSONException ex) {
            throw new TelegramApiException("%s returned malformed JSON (HTTP %d)".formatted(method, response.statusCode()), ex);
        }
    }
}
