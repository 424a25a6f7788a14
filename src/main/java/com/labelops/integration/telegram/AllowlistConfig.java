package com.labelops.integration.telegram;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Chats allowed to submit shipments and the client each chat posts to by default.
 */
public record AllowlistConfig(List<Long> allowedChatIds, Map<String, String> defaultClientByChat) {
    static final String INSTRUCTIONS = "Add numeric chat IDs to allowed_chat_ids to permit ingestion.";

    public AllowlistConfig {
        allowedChatIds = allowedChatIds == null ? List.of() : List.copyOf(allowedChatIds);
        defaultClientByChat = defaultClientByChat == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(defaultClientByChat));
    }

    public static AllowlistConfig empty() {
        return new AllowlistConfig(List.of(), Map.of());
    }

    public boolean isAllowed(long chatId) {
        return allowedChatIds.contains(chatId);
    }

    public Optional<String> defaultClientFor(long chatId) {
        return Optional.ofNullable(defaultClientByChat.get(Long.toString(chatId)));
    }

    public AllowlistConfig withDefaultClient(long chatId, String clientId) {
        Map<String, String> updated = new LinkedHashMap<>(defaultClientByChat);
        updated.put(Long.toString(chatId), clientId);
        return new AllowlistConfig(allowedChatIds, updated);
    }

    static AllowlistConfig fromJson(JSONObject json) {
        List<Long> ids = new ArrayList<>();
        JSONArray allowed = json.optJSONArray("allowed_chat_ids");
        if (allowed != null) {
            for (int i = 0; i < allowed.length(); i++) {
                ids.add(allowed.getLong(i));
            }
        }
        Map<String, String> defaults = new LinkedHashMap<>();
        JSONObject byChat = json.optJSONObject("default_client_by_chat");
        if (byChat != null) {
            for (String chatId : byChat.keySet()) {
                defaults.put(chatId.trim(), byChat.getString(chatId).trim().toLowerCase(Locale.ROOT));
            }
        }
        return new AllowlistConfig(ids, defaults);
    }

    JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("allowed_chat_ids", new JSONArray(allowedChatIds));
        JSONObject byChat = new JSONObject();
        defaultClientByChat.forEach(byChat::put);
        json.put("default_client_by_chat", byChat);
        json.put("instructions", INSTRUCTIONS);
        return json;
    }
}
