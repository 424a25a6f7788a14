package com.labelops.integration.telegram;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Maps a chat message to a client and the text to ingest. Has no side effects.
 */
public final class IngestRouter {
    public static final String DEFAULT_FALLBACK_CLIENT = "client_01";
    static final Pattern CLIENT_LINE = Pattern.compile("^client_\\d{2}$", Pattern.CASE_INSENSITIVE);

    private final Supplier<? extends Collection<String>> configuredClients;
    private final String fallbackClientId;

    public IngestRouter(Supplier<? extends Collection<String>> configuredClients, String fallbackClientId) {
        this.configuredClients = Objects.requireNonNull(configuredClients, "configuredClients");
        this.fallbackClientId = fallbackClientId == null ? DEFAULT_FALLBACK_CLIENT : fallbackClientId;
    }

    /**
     * A first non-empty line naming a client selects it and is removed from the content;
     * otherwise the chat's default client is used, then the fallback.
     */
    public RoutingDecision route(InboundMessage message, AllowlistConfig allowlist) {
        if (!allowlist.isAllowed(message.chatId())) {
            return RoutingDecision.reject("chat not allowlisted");
        }
        if (!message.isText()) {
            return RoutingDecision.reject("text only");
        }
        if (message.text().isBlank()) {
            return RoutingDecision.reject("empty message");
        }

        String explicitClient = null;
        List<String> content = new ArrayList<>();
        for (String line : message.text().split("\\R", -1)) {
            String trimmed = line.trim();
            if (explicitClient == null && content.stream().allMatch(String::isBlank) && !trimmed.isEmpty()
                && CLIENT_LINE.matcher(trimmed).matches()) {
                explicitClient = trimmed.toLowerCase(Locale.ROOT);
                continue;
            }
            content.add(line);
        }

        String clientId = explicitClient != null
            ? explicitClient
            : allowlist.defaultClientFor(message.chatId()).orElse(fallbackClientId);
        if (!configuredClients.get().contains(clientId)) {
            return RoutingDecision.reject("unknown client " + clientId);
        }
        String body = String.join("\n", content).strip();
        if (body.isEmpty()) {
            return RoutingDecision.reject("no shipment text after client line");
        }
        return RoutingDecision.accept(clientId, body);
    }
}
