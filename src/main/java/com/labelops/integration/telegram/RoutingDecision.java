package com.labelops.integration.telegram;

import java.util.Objects;

/**
 * Where a chat message goes, or why it is refused.
 */
public record RoutingDecision(boolean accepted, String clientId, String content, String reason) {

    public static RoutingDecision accept(String clientId, String content) {
        return new RoutingDecision(true, Objects.requireNonNull(clientId), Objects.requireNonNull(content), null);
    }

    public static RoutingDecision reject(String reason) {
        return new RoutingDecision(false, null, null, reason);
    }
}
