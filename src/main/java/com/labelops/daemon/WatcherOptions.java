package com.labelops.daemon;

import com.labelops.core.ai.RiskLevel;
import com.labelops.core.pipeline.BatchRequest;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Daemon run settings.
 *
 * @param clientIds clients to watch; empty watches every configured client
 * @param settle    how long a file must stay unmodified before it is queued
 */
public record WatcherOptions(List<String> clientIds,
                             boolean useAi,
                             RiskLevel maxRisk,
                             int maxAiCalls,
                             boolean recursive,
                             Duration pollInterval,
                             Duration settle) {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_SETTLE = Duration.ofSeconds(1);

    public WatcherOptions {
        clientIds = clientIds == null ? List.of() : List.copyOf(clientIds);
        maxRisk = maxRisk == null ? RiskLevel.LOW : maxRisk;
        pollInterval = Objects.requireNonNullElse(pollInterval, DEFAULT_POLL_INTERVAL);
        settle = Objects.requireNonNullElse(settle, DEFAULT_SETTLE);
    }

    public static WatcherOptions defaults() {
        return new WatcherOptions(List.of(), false, RiskLevel.LOW, BatchRequest.DEFAULT_MAX_AI_CALLS, false,
            DEFAULT_POLL_INTERVAL, DEFAULT_SETTLE);
    }

    public WatcherOptions withSettle(Duration value) {
        return new WatcherOptions(clientIds, useAi, maxRisk, maxAiCalls, recursive, pollInterval, value);
    }
}
