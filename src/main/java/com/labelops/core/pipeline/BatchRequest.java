package com.labelops.core.pipeline;

import com.labelops.config.EffectiveSettings;
import com.labelops.core.ai.RiskLevel;

import java.util.List;
import java.util.Objects;

/**
 * Everything one pipeline run needs. Settings are resolved by the caller so a batch sees a single
 * configuration version from start to end.
 *
 * @param inputFiles file names only, recorded in the manifest
 */
public record BatchRequest(EffectiveSettings settings,
                           String rawText,
                           List<String> inputFiles,
                           boolean useAi,
                           RiskLevel maxRisk,
                           int maxAiCalls,
                           BatchSource source,
                           boolean dryRun) {

    public static final int DEFAULT_MAX_AI_CALLS = 50;

    public BatchRequest {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(source, "source");
        rawText = rawText == null ? "" : rawText;
        inputFiles = inputFiles == null ? List.of() : List.copyOf(inputFiles);
        maxRisk = maxRisk == null ? RiskLevel.LOW : maxRisk;
        if (maxAiCalls < 0) {
            throw new IllegalArgumentException("maxAiCalls must not be negative");
        }
    }

    public String clientId() {
        return settings.clientId();
    }

    public static Builder builder(EffectiveSettings settings, String rawText, BatchSource source) {
        return new Builder(settings, rawText, source);
    }

    public static final class Builder {
        private final EffectiveSettings settings;
        private final String rawText;
        private final BatchSource source;
        private List<String> inputFiles = List.of();
        private boolean useAi;
        private RiskLevel maxRisk = RiskLevel.LOW;
        private int maxAiCalls = DEFAULT_MAX_AI_CALLS;
        private boolean dryRun;

        private Builder(EffectiveSettings settings, String rawText, BatchSource source) {
            this.settings = settings;
            this.rawText = rawText;
            this.source = source;
        }

        public Builder inputFiles(List<String> inputFiles) {
            this.inputFiles = inputFiles;
            return this;
        }

        public Builder useAi(boolean useAi) {
            this.useAi = useAi;
            return this;
        }

        public Builder maxRisk(RiskLevel maxRisk) {
            this.maxRisk = maxRisk;
            return this;
        }

        public Builder maxAiCalls(int maxAiCalls) {
            this.maxAiCalls = maxAiCalls;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public BatchRequest build() {
            return new BatchRequest(settings, rawText, inputFiles, useAi, maxRisk, maxAiCalls, source, dryRun);
        }
    }
}
