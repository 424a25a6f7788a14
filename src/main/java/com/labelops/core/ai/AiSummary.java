package com.labelops.core.ai;

import java.util.Objects;

/**
 * Counts of the AI step of one batch. Holds no record content.
 *
 * @param applied           suggestions written into records
 * @param flagged           suggestions left for manual review
 * @param unavailable       calls that failed or returned unusable output
 * @param skippedOverBudget records needing review after the call budget ran out
 */
public record AiSummary(boolean enabled,
                        RiskLevel maxRisk,
                        int calls,
                        int applied,
                        int flagged,
                        int unavailable,
                        int skippedOverBudget) {

    public AiSummary {
        Objects.requireNonNull(maxRisk, "maxRisk");
    }

    public static AiSummary disabled(RiskLevel maxRisk) {
        return new AiSummary(false, maxRisk, 0, 0, 0, 0, 0);
    }
}
