package com.labelops.core.ai;

import com.labelops.config.MappingField;

import java.util.Objects;

/**
 * Proposed replacement for one record field.
 *
 * @param confidence model confidence clamped to {@code 0..1}
 */
public record Suggestion(MappingField field, String proposedValue, double confidence, RiskLevel risk, String reason) {

    public Suggestion {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(risk, "risk");
        proposedValue = proposedValue == null ? "" : proposedValue.trim();
        reason = reason == null || reason.isBlank() ? "unspecified" : reason.trim();
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    /**
     * Whether the pipeline may write this suggestion into the record without review.
     */
    public boolean appliesWithin(RiskLevel maxRisk) {
        return risk.isAtMost(maxRisk) && !proposedValue.isBlank();
    }
}
