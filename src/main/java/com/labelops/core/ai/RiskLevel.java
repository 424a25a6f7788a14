package com.labelops.core.ai;

import java.util.Locale;

/**
 * Ordered risk classes of a suggested correction.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Parses {@code low}, {@code medium} or {@code high} ignoring case; anything else is
     * {@link #HIGH}.
     */
    public static RiskLevel fromString(String value) {
        if (value == null) {
            return HIGH;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            default -> HIGH;
        };
    }

    public boolean isAtMost(RiskLevel ceiling) {
        return compareTo(ceiling) <= 0;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
