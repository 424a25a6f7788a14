package com.labelops.config;

import java.util.List;

/**
 * Carries every violation found in the configuration, not only the first one.
 */
public class ConfigValidationException extends ConfigException {
    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String describe(List<String> violations) {
        StringBuilder message = new StringBuilder("Invalid configuration (")
            .append(violations.size())
            .append(violations.size() == 1 ? " problem)" : " problems)");
        for (String violation : violations) {
            message.append(System.lineSeparator()).append(" - ").append(violation);
        }
        return message.toString();
    }
}
