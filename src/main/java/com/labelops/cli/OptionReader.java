package com.labelops.cli;

import com.labelops.core.ai.RiskLevel;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits {@code --name value}, {@code --name=value} and bare {@code --switch} arguments and
 * converts their values.
 */
final class OptionReader {
    private final Map<String, String> values = new LinkedHashMap<>();

    private OptionReader() {
    }

    static OptionReader read(List<String> args, Set<String> valued, Set<String> switches) throws UsageException {
        OptionReader reader = new OptionReader();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String name = arg;
            String value = null;
            int equals = arg.indexOf('=');
            if (equals > 0) {
                name = arg.substring(0, equals);
                value = arg.substring(equals + 1);
            }
            if (switches.contains(name)) {
                if (value != null) {
                    throw new UsageException(name + " takes no value");
                }
                reader.values.put(name, "1");
                continue;
            }
            if (!valued.contains(name)) {
                throw new UsageException("Unknown option: " + name);
            }
            if (value == null) {
                if (i + 1 >= args.size()) {
                    throw new UsageException("Missing value for " + name);
                }
                value = args.get(++i);
            }
            reader.values.put(name, value.trim());
        }
        return reader;
    }

    boolean has(String name) {
        return values.containsKey(name);
    }

    String string(String name, String fallback) {
        return values.getOrDefault(name, fallback);
    }

    String required(String name) throws UsageException {
        String value = values.get(name);
        if (value == null || value.isBlank()) {
            throw new UsageException(name + " is required");
        }
        return value;
    }

    boolean flag(String name, boolean fallback) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            return fallback;
        }
        return switch (value) {
            case "1" -> true;
            case "0" -> false;
            default -> throw new UsageException(name + " expects 0 or 1, got " + value);
        };
    }

    RiskLevel risk(String name, RiskLevel fallback) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            return fallback;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "low" -> RiskLevel.LOW;
            case "medium" -> RiskLevel.MEDIUM;
            case "high" -> RiskLevel.HIGH;
            default -> throw new UsageException(name + " expects low, medium or high, got " + value);
        };
    }

    int integer(String name, int fallback, int minimum) throws UsageException {
        String value = values.get(name);
        if (value == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < minimum) {
                throw new UsageException("%s must be at least %d".formatted(name, minimum));
            }
            return parsed;
        } catch (NumberFormatException ex) {
            throw new UsageException(name + " expects a number, got " + value);
        }
    }

    Path path(String name) {
        String value = values.get(name);
        return value == null || value.isBlank() ? null : Paths.get(value);
    }
}
