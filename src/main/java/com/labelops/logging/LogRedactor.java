package com.labelops.logging;

import java.util.regex.Pattern;

/**
 * Masks values that can identify a recipient before free text reaches a log line.
 */
public final class LogRedactor {
    static final int MAX_LENGTH = 200;

    private static final Pattern POSTCODE = Pattern.compile(
        "\\b[A-Z]{1,2}\\d[A-Z\\d]?\\s*\\d[A-Z]{2}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LONG_DIGITS = Pattern.compile("\\b\\d{5,}\\b");
    private static final Pattern EMAIL = Pattern.compile("[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+");

    private LogRedactor() {
    }

    public static String redact(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String sanitized = EMAIL.matcher(value).replaceAll("EMAIL");
        sanitized = POSTCODE.matcher(sanitized).replaceAll("POSTCODE");
        sanitized = LONG_DIGITS.matcher(sanitized).replaceAll("NUM");
        if (sanitized.length() > MAX_LENGTH) {
            return sanitized.substring(0, MAX_LENGTH) + "...";
        }
        return sanitized;
    }
}
