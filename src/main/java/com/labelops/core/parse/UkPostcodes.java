package com.labelops.core.parse;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * UK postcode detection and canonical formatting ({@code AB53 8HY}).
 */
public final class UkPostcodes {
    static final Pattern IN_TEXT = Pattern.compile(
        "\\b(GIR\\s?0AA|[A-Z]{1,2}\\d[A-Z\\d]?\\s*\\d[A-Z]{2})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPACT = Pattern.compile("[A-Z]{1,2}\\d[A-Z\\d]?\\d[A-Z]{2}");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");

    private UkPostcodes() {
    }

    public static boolean isValid(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String compact = compact(value);
        return compact.equals("GIR0AA") || COMPACT.matcher(compact).matches();
    }

    /**
     * Canonical form, or an empty string when the value is not a UK postcode.
     */
    public static String normalize(String value) {
        if (!isValid(value)) {
            return "";
        }
        String compact = compact(value);
        return compact.substring(0, compact.length() - 3) + " " + compact.substring(compact.length() - 3);
    }

    /**
     * Finds the first postcode inside a line and returns it with the remaining text.
     */
    static Optional<Extraction> extract(String line) {
        Matcher matcher = IN_TEXT.matcher(line);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String postcode = normalize(matcher.group(1));
        if (postcode.isEmpty()) {
            return Optional.empty();
        }
        String remaining = TextCleaner.cleanLine(line.substring(0, matcher.start()) + " " + line.substring(matcher.end()));
        return Optional.of(new Extraction(postcode, remaining));
    }

    private static String compact(String value) {
        return NON_ALPHANUMERIC.matcher(value).replaceAll("").toUpperCase(Locale.ROOT);
    }

    record Extraction(String postcode, String remaining) {
    }
}
