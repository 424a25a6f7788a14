package com.labelops.core.parse;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line cleanup and casing rules for pasted address text.
 */
public final class TextCleaner {
    private static final Set<String> ACRONYMS = Set.of("PO", "UK", "GB", "EU", "USA");
    private static final Set<String> UK_COUNTRY_VARIANTS = Set.of(
        "UK", "U.K", "U.K.", "UNITED KINGDOM", "GREAT BRITAIN", "GB", "BRITAIN",
        "ENGLAND", "SCOTLAND", "WALES", "NORTHERN IRELAND");
    private static final Set<String> COUNTRY_TYPOS = Set.of(
        "UNITED KINGSOM", "UNITED KINDGOM", "UNITED STAES", "UNITED STATSE", "UNITED ARAB EMRITES");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_LETTER_OR_SPACE = Pattern.compile("[^A-Za-z\\s]");
    private static final String EDGE_CHARACTERS = " ,.";

    private TextCleaner() {
    }

    /**
     * Drops control characters and symbols such as emoji, collapses whitespace and trims
     * surrounding spaces, commas and full stops.
     */
    public static String cleanLine(String line) {
        if (line == null || line.isEmpty()) {
            return "";
        }
        StringBuilder kept = new StringBuilder(line.length());
        line.codePoints()
            .map(codePoint -> codePoint == '\t' ? ' ' : codePoint)
            .filter(TextCleaner::isPrintable)
            .forEach(kept::appendCodePoint);
        String collapsed = WHITESPACE.matcher(kept).replaceAll(" ");
        return trimEdges(collapsed);
    }

    public static boolean isUkCountry(String value) {
        return UK_COUNTRY_VARIANTS.contains(countryKey(value));
    }

    /**
     * Misspelt country names common in pasted addresses. They are kept as the country, upper
     * cased, so review can propose the correct spelling.
     */
    public static boolean isCountryTypo(String value) {
        return COUNTRY_TYPOS.contains(countryKey(value));
    }

    static String countryKey(String value) {
        if (value == null) {
            return "";
        }
        String letters = NOT_LETTER_OR_SPACE.matcher(value).replaceAll("").toUpperCase(Locale.ROOT).trim();
        return WHITESPACE.matcher(letters).replaceAll(" ");
    }

    /**
     * Title cases words while keeping acronyms, initials and tokens with digits upper case.
     */
    public static String titleCase(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        StringBuilder result = new StringBuilder();
        for (String token : text.trim().split(" ")) {
            if (token.isEmpty()) {
                continue;
            }
            if (result.length() > 0) {
                result.append(' ');
            }
            if (token.contains("-")) {
                result.append(joinCased(token.split("-", -1), "-"));
            } else if (token.contains("'")) {
                result.append(joinApostrophe(token.split("'", -1)));
            } else {
                result.append(caseToken(token));
            }
        }
        return result.toString();
    }

    private static String joinCased(String[] parts, String separator) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append(separator);
            }
            joined.append(caseToken(parts[i]));
        }
        return joined.toString();
    }

    private static String joinApostrophe(String[] parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                joined.append('\'');
            }
            // possessive suffix: Queen's, not Queen'S
            if (i == parts.length - 1 && i > 0 && parts[i].equalsIgnoreCase("s")) {
                joined.append(parts[i].toLowerCase(Locale.ROOT));
            } else {
                joined.append(caseToken(parts[i]));
            }
        }
        return joined.toString();
    }

    private static String caseToken(String token) {
        if (token.isEmpty()) {
            return token;
        }
        String upper = token.toUpperCase(Locale.ROOT);
        if (ACRONYMS.contains(upper)) {
            return upper;
        }
        if (token.length() <= 2 && token.chars().allMatch(Character::isLetter)) {
            return upper;
        }
        if (token.chars().anyMatch(Character::isDigit)) {
            return upper;
        }
        return upper.charAt(0) + token.substring(1).toLowerCase(Locale.ROOT);
    }

    private static boolean isPrintable(int codePoint) {
        int type = Character.getType(codePoint);
        return type != Character.CONTROL
            && type != Character.FORMAT
            && type != Character.PRIVATE_USE
            && type != Character.SURROGATE
            && type != Character.UNASSIGNED
            && type != Character.OTHER_SYMBOL;
    }

    private static String trimEdges(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && EDGE_CHARACTERS.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && EDGE_CHARACTERS.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
