package com.labelops.core.service;

import com.labelops.config.ServiceRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chooses the shipping service for a block of text from a client's ordered rule list.
 */
public final class ServiceMatcher {
    private static final Pattern SERVICE_DIRECTIVE =
        Pattern.compile("(?im)^\\s*SERVICE\\s*=\\s*(.+?)\\s*$");

    private ServiceMatcher() {
    }

    /**
     * Returns the first tag rule, in configured order, whose tag occurs in {@code text}; otherwise
     * the default rule. A tag occurs when the first non-empty line equals it, when a
     * {@code SERVICE=} directive names it, or when it appears with no letter or digit directly
     * before or after it. Comparison ignores case.
     *
     * @throws IllegalArgumentException when no tag matches and the list has no default rule
     */
    public static ServiceRule match(String text, List<ServiceRule> rules) {
        Objects.requireNonNull(rules, "rules");
        String body = text == null ? "" : text;
        String firstLine = firstNonEmptyLine(body);
        List<String> directives = directives(body);

        ServiceRule fallback = null;
        for (ServiceRule rule : rules) {
            if (rule.isDefault()) {
                if (fallback == null) {
                    fallback = rule;
                }
                continue;
            }
            String tag = rule.trigger().tag();
            if (tag == null || tag.isBlank()) {
                continue;
            }
            if (tag.equalsIgnoreCase(firstLine)
                || directives.stream().anyMatch(tag::equalsIgnoreCase)
                || containsToken(body, tag)) {
                return rule;
            }
        }
        if (fallback == null) {
            throw new IllegalArgumentException("No default service rule configured");
        }
        return fallback;
    }

    static boolean containsToken(String text, String tag) {
        Pattern token = Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(tag.trim()) + "(?![\\p{L}\\p{N}])",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return token.matcher(text).find();
    }

    private static String firstNonEmptyLine(String text) {
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                return line.trim();
            }
        }
        return "";
    }

    private static List<String> directives(String text) {
        Matcher matcher = SERVICE_DIRECTIVE.matcher(text);
        List<String> values = new ArrayList<>();
        while (matcher.find()) {
            values.add(matcher.group(1).toUpperCase(Locale.ROOT));
        }
        return values;
    }
}
