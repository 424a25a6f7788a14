package com.labelops.core.ai;

import com.labelops.config.ClientDefaults;
import com.labelops.config.MappingField;
import com.labelops.core.parse.AddressRecord;
import com.labelops.core.parse.TextCleaner;
import com.labelops.core.parse.UkPostcodes;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which records show problems worth a correction request.
 */
public final class ReviewHeuristics {
    private static final Pattern LOOSE_POSTCODE = Pattern.compile("^[A-Z0-9][A-Z0-9\\s-]{2,12}$");

    private ReviewHeuristics() {
    }

    /**
     * True when the postcode is missing or malformed, the country is missing or a known typo, or
     * any field carries a {@code ?} or {@code UNKNOWN} marker.
     */
    public static boolean needsReview(AddressRecord record) {
        String country = record.country().toUpperCase(Locale.ROOT);
        if (!postcodeLooksValid(record.postcode(), country)) {
            return true;
        }
        if (country.isEmpty() || TextCleaner.isCountryTypo(country)) {
            return true;
        }
        for (MappingField field : MappingField.values()) {
            String value = record.value(field);
            if (value.contains("?") || value.toUpperCase(Locale.ROOT).contains("UNKNOWN")) {
                return true;
            }
        }
        return false;
    }

    private static boolean postcodeLooksValid(String postcode, String country) {
        if (postcode.isBlank()) {
            return false;
        }
        if (ClientDefaults.DEFAULT_COUNTRY.equals(country)) {
            return UkPostcodes.isValid(postcode);
        }
        return LOOSE_POSTCODE.matcher(postcode.toUpperCase(Locale.ROOT)).matches();
    }
}
