package com.labelops.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values used for record fields the shipment note does not provide.
 *
 * @param weightKg {@code null} when the configuration had no usable number
 */
public record ClientDefaults(String service, Double weightKg, String country, String referencePrefix) {

    public static final String DEFAULT_COUNTRY = "UNITED KINGDOM";

    public ClientDefaults {
        service = blankToNull(service);
        country = blankToNull(country);
        referencePrefix = blankToNull(referencePrefix);
    }

    public String countryOrDefault() {
        return country == null ? DEFAULT_COUNTRY : country;
    }

    /**
     * Flat view written into the batch manifest.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("service", service);
        values.put("weight_kg", weightKg);
        values.put("country", countryOrDefault());
        if (referencePrefix != null) {
            values.put("reference_prefix", referencePrefix);
        }
        return values;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
