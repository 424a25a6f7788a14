package com.labelops.config;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Record fields that can be placed into a column of the courier import template.
 */
public enum MappingField {
    FULL_NAME("full_name", true),
    ADDRESS_LINE_1("address_line_1", true),
    ADDRESS_LINE_2("address_line_2", true),
    TOWN_CITY("town_city", true),
    COUNTY("county", true),
    POSTCODE("postcode", true),
    COUNTRY("country", true),
    SERVICE("service", true),
    WEIGHT_KG("weight_kg", true),
    REFERENCE("reference", false),
    PHONE("phone", false),
    EMAIL("email", false);

    private final String key;
    private final boolean required;

    MappingField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    public String key() {
        return key;
    }

    public boolean required() {
        return required;
    }

    public static Optional<MappingField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim();
        return Arrays.stream(values())
            .filter(field -> field.key.equalsIgnoreCase(normalized))
            .findFirst();
    }

    public static List<MappingField> requiredFields() {
        return Arrays.stream(values())
            .filter(MappingField::required)
            .collect(Collectors.toList());
    }
}
