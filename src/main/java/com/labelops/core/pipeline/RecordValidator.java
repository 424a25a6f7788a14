package com.labelops.core.pipeline;

import com.labelops.config.MappingField;
import com.labelops.core.parse.AddressRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a record carries everything a courier label needs.
 */
public final class RecordValidator {
    private static final List<MappingField> REQUIRED_TEXT = List.of(
        MappingField.FULL_NAME,
        MappingField.ADDRESS_LINE_1,
        MappingField.TOWN_CITY,
        MappingField.POSTCODE,
        MappingField.COUNTRY,
        MappingField.SERVICE);

    private RecordValidator() {
    }

    /**
     * @return problems as field-level messages; empty when the record is usable
     */
    public static List<String> problems(AddressRecord record) {
        List<String> problems = new ArrayList<>();
        for (MappingField field : REQUIRED_TEXT) {
            if (record.value(field).isBlank()) {
                problems.add(field.key() + " missing");
            }
        }
        if (record.weightKg() == null) {
            problems.add("weight_kg missing");
        } else if (record.weightKg() <= 0 || record.weightKg().isNaN()) {
            problems.add("weight_kg must be positive");
        }
        return problems;
    }
}
