package com.labelops.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 1-indexed column positions of record fields inside the import template.
 */
public final class TemplateMapping {
    private final Map<MappingField, Integer> columns;

    public TemplateMapping(Map<MappingField, Integer> columns) {
        EnumMap<MappingField, Integer> copy = new EnumMap<>(MappingField.class);
        if (columns != null) {
            copy.putAll(columns);
        }
        this.columns = Collections.unmodifiableMap(copy);
    }

    /**
     * Layout of the headerless Click &amp; Drop template.
     */
    public static TemplateMapping clickAndDrop() {
        EnumMap<MappingField, Integer> columns = new EnumMap<>(MappingField.class);
        columns.put(MappingField.FULL_NAME, 1);
        columns.put(MappingField.ADDRESS_LINE_1, 2);
        columns.put(MappingField.ADDRESS_LINE_2, 3);
        columns.put(MappingField.TOWN_CITY, 4);
        columns.put(MappingField.COUNTY, 5);
        columns.put(MappingField.POSTCODE, 6);
        columns.put(MappingField.COUNTRY, 7);
        columns.put(MappingField.SERVICE, 8);
        columns.put(MappingField.WEIGHT_KG, 9);
        columns.put(MappingField.REFERENCE, 10);
        return new TemplateMapping(columns);
    }

    public Optional<Integer> column(MappingField field) {
        return Optional.ofNullable(columns.get(field));
    }

    public Map<MappingField, Integer> columns() {
        return columns;
    }

    public int maxColumn() {
        return columns.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    public TemplateMapping with(MappingField field, Integer column) {
        EnumMap<MappingField, Integer> copy = new EnumMap<>(MappingField.class);
        copy.putAll(columns);
        if (column == null) {
            copy.remove(field);
        } else {
            copy.put(field, column);
        }
        return new TemplateMapping(copy);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TemplateMapping mapping && mapping.columns.equals(columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "TemplateMapping" + columns;
    }
}
