package com.labelops.core.parse;

import com.labelops.config.MappingField;

/**
 * One shipment recipient as parsed from a text block. Instances are immutable; corrections and
 * service selection return modified copies.
 *
 * @param aiFlagged whether the AI step produced suggestions for this record
 */
public record AddressRecord(String fullName,
                            String addressLine1,
                            String addressLine2,
                            String townCity,
                            String county,
                            String postcode,
                            String country,
                            String service,
                            Double weightKg,
                            String reference,
                            String phone,
                            String email,
                            String notes,
                            boolean aiFlagged) {

    public AddressRecord {
        fullName = normalize(fullName);
        addressLine1 = normalize(addressLine1);
        addressLine2 = normalize(addressLine2);
        townCity = normalize(townCity);
        county = normalize(county);
        postcode = normalize(postcode);
        country = normalize(country);
        service = normalize(service);
        reference = normalize(reference);
        phone = normalize(phone);
        email = normalize(email);
        notes = normalize(notes);
    }

    /**
     * Text value of a mapped field; weight is rendered as a plain number.
     */
    public String value(MappingField field) {
        return switch (field) {
            case FULL_NAME -> fullName;
            case ADDRESS_LINE_1 -> addressLine1;
            case ADDRESS_LINE_2 -> addressLine2;
            case TOWN_CITY -> townCity;
            case COUNTY -> county;
            case POSTCODE -> postcode;
            case COUNTRY -> country;
            case SERVICE -> service;
            case WEIGHT_KG -> weightKg == null ? "" : String.valueOf(weightKg);
            case REFERENCE -> reference;
            case PHONE -> phone;
            case EMAIL -> email;
        };
    }

    /**
     * Copy with one text field replaced. Weight is not a text field and cannot be changed here.
     */
    public AddressRecord with(MappingField field, String value) {
        return switch (field) {
            case FULL_NAME -> new AddressRecord(value, addressLine1, addressLine2, townCity, county, postcode,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case ADDRESS_LINE_1 -> new AddressRecord(fullName, value, addressLine2, townCity, county, postcode,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case ADDRESS_LINE_2 -> new AddressRecord(fullName, addressLine1, value, townCity, county, postcode,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case TOWN_CITY -> new AddressRecord(fullName, addressLine1, addressLine2, value, county, postcode,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case COUNTY -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, value, postcode,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case POSTCODE -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, value,
                country, service, weightKg, reference, phone, email, notes, aiFlagged);
            case COUNTRY -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
                value, service, weightKg, reference, phone, email, notes, aiFlagged);
            case SERVICE -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
                country, value, weightKg, reference, phone, email, notes, aiFlagged);
            case REFERENCE -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
                country, service, weightKg, value, phone, email, notes, aiFlagged);
            case PHONE -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
                country, service, weightKg, reference, value, email, notes, aiFlagged);
            case EMAIL -> new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
                country, service, weightKg, reference, phone, value, notes, aiFlagged);
            case WEIGHT_KG -> throw new IllegalArgumentException("weight_kg is numeric; use withWeight");
        };
    }

    public AddressRecord withWeight(Double weight) {
        return new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
            country, service, weight, reference, phone, email, notes, aiFlagged);
    }

    public AddressRecord withNote(String note) {
        if (note == null || note.isBlank()) {
            return this;
        }
        String combined = notes.isEmpty() ? note.trim() : notes + "; " + note.trim();
        return new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
            country, service, weightKg, reference, phone, email, combined, aiFlagged);
    }

    public AddressRecord withAiFlag(boolean flagged) {
        return new AddressRecord(fullName, addressLine1, addressLine2, townCity, county, postcode,
            country, service, weightKg, reference, phone, email, notes, flagged);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
