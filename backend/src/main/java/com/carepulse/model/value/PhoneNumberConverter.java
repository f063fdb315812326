package com.carepulse.model.value;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link PhoneNumber} as its normalized 8 digits.
 */
@Converter
public class PhoneNumberConverter implements AttributeConverter<PhoneNumber, String> {

    @Override
    public String convertToDatabaseColumn(PhoneNumber attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public PhoneNumber convertToEntityAttribute(String dbData) {
        return dbData != null ? PhoneNumber.of(dbData) : null;
    }
}
