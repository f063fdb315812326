package com.carepulse.model.value;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class EmailAddressConverter implements AttributeConverter<EmailAddress, String> {

    @Override
    public String convertToDatabaseColumn(EmailAddress attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public EmailAddress convertToEntityAttribute(String dbData) {
        return dbData != null ? EmailAddress.of(dbData) : null;
    }
}
