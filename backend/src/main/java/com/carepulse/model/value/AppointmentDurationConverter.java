package com.carepulse.model.value;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores an {@link AppointmentDuration} as integer minutes.
 */
@Converter
public class AppointmentDurationConverter implements AttributeConverter<AppointmentDuration, Integer> {

    @Override
    public Integer convertToDatabaseColumn(AppointmentDuration attribute) {
        return attribute != null ? attribute.getMinutes() : null;
    }

    @Override
    public AppointmentDuration convertToEntityAttribute(Integer dbData) {
        return dbData != null ? AppointmentDuration.ofMinutes(dbData) : null;
    }
}
