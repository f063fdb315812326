package com.carepulse.model.enums;

/**
 * Kind of visit. Each type has a default appointment length,
 * see {@code AppointmentDuration.forAppointmentType}.
 */
public enum AppointmentType {
    FIRST_CONSULT,
    CHECK_UP,
    FOLLOW_UP;

    public static AppointmentType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AppointmentType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown AppointmentType: " + value);
    }
}
