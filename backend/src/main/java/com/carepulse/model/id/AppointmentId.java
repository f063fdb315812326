package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * Appointment identifier, {@code appt_<alphanumeric>}.
 */
public record AppointmentId(String value) {

    public static final String PREFIX = "appt";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public AppointmentId {
        Identifiers.validate(value, PREFIX, PATTERN, "AppointmentId");
    }

    /**
     * Generate a new random identifier.
     */
    public static AppointmentId create() {
        return new AppointmentId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static AppointmentId create(String raw) {
        return new AppointmentId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "AppointmentId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
