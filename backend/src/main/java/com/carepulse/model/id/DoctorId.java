package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * Doctor identifier, {@code doctor_<alphanumeric>}.
 */
public record DoctorId(String value) {

    public static final String PREFIX = "doctor";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public DoctorId {
        Identifiers.validate(value, PREFIX, PATTERN, "DoctorId");
    }

    /**
     * Generate a new random identifier.
     */
    public static DoctorId create() {
        return new DoctorId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static DoctorId create(String raw) {
        return new DoctorId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "DoctorId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
