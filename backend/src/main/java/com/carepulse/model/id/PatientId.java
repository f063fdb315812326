package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * Patient identifier, {@code patient_<alphanumeric>}.
 */
public record PatientId(String value) {

    public static final String PREFIX = "patient";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public PatientId {
        Identifiers.validate(value, PREFIX, PATTERN, "PatientId");
    }

    /**
     * Generate a new random identifier.
     */
    public static PatientId create() {
        return new PatientId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static PatientId create(String raw) {
        return new PatientId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "PatientId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
