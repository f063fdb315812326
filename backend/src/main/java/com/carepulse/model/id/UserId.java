package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * User account identifier, {@code user_<alphanumeric>}.
 */
public record UserId(String value) {

    public static final String PREFIX = "user";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public UserId {
        Identifiers.validate(value, PREFIX, PATTERN, "UserId");
    }

    /**
     * Generate a new random identifier.
     */
    public static UserId create() {
        return new UserId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static UserId create(String raw) {
        return new UserId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "UserId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
