package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * Document identifier, {@code doc_<alphanumeric>}.
 */
public record DocumentId(String value) {

    public static final String PREFIX = "doc";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public DocumentId {
        Identifiers.validate(value, PREFIX, PATTERN, "DocumentId");
    }

    /**
     * Generate a new random identifier.
     */
    public static DocumentId create() {
        return new DocumentId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static DocumentId create(String raw) {
        return new DocumentId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "DocumentId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
