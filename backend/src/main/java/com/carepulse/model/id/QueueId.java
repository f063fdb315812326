package com.carepulse.model.id;

import java.util.regex.Pattern;

/**
 * Check-in queue ticket identifier, {@code queue_<alphanumeric>}.
 */
public record QueueId(String value) {

    public static final String PREFIX = "queue";

    private static final Pattern PATTERN = Identifiers.patternFor(PREFIX);

    public QueueId {
        Identifiers.validate(value, PREFIX, PATTERN, "QueueId");
    }

    /**
     * Generate a new random identifier.
     */
    public static QueueId create() {
        return new QueueId(Identifiers.generate(PREFIX));
    }

    /**
     * Validate an existing identifier; a null or empty input generates a new one.
     *
     * @throws com.carepulse.exception.InvalidFormatException if {@code raw} is malformed
     */
    public static QueueId create(String raw) {
        return new QueueId(Identifiers.createOrValidate(raw, PREFIX, PATTERN, "QueueId"));
    }

    @Override
    public String toString() {
        return value;
    }
}
