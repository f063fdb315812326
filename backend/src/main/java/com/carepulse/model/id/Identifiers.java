package com.carepulse.model.id;

import com.carepulse.exception.InvalidFormatException;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Shared generation and validation for prefixed entity identifiers.
 * Every identifier has the shape {@code <prefix>_<suffix>} where the suffix
 * is made of letters, digits and underscores.
 */
final class Identifiers {

    static final int SUFFIX_LENGTH = 8;

    private static final char[] ALPHABET =
        "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_".toCharArray();

    private static final SecureRandom RANDOM = new SecureRandom();

    private Identifiers() {
    }

    static String generate(String prefix) {
        StringBuilder sb = new StringBuilder(prefix.length() + 1 + SUFFIX_LENGTH);
        sb.append(prefix).append('_');
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(ALPHABET[RANDOM.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }

    /**
     * Validate a raw identifier, or generate a new one when {@code raw} is null or empty.
     */
    static String createOrValidate(String raw, String prefix, Pattern pattern, String typeName) {
        if (raw == null || raw.isEmpty()) {
            return generate(prefix);
        }
        return validate(raw, prefix, pattern, typeName);
    }

    static String validate(String raw, String prefix, Pattern pattern, String typeName) {
        if (raw == null || !pattern.matcher(raw).matches()) {
            throw new InvalidFormatException(
                "Invalid " + typeName + " format (expected: " + prefix + "_<alphanumeric>)");
        }
        return raw;
    }

    static Pattern patternFor(String prefix) {
        return Pattern.compile("^" + prefix + "_[a-zA-Z0-9_]+$");
    }
}
