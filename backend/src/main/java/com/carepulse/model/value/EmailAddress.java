package com.carepulse.model.value;

import com.carepulse.exception.InvalidFormatException;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Email address, lower-cased and trimmed.
 * Validation is a permissive {@code local@domain.tld} check, not full RFC 5322.
 */
public final class EmailAddress {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final String normalizedValue;

    private EmailAddress(String normalizedValue) {
        this.normalizedValue = normalizedValue;
    }

    public static EmailAddress of(String input) {
        if (input == null || !EMAIL.matcher(input).matches()) {
            throw new InvalidFormatException(
                "Invalid email format: \"" + input + "\". Expected format: user@domain.com");
        }
        return new EmailAddress(input.toLowerCase(Locale.ROOT).trim());
    }

    public String getValue() {
        return normalizedValue;
    }

    public String getDomain() {
        int at = normalizedValue.indexOf('@');
        return normalizedValue.substring(at + 1);
    }

    public String getUsername() {
        int at = normalizedValue.indexOf('@');
        return normalizedValue.substring(0, at);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmailAddress other)) {
            return false;
        }
        return normalizedValue.equals(other.normalizedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedValue);
    }

    @Override
    public String toString() {
        return normalizedValue;
    }
}
