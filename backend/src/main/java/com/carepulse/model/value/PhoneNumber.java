package com.carepulse.model.value;

import com.carepulse.exception.InvalidFormatException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Singapore mobile phone number.
 * <p>
 * Accepts an optional {@code +65} prefix and spaces or hyphens between the digit
 * groups. The number is stored as its 8 local digits; that normalized form is
 * what {@link #getValue()} returns and what gets persisted.
 */
public final class PhoneNumber {

    private static final Pattern SINGAPORE_MOBILE =
        Pattern.compile("^(?:\\+65[\\s-]?)?[689]\\d{3}[\\s-]?\\d{4}$");
    private static final Pattern COUNTRY_PREFIX = Pattern.compile("^\\+65[\\s-]?");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]");

    private final String normalizedValue;

    private PhoneNumber(String normalizedValue) {
        this.normalizedValue = normalizedValue;
    }

    /**
     * Parse and normalize a phone number.
     *
     * @throws InvalidFormatException if the input is not an SMS-capable Singapore number
     */
    public static PhoneNumber of(String input) {
        if (input == null || !SINGAPORE_MOBILE.matcher(input).matches()) {
            throw new InvalidFormatException(
                "Invalid Singapore phone number: \"" + input + "\". "
                    + "Expected format: +65 XXXX XXXX (mobile numbers starting with 6, 8, or 9)");
        }

        String normalized = normalize(input);
        if (!isMobileNumber(normalized)) {
            throw new InvalidFormatException(
                "Phone number " + input + " is not SMS-capable. Only mobile numbers (6, 8, 9) are allowed.");
        }
        return new PhoneNumber(normalized);
    }

    private static String normalize(String input) {
        String withoutCountry = COUNTRY_PREFIX.matcher(input).replaceFirst("");
        return SEPARATORS.matcher(withoutCountry).replaceAll("");
    }

    private static boolean isMobileNumber(String normalized) {
        char first = normalized.charAt(0);
        return first == '6' || first == '8' || first == '9';
    }

    /**
     * The 8 local digits without country code, e.g. {@code 91234567}.
     */
    public String getValue() {
        return normalizedValue;
    }

    /**
     * {@code +65 9123 4567}
     */
    public String formatForDisplay() {
        return "+65 " + normalizedValue.substring(0, 4) + " " + normalizedValue.substring(4);
    }

    /**
     * E.164 form for the SMS gateway, {@code +6591234567}.
     */
    public String formatForSms() {
        return "+65" + normalizedValue;
    }

    public boolean canReceiveSms() {
        return isMobileNumber(normalizedValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PhoneNumber other)) {
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
