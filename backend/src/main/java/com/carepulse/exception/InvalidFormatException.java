package com.carepulse.exception;

/**
 * Raised when an input string does not match the format a value requires
 * (identifiers, phone numbers, email addresses).
 */
public class InvalidFormatException extends IllegalArgumentException {

    public InvalidFormatException(String message) {
        super(message);
    }
}
