package com.carepulse.exception;

/**
 * Raised when a numeric value falls outside its allowed bounds.
 */
public class RangeException extends IllegalArgumentException {

    public RangeException(String message) {
        super(message);
    }
}
