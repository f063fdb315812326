package com.carepulse.exception;

/**
 * The request is well-formed but clashes with the current state of stored data
 * (double booking, deleting a referenced record, duplicate check-in).
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
