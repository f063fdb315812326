package com.carepulse.exception;

import lombok.Getter;

/**
 * Appointment duration rejected by the clinic scheduling rules.
 */
@Getter
public class DurationOutOfRangeException extends RangeException {

    public enum Kind {
        TOO_SHORT,
        TOO_LONG,
        BAD_INCREMENT
    }

    private final Kind kind;
    private final int minutes;

    public DurationOutOfRangeException(Kind kind, int minutes, String message) {
        super(message);
        this.kind = kind;
        this.minutes = minutes;
    }
}
