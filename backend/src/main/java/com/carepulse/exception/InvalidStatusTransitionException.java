package com.carepulse.exception;

import com.carepulse.model.enums.AppointmentStatus;
import lombok.Getter;

@Getter
public class InvalidStatusTransitionException extends ConflictException {

    private final AppointmentStatus from;
    private final AppointmentStatus to;

    public InvalidStatusTransitionException(AppointmentStatus from, AppointmentStatus to) {
        super("Cannot change appointment status from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }
}
