package com.carepulse.model.enums;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Appointment lifecycle status.
 *
 * <pre>
 * SCHEDULED   -> IN_PROGRESS, CANCELLED
 * IN_PROGRESS -> COMPLETED, CANCELLED
 * COMPLETED, CANCELLED, NO_SHOW are terminal
 * </pre>
 *
 * This is a lookup table only. Persisted status changes go through
 * {@code AppointmentService.transitionStatus}, which consults it.
 */
public enum AppointmentStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Map<AppointmentStatus, Set<AppointmentStatus>> TRANSITIONS =
        new EnumMap<>(AppointmentStatus.class);

    static {
        TRANSITIONS.put(SCHEDULED, Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS, CANCELLED)));
        TRANSITIONS.put(IN_PROGRESS, Collections.unmodifiableSet(EnumSet.of(COMPLETED, CANCELLED)));
        TRANSITIONS.put(COMPLETED, Collections.emptySet());
        TRANSITIONS.put(CANCELLED, Collections.emptySet());
        TRANSITIONS.put(NO_SHOW, Collections.emptySet());
    }

    /**
     * Check whether moving from this status to {@code target} is allowed.
     */
    public boolean canTransitionTo(AppointmentStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    /**
     * Null-safe form of {@link #canTransitionTo}. Returns false for any pair
     * the table does not list, including unknown (null) values.
     */
    public static boolean canTransition(AppointmentStatus current, AppointmentStatus target) {
        return current != null && current.canTransitionTo(target);
    }

    public Set<AppointmentStatus> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public static AppointmentStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AppointmentStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown AppointmentStatus: " + value);
    }
}
