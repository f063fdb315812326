package com.carepulse.model.value;

import com.carepulse.exception.DurationOutOfRangeException;
import com.carepulse.exception.DurationOutOfRangeException.Kind;
import com.carepulse.model.enums.AppointmentType;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Length of an appointment in minutes.
 * <p>
 * Always between {@value #MIN_MINUTES} and {@value #MAX_MINUTES} inclusive and a
 * multiple of {@value #INCREMENT_MINUTES}.
 */
public final class AppointmentDuration implements Comparable<AppointmentDuration> {

    public static final int MIN_MINUTES = 30;
    public static final int MAX_MINUTES = 90;
    public static final int INCREMENT_MINUTES = 15;

    /** Clinic opening hour, local time. */
    public static final int OPENING_HOUR = 9;
    /** Clinic closing hour, local time. */
    public static final int CLOSING_HOUR = 18;

    private final int minutes;

    private AppointmentDuration(int minutes) {
        this.minutes = minutes;
    }

    /**
     * @throws DurationOutOfRangeException if the minutes are out of bounds or not a 15-minute step.
     *         Bounds are checked before the increment; only the first failure is reported.
     */
    public static AppointmentDuration ofMinutes(int minutes) {
        if (minutes < MIN_MINUTES) {
            throw new DurationOutOfRangeException(Kind.TOO_SHORT, minutes,
                "Appointment duration too short: " + minutes + " minutes. Minimum is " + MIN_MINUTES + " minutes.");
        }
        if (minutes > MAX_MINUTES) {
            throw new DurationOutOfRangeException(Kind.TOO_LONG, minutes,
                "Appointment duration too long: " + minutes + " minutes. Maximum is " + MAX_MINUTES + " minutes.");
        }
        if (minutes % INCREMENT_MINUTES != 0) {
            throw new DurationOutOfRangeException(Kind.BAD_INCREMENT, minutes,
                "Appointment duration must be in " + INCREMENT_MINUTES + "-minute increments. Got: "
                    + minutes + " minutes.");
        }
        return new AppointmentDuration(minutes);
    }

    public static AppointmentDuration standard() {
        return new AppointmentDuration(60);
    }

    public static AppointmentDuration consultation() {
        return new AppointmentDuration(90);
    }

    public static AppointmentDuration checkup() {
        return new AppointmentDuration(30);
    }

    public static AppointmentDuration followUp() {
        return new AppointmentDuration(30);
    }

    /**
     * Default length for a visit type. Unknown (null) types get the standard hour.
     */
    public static AppointmentDuration forAppointmentType(AppointmentType type) {
        if (type == null) {
            return standard();
        }
        return switch (type) {
            case FIRST_CONSULT -> consultation();
            case CHECK_UP -> checkup();
            case FOLLOW_UP -> followUp();
        };
    }

    public int getMinutes() {
        return minutes;
    }

    public double getHours() {
        return minutes / 60.0;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }

    public LocalDateTime calculateEndTime(LocalDateTime start) {
        return start.plusMinutes(minutes);
    }

    /**
     * Whether an appointment starting at {@code start} lies within opening hours.
     * Compares hours only: a 17:30 start with a 30 minute length ends at 18:00 and fits,
     * 17:45 ending 18:15 also fits since the end hour is still 18.
     * A slot running past midnight never fits.
     */
    public boolean fitsInOperatingHours(LocalDateTime start) {
        LocalDateTime end = calculateEndTime(start);
        return end.toLocalDate().equals(start.toLocalDate())
            && start.getHour() >= OPENING_HOUR
            && end.getHour() <= CLOSING_HOUR;
    }

    public boolean isLongerThan(AppointmentDuration other) {
        return minutes > other.minutes;
    }

    public AppointmentDuration addMinutes(int additionalMinutes) {
        return ofMinutes(minutes + additionalMinutes);
    }

    public String formatForDisplay() {
        if (minutes < 60) {
            return minutes + " minutes";
        }
        if (minutes == 60) {
            return "1 hour";
        }
        if (minutes % 60 == 0) {
            return (minutes / 60) + " hours";
        }
        int hours = minutes / 60;
        int remaining = minutes % 60;
        return hours + " hour" + (hours > 1 ? "s" : "") + " " + remaining + " minutes";
    }

    /**
     * ISO-8601 style duration, e.g. {@code PT1H30M}.
     */
    public String formatForApi() {
        return "PT" + (minutes / 60) + "H" + (minutes % 60) + "M";
    }

    @Override
    public int compareTo(AppointmentDuration other) {
        return Integer.compare(minutes, other.minutes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AppointmentDuration other && minutes == other.minutes;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(minutes);
    }

    @Override
    public String toString() {
        return Integer.toString(minutes);
    }
}
