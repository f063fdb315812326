package com.carepulse.dto.request;

import java.time.LocalDateTime;

/**
 * Partial update of an appointment. Patient and doctor cannot be changed.
 * A {@code status} is applied through the status transition rules.
 */
public record UpdateAppointmentRequest(
    String type,
    LocalDateTime scheduledDateTime,
    Integer durationMinutes,
    String reasonForVisit,
    String notes,
    String status
) {}
