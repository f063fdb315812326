package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * Request DTO for booking an appointment.
 * {@code durationMinutes} defaults to the standard length of the appointment type.
 */
public record CreateAppointmentRequest(
    @NotBlank(message = "Patient ID is required")
    String patientId,

    @NotBlank(message = "Doctor ID is required")
    String doctorId,

    @NotBlank(message = "Appointment type is required")
    String type,

    @NotNull(message = "Scheduled date/time is required")
    LocalDateTime scheduledDateTime,

    Integer durationMinutes,

    String reasonForVisit,

    String notes
) {}
