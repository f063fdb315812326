package com.carepulse.dto.response;

import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.AppointmentType;
import com.carepulse.model.scheduling.Appointment;

import java.time.LocalDateTime;

/**
 * Response DTO for an appointment. {@code duration} is the ISO-8601 form, e.g. {@code PT1H30M}.
 */
public record AppointmentDto(
    String id,
    String patientId,
    String doctorId,
    AppointmentType type,
    AppointmentStatus status,
    LocalDateTime scheduledDateTime,
    LocalDateTime endDateTime,
    int durationMinutes,
    String duration,
    String durationDisplay,
    String reasonForVisit,
    String notes,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static AppointmentDto fromEntity(Appointment appointment) {
        return new AppointmentDto(
            appointment.getId(),
            appointment.getPatientId(),
            appointment.getDoctorId(),
            appointment.getType(),
            appointment.getStatus(),
            appointment.getScheduledAt(),
            appointment.getEndTime(),
            appointment.getDuration().getMinutes(),
            appointment.getDuration().formatForApi(),
            appointment.getDuration().formatForDisplay(),
            appointment.getReasonForVisit(),
            appointment.getNotes(),
            appointment.getCreatedAt(),
            appointment.getUpdatedAt()
        );
    }
}
