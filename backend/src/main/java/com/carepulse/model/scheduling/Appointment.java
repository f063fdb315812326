package com.carepulse.model.scheduling;

import com.carepulse.model.AuditableEntity;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.AppointmentType;
import com.carepulse.model.value.AppointmentDuration;
import com.carepulse.model.value.AppointmentDurationConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Booked visit of a patient with a doctor.
 * Status is changed only through the appointment service, which checks
 * {@link AppointmentStatus#canTransitionTo}.
 */
@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_doctor_time", columnList = "doctor_id, scheduled_at"),
    @Index(name = "idx_appointment_patient", columnList = "patient_id"),
    @Index(name = "idx_appointment_status", columnList = "status")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Appointment extends AuditableEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "patient_id", nullable = false, length = 64)
    private String patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_appointment_patient"))
    private Patient patient;

    @Column(name = "doctor_id", nullable = false, length = 64)
    private String doctorId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_appointment_doctor"))
    private Doctor doctor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AppointmentStatus status;

    /**
     * Clinic-local start time.
     */
    @Column(name = "scheduled_at", nullable = false)
    private LocalDateTime scheduledAt;

    @Convert(converter = AppointmentDurationConverter.class)
    @Column(name = "duration_minutes", nullable = false)
    private AppointmentDuration duration;

    @Column(name = "reason_for_visit", columnDefinition = "TEXT")
    private String reasonForVisit;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public LocalDateTime getEndTime() {
        return duration.calculateEndTime(scheduledAt);
    }

    public boolean isOn(LocalDate date) {
        return scheduledAt.toLocalDate().equals(date);
    }

    public boolean overlaps(LocalDateTime start, LocalDateTime end) {
        return scheduledAt.isBefore(end) && getEndTime().isAfter(start);
    }
}
