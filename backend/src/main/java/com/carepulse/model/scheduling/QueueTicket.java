package com.carepulse.model.scheduling;

import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.QueueStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Walk-in queue ticket issued when a patient checks in for an appointment.
 * Queue numbers restart at 1 every day.
 */
@Entity
@Table(name = "queue_ticket", indexes = {
    @Index(name = "idx_queue_appointment", columnList = "appointment_id", unique = true),
    @Index(name = "idx_queue_date", columnList = "queue_date, queue_number")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueTicket {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "appointment_id", nullable = false, length = 64)
    private String appointmentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_queue_appointment"))
    private Appointment appointment;

    @Column(name = "patient_id", nullable = false, length = 64)
    private String patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_queue_patient"))
    private Patient patient;

    @Column(name = "queue_date", nullable = false)
    private LocalDate queueDate;

    @Column(name = "queue_number", nullable = false)
    private int queueNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueueStatus status;

    @Column(name = "checked_in_at", nullable = false)
    private LocalDateTime checkedInAt;
}
