package com.carepulse.model.document;

import com.carepulse.model.AuditableEntity;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.DocumentCategory;
import com.carepulse.model.scheduling.Appointment;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Metadata of a file held by the storage gateway.
 */
@Entity
@Table(name = "document", indexes = {
    @Index(name = "idx_document_patient", columnList = "patient_id"),
    @Index(name = "idx_document_appointment", columnList = "appointment_id"),
    @Index(name = "idx_document_uploader", columnList = "uploaded_by")
})
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Document extends AuditableEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    /**
     * MIME type.
     */
    @Column(name = "file_type", nullable = false, length = 100)
    private String fileType;

    /**
     * Size in bytes.
     */
    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "storage_key", nullable = false, length = 500)
    private String storageKey;

    @Column(name = "uploaded_by", nullable = false, length = 64)
    private String uploadedBy;

    @Column(name = "patient_id", nullable = false, length = 64)
    private String patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_document_patient"))
    private Patient patient;

    @Column(name = "doctor_id", length = 64)
    private String doctorId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_document_doctor"))
    private Doctor doctor;

    @Column(name = "appointment_id", length = 64)
    private String appointmentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_document_appointment"))
    private Appointment appointment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DocumentCategory category;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "shared_with_patient", nullable = false)
    private boolean sharedWithPatient;
}
