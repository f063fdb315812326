package com.carepulse.model.document;

import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.DocumentCategory;
import com.carepulse.model.scheduling.Appointment;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * First phase of a document upload: an upload handle was handed out but the
 * client has not confirmed the upload yet. Rows past {@code expiresAt} are
 * removed by the pending upload reaper and can no longer be confirmed.
 */
@Entity
@Table(name = "pending_upload", indexes = {
    @Index(name = "idx_pending_upload_key", columnList = "storage_key", unique = true),
    @Index(name = "idx_pending_upload_expiry", columnList = "expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingUpload {

    /**
     * File id handed out with the upload URL.
     */
    @Id
    @Column(name = "file_id", length = 64)
    private String fileId;

    @Column(name = "storage_key", nullable = false, length = 500)
    private String storageKey;

    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @Column(name = "file_type", nullable = false, length = 100)
    private String fileType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "patient_id", nullable = false, length = 64)
    private String patientId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_pending_upload_patient"))
    private Patient patient;

    @Column(name = "appointment_id", length = 64)
    private String appointmentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id", insertable = false, updatable = false,
        foreignKey = @ForeignKey(name = "fk_pending_upload_appointment"))
    private Appointment appointment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private DocumentCategory category;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "requested_by", nullable = false, length = 64)
    private String requestedBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
