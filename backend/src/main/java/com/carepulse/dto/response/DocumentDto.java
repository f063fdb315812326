package com.carepulse.dto.response;

import com.carepulse.model.document.Document;
import com.carepulse.model.enums.DocumentCategory;

import java.time.LocalDateTime;

public record DocumentDto(
    String id,
    String fileName,
    String fileType,
    long fileSize,
    String storageKey,
    String uploadedBy,
    String patientId,
    String doctorId,
    String appointmentId,
    DocumentCategory category,
    String categoryLabel,
    String description,
    boolean sharedWithPatient,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static DocumentDto fromEntity(Document document) {
        return new DocumentDto(
            document.getId(),
            document.getFileName(),
            document.getFileType(),
            document.getFileSize(),
            document.getStorageKey(),
            document.getUploadedBy(),
            document.getPatientId(),
            document.getDoctorId(),
            document.getAppointmentId(),
            document.getCategory(),
            document.getCategory().getLabel(),
            document.getDescription(),
            document.isSharedWithPatient(),
            document.getCreatedAt(),
            document.getUpdatedAt()
        );
    }
}
