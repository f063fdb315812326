package com.carepulse.dto.request;

import com.carepulse.model.enums.DocumentCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * First phase of a document upload.
 */
public record UploadUrlRequest(
    @NotBlank(message = "File name is required")
    @Size(max = 255, message = "File name too long")
    String fileName,

    @NotBlank(message = "File type is required")
    String fileType,

    @NotNull(message = "File size is required")
    @Positive(message = "File size must be positive")
    Long fileSize,

    @NotBlank(message = "Patient ID is required")
    String patientId,

    @NotNull(message = "Invalid document category")
    DocumentCategory category,

    String appointmentId,

    String description
) {}
