package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Second phase of a document upload. Metadata comes from the pending upload;
 * only the sharing flag and description may be supplied here.
 */
public record ConfirmUploadRequest(
    @NotBlank(message = "Storage key is required")
    String storageKey,

    @NotBlank(message = "File ID is required")
    String fileId,

    String description,

    Boolean sharedWithPatient
) {}
