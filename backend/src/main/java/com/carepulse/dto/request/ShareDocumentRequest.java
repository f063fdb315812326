package com.carepulse.dto.request;

import jakarta.validation.constraints.NotNull;

public record ShareDocumentRequest(
    @NotNull(message = "sharedWithPatient is required")
    Boolean sharedWithPatient
) {}
