package com.carepulse.dto.request;

import com.carepulse.model.enums.DocumentCategory;

public record UpdateDocumentRequest(
    String description,
    DocumentCategory category,
    Boolean sharedWithPatient
) {}
