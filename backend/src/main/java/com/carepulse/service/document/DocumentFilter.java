package com.carepulse.service.document;

import com.carepulse.model.enums.DocumentCategory;

/**
 * Optional document list filters. Null components match everything.
 */
public record DocumentFilter(
    String patientId,
    String doctorId,
    String appointmentId,
    DocumentCategory category,
    Boolean shared,
    String uploadedBy
) {

    public static DocumentFilter none() {
        return new DocumentFilter(null, null, null, null, null, null);
    }
}
