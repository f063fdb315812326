package com.carepulse.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Category of an uploaded patient document.
 */
public enum DocumentCategory {
    MEDICAL_HISTORY("Medical History"),
    LAB_RESULTS("Lab Results"),
    PRESCRIPTION("Prescription"),
    IMAGING("Medical Imaging"),
    CLINICAL_NOTES("Clinical Notes"),
    CONSENT_FORM("Consent Form"),
    INSURANCE("Insurance"),
    OTHER("Other");

    private final String label;

    DocumentCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DocumentCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DocumentCategory category : values()) {
            if (category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown DocumentCategory: " + value);
    }
}
