package com.carepulse.model.enums;

public enum UserRole {
    PATIENT,
    DOCTOR,
    STAFF
}
