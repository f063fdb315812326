package com.carepulse.security;

import com.carepulse.model.enums.UserRole;

/**
 * Authenticated caller as seen by the services.
 *
 * @param id          user account id
 * @param role        clinic role
 * @param email       normalized email
 * @param phoneNumber normalized phone digits, may be null
 */
public record ClinicPrincipal(String id, UserRole role, String email, String phoneNumber) {

    public boolean isPatient() {
        return role == UserRole.PATIENT;
    }

    public boolean isDoctor() {
        return role == UserRole.DOCTOR;
    }

    public boolean isStaff() {
        return role == UserRole.STAFF;
    }
}
