package com.carepulse.dto.response;

import com.carepulse.model.clinic.Patient;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Response DTO for a patient. {@code phone} is the stored 8-digit form.
 */
public record PatientDto(
    String id,
    String userId,
    String firstName,
    String lastName,
    String fullName,
    String email,
    String phone,
    String phoneDisplay,
    LocalDate dateOfBirth,
    String address,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static PatientDto fromEntity(Patient patient) {
        return new PatientDto(
            patient.getId(),
            patient.getUserId(),
            patient.getFirstName(),
            patient.getLastName(),
            patient.getFullName(),
            patient.getEmail().getValue(),
            patient.getPhone().getValue(),
            patient.getPhone().formatForDisplay(),
            patient.getDateOfBirth(),
            patient.getAddress(),
            patient.getCreatedAt(),
            patient.getUpdatedAt()
        );
    }
}
