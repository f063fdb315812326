package com.carepulse.dto.response;

import com.carepulse.model.clinic.Doctor;

import java.time.LocalDateTime;

public record DoctorDto(
    String id,
    String userId,
    String firstName,
    String lastName,
    String displayName,
    String email,
    String specialization,
    boolean active,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {

    public static DoctorDto fromEntity(Doctor doctor) {
        return new DoctorDto(
            doctor.getId(),
            doctor.getUserId(),
            doctor.getFirstName(),
            doctor.getLastName(),
            doctor.getDisplayName(),
            doctor.getEmail().getValue(),
            doctor.getSpecialization(),
            doctor.isActive(),
            doctor.getCreatedAt(),
            doctor.getUpdatedAt()
        );
    }
}
