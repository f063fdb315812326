package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for adding a doctor. Without a {@code userId} a new DOCTOR account is created.
 */
public record CreateDoctorRequest(
    String userId,

    @Size(min = 8, max = 72, message = "Password must be 8-72 characters")
    String password,

    @NotBlank(message = "First name is required")
    @Size(max = 50)
    String firstName,

    @NotBlank(message = "Last name is required")
    @Size(max = 50)
    String lastName,

    @NotBlank(message = "Email is required")
    String email,

    @Size(max = 100)
    String specialization,

    Boolean active
) {}
