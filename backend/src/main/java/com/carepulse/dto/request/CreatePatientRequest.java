package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Request DTO for registering a patient.
 * Without a {@code userId} a new PATIENT account is created; {@code password}
 * is optional and only used for that new account.
 */
public record CreatePatientRequest(
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

    @NotBlank(message = "Phone is required")
    String phone,

    @NotNull(message = "Date of birth is required")
    @PastOrPresent(message = "Date of birth cannot be in the future")
    LocalDate dateOfBirth,

    String address
) {}
