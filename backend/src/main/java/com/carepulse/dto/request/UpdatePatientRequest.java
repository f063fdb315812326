package com.carepulse.dto.request;

import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Partial update of a patient. Null fields are left unchanged.
 */
public record UpdatePatientRequest(
    @Size(min = 1, max = 50)
    String firstName,

    @Size(min = 1, max = 50)
    String lastName,

    String email,

    String phone,

    @PastOrPresent(message = "Date of birth cannot be in the future")
    LocalDate dateOfBirth,

    String address
) {}
