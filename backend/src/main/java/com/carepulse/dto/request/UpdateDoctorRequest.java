package com.carepulse.dto.request;

import jakarta.validation.constraints.Size;

public record UpdateDoctorRequest(
    @Size(min = 1, max = 50)
    String firstName,

    @Size(min = 1, max = 50)
    String lastName,

    String email,

    @Size(max = 100)
    String specialization,

    Boolean active
) {}
