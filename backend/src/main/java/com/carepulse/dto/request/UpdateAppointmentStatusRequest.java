package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;

public record UpdateAppointmentStatusRequest(
    @NotBlank(message = "Status is required")
    String status
) {}
