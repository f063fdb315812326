package com.carepulse.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.OffsetDateTime;

/**
 * Request bodies of the SMS endpoints.
 */
public final class SendSmsRequest {

    private SendSmsRequest() {
    }

    public record Raw(
        @NotNull @Size(min = 8, message = "Phone number must be at least 8 digits")
        String to,

        @NotNull @Size(min = 1, max = 1600, message = "Message must be 1-1600 characters")
        String body,

        String patientName
    ) {}

    /**
     * Reminder and confirmation share the same shape.
     */
    public record AppointmentNotice(
        @NotNull @Size(min = 8, message = "Phone number must be at least 8 digits")
        String phoneNumber,

        @NotBlank(message = "Patient name is required")
        String patientName,

        @NotNull(message = "Invalid appointment date")
        OffsetDateTime appointmentDate,

        @NotBlank(message = "Doctor name is required")
        String doctorName,

        String clinicName
    ) {}

    public record Cancellation(
        @NotNull @Size(min = 8, message = "Phone number must be at least 8 digits")
        String phoneNumber,

        @NotBlank(message = "Patient name is required")
        String patientName,

        @NotNull(message = "Invalid appointment date")
        OffsetDateTime appointmentDate,

        String reason,

        String clinicName
    ) {}

    public record Custom(
        @NotNull @Size(min = 8, message = "Phone number must be at least 8 digits")
        String phoneNumber,

        @NotNull @Size(min = 1, max = 1600, message = "Message must be 1-1600 characters")
        String message,

        String patientName
    ) {}

    public record Test(
        @NotNull @Size(min = 8, message = "Phone number must be at least 8 digits")
        String phoneNumber
    ) {}
}
