package com.carepulse.dto.response;

import java.util.Map;

/**
 * Response DTO for appointment counts per status.
 */
public record AppointmentStatsDto(
    long totalAppointments,
    Map<String, Long> byStatus
) {}
