package com.carepulse.dto.response;

import java.util.List;

public record PatientListDto(
    List<PatientDto> patients,
    long total,
    int limit,
    int offset
) {}
