package com.carepulse.dto.response;

import com.carepulse.service.document.DocumentStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DocumentStatsDto(
    long totalDocuments,
    Map<String, Long> documentsByCategory,
    long totalFileSize,
    List<DocumentDto> recentDocuments
) {

    public static DocumentStatsDto from(DocumentStats stats) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        stats.documentsByCategory().forEach((category, count) -> byCategory.put(category.name(), count));
        return new DocumentStatsDto(
            stats.totalDocuments(),
            byCategory,
            stats.totalFileSize(),
            stats.recentDocuments().stream().map(DocumentDto::fromEntity).toList()
        );
    }
}
