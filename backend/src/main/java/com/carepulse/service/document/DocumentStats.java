package com.carepulse.service.document;

import com.carepulse.model.document.Document;
import com.carepulse.model.enums.DocumentCategory;

import java.util.List;
import java.util.Map;

public record DocumentStats(
    long totalDocuments,
    Map<DocumentCategory, Long> documentsByCategory,
    long totalFileSize,
    List<Document> recentDocuments
) {}
