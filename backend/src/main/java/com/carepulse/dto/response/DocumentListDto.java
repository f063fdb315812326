package com.carepulse.dto.response;

import java.util.List;

/**
 * Response DTO for a page of documents.
 */
public record DocumentListDto(
    List<DocumentDto> documents,
    Pagination pagination
) {

    public record Pagination(int limit, int offset, long total) {}
}
