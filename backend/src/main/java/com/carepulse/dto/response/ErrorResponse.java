package com.carepulse.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every endpoint: {@code {"error": ..., "message": ...}}.
 * {@code fieldErrors} is only present for request validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    Map<String, String> fieldErrors
) {

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }
}
