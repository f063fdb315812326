package com.carepulse.service.storage;

import java.time.Instant;

/**
 * Time-limited URL handed to the client for a direct upload or download.
 */
public record PresignedUrl(String url, Instant expiresAt) {}
