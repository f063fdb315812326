package com.carepulse.service.document;

import java.time.Instant;

/**
 * Handle returned by the first upload phase. The client PUTs the file to
 * {@code uploadUrl} and then confirms with {@code storageKey} and {@code fileId}
 * before {@code expiresAt}.
 */
public record UploadTicket(String uploadUrl, String storageKey, String fileId, Instant expiresAt) {}
