package com.carepulse.service.document;

import java.time.Instant;

public record DownloadLink(String downloadUrl, String fileName, Instant expiresAt) {}
