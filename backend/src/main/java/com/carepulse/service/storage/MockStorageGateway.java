package com.carepulse.service.storage;

import com.carepulse.config.ClinicProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Local stand-in for the object store. Issues URLs under the configured base URL
 * and stores nothing.
 */
@Component
@Slf4j
public class MockStorageGateway implements StorageGateway {

    private final ClinicProperties properties;
    private final Clock clock;

    public MockStorageGateway(ClinicProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public PresignedUrl createUploadUrl(String storageKey, String fileId, String contentType, Duration ttl) {
        String url = baseUrl() + "/mock-upload/" + fileId;
        log.info("Mock upload URL issued for {} ({}): {}", storageKey, contentType, url);
        return new PresignedUrl(url, Instant.now(clock).plus(ttl));
    }

    @Override
    public PresignedUrl createDownloadUrl(String storageKey, String fileName, Duration ttl) {
        String url = baseUrl() + "/mock-download/" + StorageKeys.fileIdOf(storageKey);
        log.info("Mock download URL issued for {} ({}): {}", storageKey, fileName, url);
        return new PresignedUrl(url, Instant.now(clock).plus(ttl));
    }

    @Override
    public void delete(String storageKey) {
        log.info("Mock delete of {}", storageKey);
    }

    private String baseUrl() {
        String base = properties.getStorage().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
