package com.carepulse.service.storage;

import java.time.Duration;

/**
 * Object store seam for document files. The backend never streams file bytes
 * itself; clients upload and download through the URLs issued here.
 */
public interface StorageGateway {

    /**
     * Issue a URL the client can PUT the file to.
     */
    PresignedUrl createUploadUrl(String storageKey, String fileId, String contentType, Duration ttl);

    /**
     * Issue a URL the client can GET the file from.
     */
    PresignedUrl createDownloadUrl(String storageKey, String fileName, Duration ttl);

    /**
     * Remove the stored object. Removing a key that does not exist is not an error.
     */
    void delete(String storageKey);
}
