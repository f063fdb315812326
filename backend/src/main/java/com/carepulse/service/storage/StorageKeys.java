package com.carepulse.service.storage;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Storage key layout: {@code documents/<patientId>/<yyyy-MM-dd>/<fileId><ext>}.
 */
public final class StorageKeys {

    private static final String ROOT = "documents";

    private StorageKeys() {
    }

    public static String forDocument(String patientId, LocalDate date, String fileId, String fileName) {
        return ROOT + "/" + patientId + "/" + date.format(DateTimeFormatter.ISO_LOCAL_DATE)
            + "/" + fileId + extensionOf(fileName);
    }

    /**
     * Extension including the dot, or an empty string when the name has none.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot);
    }

    /**
     * File id encoded in the last path segment of a key.
     */
    public static String fileIdOf(String storageKey) {
        String last = storageKey.substring(storageKey.lastIndexOf('/') + 1);
        int dot = last.indexOf('.');
        return dot < 0 ? last : last.substring(0, dot);
    }
}
