package com.carepulse.service.storage;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class StorageKeysTest {

    @Test
    void keyIsGroupedByPatientAndDay() {
        String key = StorageKeys.forDocument("patient_p1", LocalDate.of(2025, 12, 1), "doc_abc", "x-ray.final.png");

        assertThat(key).isEqualTo("documents/patient_p1/2025-12-01/doc_abc.png");
    }

    @Test
    void nameWithoutExtensionKeepsBareFileId() {
        assertThat(StorageKeys.forDocument("patient_p1", LocalDate.of(2025, 1, 5), "doc_abc", "README"))
            .isEqualTo("documents/patient_p1/2025-01-05/doc_abc");
        assertThat(StorageKeys.extensionOf(null)).isEmpty();
    }

    @Test
    void fileIdIsRecoveredFromKey() {
        assertThat(StorageKeys.fileIdOf("documents/patient_p1/2025-12-01/doc_abc.pdf")).isEqualTo("doc_abc");
        assertThat(StorageKeys.fileIdOf("doc_abc")).isEqualTo("doc_abc");
    }
}
