package com.carepulse.scheduler;

import com.carepulse.repository.PendingUploadRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PendingUploadReaperTest {

    private static final Instant NOW = Instant.parse("2025-12-01T02:00:00Z");

    @Mock
    private PendingUploadRepository pendingUploadRepository;

    @Test
    void deletesUploadsExpiredAsOfNow() {
        when(pendingUploadRepository.deleteExpired(NOW)).thenReturn(3);
        PendingUploadReaper reaper = new PendingUploadReaper(pendingUploadRepository, Clock.fixed(NOW, ZoneOffset.UTC));

        reaper.reapExpired();

        verify(pendingUploadRepository).deleteExpired(NOW);
    }
}
