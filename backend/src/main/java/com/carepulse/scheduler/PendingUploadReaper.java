package com.carepulse.scheduler;

import com.carepulse.repository.PendingUploadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes pending uploads that were never confirmed before they expired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingUploadReaper {

    private final PendingUploadRepository pendingUploadRepository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${carepulse.storage.reaper-interval:PT5M}",
               initialDelayString = "${carepulse.storage.reaper-interval:PT5M}")
    @Transactional
    public void reapExpired() {
        int removed = pendingUploadRepository.deleteExpired(Instant.now(clock));
        if (removed > 0) {
            log.info("Removed {} expired pending uploads", removed);
        }
    }
}
