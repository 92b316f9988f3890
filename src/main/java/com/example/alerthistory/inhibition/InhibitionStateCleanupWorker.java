package com.example.alerthistory.inhibition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class InhibitionStateCleanupWorker {

    private final InhibitionStateTracker stateTracker;

    @Scheduled(fixedDelayString = "#{${alert-history.inhibition.cleanup-interval-seconds:60} * 1000}",
            initialDelayString = "#{${alert-history.inhibition.cleanup-interval-seconds:60} * 1000}")
    public void cleanup() {
        try {
            stateTracker.cleanupExpired();
        } catch (RuntimeException e) {
            log.error("Inhibition state cleanup failed: {}", e.getMessage(), e);
        }
    }
}
