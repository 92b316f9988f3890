package com.example.alerthistory.silencing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the silence snapshot aligned with the store: loads it once the application is ready and
 * rebuilds it periodically to prune expired silences and pick up writes from other instances.
 * A failed sync keeps the previous snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SilenceSyncWorker {

    private final SilenceService silenceService;

    @EventListener(ApplicationReadyEvent.class)
    public void initialLoad() {
        sync();
    }

    @Scheduled(fixedDelayString = "${alert-history.silences.sync-interval-seconds:60}000",
            initialDelayString = "${alert-history.silences.sync-interval-seconds:60}000")
    public void sync() {
        try {
            if (!silenceService.syncCache()) {
                log.debug("Silence cache sync skipped");
            }
        } catch (RuntimeException e) {
            log.error("Silence cache sync failed, keeping previous snapshot: {}", e.getMessage());
        }
    }
}
