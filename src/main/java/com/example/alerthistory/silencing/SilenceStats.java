package com.example.alerthistory.silencing;

import java.time.Instant;
import java.util.Map;

/**
 * Store counts per derived status (keyed by the lowercase status name) plus the state of the
 * in-memory snapshot.
 */
public record SilenceStats(
        long total,
        Map<String, Long> byStatus,
        int cachedSilences,
        Instant cacheLastSync) {

    public long count(SilenceStatus status) {
        return byStatus.getOrDefault(status.toValue(), 0L);
    }
}
