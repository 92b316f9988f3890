package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Silence;
import com.example.alerthistory.domain.SilenceMatcher;
import com.example.alerthistory.matcher.MatchOperator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SilenceSnapshotCacheTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final SilenceSnapshotCache cache = new SilenceSnapshotCache();

    private static Silence silence(String id, Instant startsAt, Instant endsAt, String alertname) {
        return Silence.builder()
                .id(id)
                .createdBy("oncall@example.com")
                .comment("test")
                .startsAt(startsAt)
                .endsAt(endsAt)
                .matchers(new ArrayList<>(List.of(new SilenceMatcher("alertname", MatchOperator.EQUAL, alertname))))
                .createdAt(NOW)
                .build();
    }

    private static Silence active(String id, String alertname) {
        return silence(id, NOW.minusSeconds(3600), NOW.plusSeconds(3600), alertname);
    }

    @Test
    void emptyUntilFirstSync() {
        assertFalse(cache.isLoaded());
        cache.upsert(active("s1", "A"), NOW);
        assertTrue(cache.snapshot().isEmpty());

        assertTrue(cache.rebuild(cache.beginSync(), List.of(active("s1", "A")), NOW));
        assertTrue(cache.snapshot().orElseThrow().contains("s1"));
    }

    @Test
    void syncThatOverlapsAWriteIsDiscarded() {
        cache.rebuild(cache.beginSync(), List.of(active("s1", "A")), NOW);

        long token = cache.beginSync();
        List<Silence> staleRows = List.of(active("s1", "A"));
        cache.remove("s1");

        assertFalse(cache.rebuild(token, staleRows, NOW));
        assertFalse(cache.snapshot().orElseThrow().contains("s1"));
    }

    @Test
    void upsertPublishesCompiledMatchers() {
        cache.rebuild(cache.beginSync(), List.of(), NOW);
        cache.upsert(active("s1", "HighCPU"), NOW);

        CompiledSilence compiled = cache.snapshot().orElseThrow().silences().iterator().next();
        assertTrue(compiled.isActiveAt(NOW));
        assertTrue(compiled.matches(Map.of("alertname", "HighCPU")));
    }

    @Test
    void expiredSilenceIsDroppedOnUpsert() {
        cache.rebuild(cache.beginSync(), List.of(active("s1", "A")), NOW);

        cache.upsert(silence("s1", NOW.minusSeconds(3600), NOW, "A"), NOW);

        assertEquals(0, cache.snapshot().orElseThrow().size());
    }

    @Test
    void invalidStoredSilenceIsSkippedDuringRebuild() {
        Silence broken = silence("bad", NOW.minusSeconds(60), NOW.plusSeconds(60), "A");
        broken.getMatchers().set(0, new SilenceMatcher("alertname", MatchOperator.REGEX, "(unclosed"));

        assertTrue(cache.rebuild(cache.beginSync(), List.of(broken, active("s1", "A")), NOW));
        assertEquals(1, cache.snapshot().orElseThrow().size());
    }
}
