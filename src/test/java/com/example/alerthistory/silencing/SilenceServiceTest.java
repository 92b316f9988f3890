package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.error.NotFoundException;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.matcher.MatchOperator;
import com.example.alerthistory.repository.SilenceRepository;
import com.example.alerthistory.suppression.AlertSuppressor;
import com.example.alerthistory.suppression.QueryContext;
import com.example.alerthistory.suppression.SilenceVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SilenceServiceTest {

    @Autowired SilenceService silenceService;
    @Autowired SilenceRepository silenceRepository;
    @Autowired SilenceSnapshotCache snapshotCache;
    @Autowired AlertSuppressor alertSuppressor;

    private Instant now;

    @BeforeEach
    void setUp() {
        silenceRepository.deleteAll();
        assertTrue(silenceService.syncCache());
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private SilenceView create(String createdBy, Instant startsAt, Instant endsAt, MatcherSpec... matchers) {
        return silenceService.createSilence(SilenceRequest.builder()
                .createdBy(createdBy)
                .comment("maintenance window")
                .startsAt(startsAt)
                .endsAt(endsAt)
                .matchers(List.of(matchers))
                .build());
    }

    private SilenceView createActive(MatcherSpec... matchers) {
        return create("oncall@example.com", now.minus(1, ChronoUnit.HOURS), now.plus(1, ChronoUnit.HOURS), matchers);
    }

    private static MatcherSpec eq(String name, String value) {
        return new MatcherSpec(name, MatchOperator.EQUAL, value);
    }

    private SilenceVerdict check(Map<String, String> labels) {
        return alertSuppressor.isAlertSilenced(QueryContext.withTimeoutMillis(2000), Alert.firing(labels, now));
    }

    @Test
    void activeSilenceSuppressesMatchingAlertsOnly() {
        SilenceView silence = createActive(eq("alertname", "HighCPU"));
        assertEquals(SilenceStatus.ACTIVE, silence.status());

        SilenceVerdict hit = check(Map.of("alertname", "HighCPU", "instance", "a"));
        assertTrue(hit.silenced());
        assertEquals(List.of(silence.id()), hit.silenceIds());
        assertNull(hit.error());

        assertFalse(check(Map.of("alertname", "HighMem")).silenced());
    }

    @Test
    void regexSilenceMatchesAlternatives() {
        createActive(new MatcherSpec("severity", MatchOperator.REGEX, "critical|warning"));

        assertTrue(check(Map.of("severity", "critical")).silenced());
        assertTrue(check(Map.of("severity", "warning")).silenced());
        assertFalse(check(Map.of("severity", "info")).silenced());
    }

    @Test
    void deletedSilenceStopsSuppressingImmediately() {
        SilenceView silence = createActive(eq("alertname", "HighCPU"));
        assertTrue(check(Map.of("alertname", "HighCPU")).silenced());

        silenceService.deleteSilence(silence.id());

        assertFalse(check(Map.of("alertname", "HighCPU")).silenced());
        assertThrows(NotFoundException.class, () -> silenceService.getSilence(silence.id()));
    }

    @Test
    void pendingSilenceDoesNotSuppress() {
        SilenceView pending = create("oncall@example.com", now.plus(1, ChronoUnit.HOURS), now.plus(2, ChronoUnit.HOURS),
                eq("alertname", "HighCPU"));

        assertEquals(SilenceStatus.PENDING, pending.status());
        assertFalse(check(Map.of("alertname", "HighCPU")).silenced());
    }

    @Test
    void allMatchingSilencesAreReportedInIdOrder() {
        SilenceView a = createActive(eq("alertname", "HighCPU"));
        SilenceView b = createActive(eq("instance", "a"));

        SilenceVerdict verdict = check(Map.of("alertname", "HighCPU", "instance", "a"));

        assertEquals(List.of(a.id(), b.id()).stream().sorted().toList(), verdict.silenceIds());
    }

    @Test
    void readsStoreWhenSnapshotIsNotLoaded() {
        SilenceView silence = createActive(eq("alertname", "HighCPU"));
        snapshotCache.invalidate();

        SilenceVerdict verdict = check(Map.of("alertname", "HighCPU"));

        assertTrue(verdict.silenced());
        assertEquals(List.of(silence.id()), verdict.silenceIds());
    }

    @Test
    void updateChangesMutableFieldsOnly() {
        SilenceView silence = createActive(eq("alertname", "HighCPU"));
        Instant newEnd = now.plus(3, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);

        SilenceView updated = silenceService.updateSilence(silence.id(), SilenceUpdate.builder()
                .comment("extended maintenance")
                .endsAt(newEnd)
                .matchers(List.of(eq("alertname", "HighMem")))
                .build());

        assertEquals("extended maintenance", updated.comment());
        assertEquals(newEnd, updated.endsAt());
        assertEquals(silence.startsAt(), updated.startsAt());
        assertEquals(silence.createdBy(), updated.createdBy());
        assertNotNull(updated.updatedAt());

        assertFalse(check(Map.of("alertname", "HighCPU")).silenced());
        assertTrue(check(Map.of("alertname", "HighMem")).silenced());
    }

    @Test
    void updateRejectsEndBeforeStart() {
        SilenceView silence = createActive(eq("alertname", "HighCPU"));

        ValidationException e = assertThrows(ValidationException.class, () -> silenceService.updateSilence(silence.id(),
                SilenceUpdate.builder().endsAt(silence.startsAt().minusSeconds(1)).build()));
        assertEquals("after_starts_at", e.getConstraint());
    }

    @Test
    void expiredSilenceCannotBeUpdated() {
        SilenceView expired = create("oncall@example.com", now.minus(2, ChronoUnit.HOURS), now.minus(1, ChronoUnit.HOURS),
                eq("alertname", "HighCPU"));
        assertEquals(SilenceStatus.EXPIRED, expired.status());

        ValidationException e = assertThrows(ValidationException.class, () -> silenceService.updateSilence(expired.id(),
                SilenceUpdate.builder().comment("too late").build()));
        assertEquals("not_expired", e.getConstraint());
        assertFalse(check(Map.of("alertname", "HighCPU")).silenced());
    }

    @Test
    void unknownAndMalformedIds() {
        assertThrows(NotFoundException.class, () -> silenceService.getSilence(UUID.randomUUID().toString()));
        assertThrows(NotFoundException.class, () -> silenceService.deleteSilence(UUID.randomUUID().toString()));
        ValidationException e = assertThrows(ValidationException.class, () -> silenceService.getSilence("silence-1"));
        assertEquals("id", e.getField());
    }

    @Test
    void listFiltersAndPaginates() {
        createActive(eq("alertname", "A"));
        createActive(eq("alertname", "B"));
        create("dba@example.com", now.minus(1, ChronoUnit.HOURS), now.plus(1, ChronoUnit.HOURS), eq("team", "db"));
        create("dba@example.com", now.plus(1, ChronoUnit.HOURS), now.plus(2, ChronoUnit.HOURS), eq("team", "db"));

        SilencePage all = silenceService.listSilences(SilenceFilter.builder().size(2).build());
        assertEquals(4, all.total());
        assertEquals(2, all.items().size());

        SilencePage byCreator = silenceService.listSilences(SilenceFilter.builder().createdBy("dba@example.com").build());
        assertEquals(2, byCreator.total());

        SilencePage activeDb = silenceService.listSilences(SilenceFilter.builder()
                .statuses(EnumSet.of(SilenceStatus.ACTIVE))
                .matcherName("team")
                .matcherValue("db")
                .build());
        assertEquals(1, activeDb.total());
        assertEquals(SilenceStatus.ACTIVE, activeDb.items().get(0).status());

        SilencePage byStart = silenceService.listSilences(SilenceFilter.builder()
                .sortBy(SilenceFilter.SortField.STARTS_AT)
                .descending(false)
                .build());
        List<Instant> starts = byStart.items().stream().map(SilenceView::startsAt).toList();
        assertEquals(starts.stream().sorted().toList(), starts);
    }

    @Test
    void pageSizeIsCapped() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> silenceService.listSilences(SilenceFilter.builder().size(5000).build()));
        assertEquals("size", e.getField());
    }

    @Test
    void statsCountDerivedStatuses() {
        createActive(eq("alertname", "A"));
        create("oncall@example.com", now.plus(1, ChronoUnit.HOURS), now.plus(2, ChronoUnit.HOURS), eq("alertname", "B"));
        create("oncall@example.com", now.minus(2, ChronoUnit.HOURS), now.minus(1, ChronoUnit.HOURS), eq("alertname", "C"));

        SilenceStats stats = silenceService.getStats();

        assertEquals(3, stats.total());
        assertEquals(1, stats.count(SilenceStatus.ACTIVE));
        assertEquals(1, stats.count(SilenceStatus.PENDING));
        assertEquals(1, stats.count(SilenceStatus.EXPIRED));
        assertEquals(2, stats.cachedSilences());
    }
}
