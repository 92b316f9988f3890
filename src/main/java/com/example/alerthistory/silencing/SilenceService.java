package com.example.alerthistory.silencing;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.domain.Silence;
import com.example.alerthistory.domain.SilenceMatcher;
import com.example.alerthistory.error.ConflictException;
import com.example.alerthistory.error.NotFoundException;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.matcher.Matcher;
import com.example.alerthistory.monitoring.SuppressionMetrics;
import com.example.alerthistory.repository.SilenceRepository;
import com.example.alerthistory.suppression.QueryContext;
import com.example.alerthistory.suppression.SilenceVerdict;
import com.example.alerthistory.suppression.StateStoreReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Silence lifecycle: administrative CRUD against the store and the alert-path query
 * {@link #isAlertSilenced}, which reads the in-memory snapshot when it is loaded.
 *
 * Store and timeout failures are raised as-is here; the fail-open policy for queries lives in
 * {@link com.example.alerthistory.suppression.FailOpenAlertSuppressor}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SilenceService {

    private final SilenceRepository silenceRepository;
    private final SilenceValidator validator;
    private final SilenceSnapshotCache snapshotCache;
    private final StateStoreReader storeReader;
    private final AlertHistoryProperties properties;
    private final SuppressionMetrics metrics;
    private final Clock clock;

    // ==================== Alert path ====================

    public SilenceVerdict isAlertSilenced(QueryContext ctx, Alert alert) {
        if (alert == null) {
            throw new ValidationException("alert", "required", "alert is required");
        }
        Instant now = clock.instant();
        Collection<CompiledSilence> candidates = candidates(ctx, now);

        List<String> matched = new ArrayList<>();
        for (CompiledSilence silence : candidates) {
            if (silence.isActiveAt(now) && silence.matches(alert.labels())) {
                matched.add(silence.id());
            }
        }
        ctx.checkDeadline("silence matching");

        if (matched.isEmpty()) {
            return SilenceVerdict.notSilenced();
        }
        matched.sort(null);
        log.debug("Alert {} silenced by {}", alert.fingerprint(), matched);
        return SilenceVerdict.silenced(matched);
    }

    private Collection<CompiledSilence> candidates(QueryContext ctx, Instant now) {
        if (properties.getSilences().isCacheEnabled()) {
            var snapshot = snapshotCache.snapshot();
            if (snapshot.isPresent()) {
                return snapshot.get().silences();
            }
        }
        List<Silence> rows = storeReader.read(ctx, "silence lookup", () -> silenceRepository.findUnexpired(now));
        List<CompiledSilence> compiled = new ArrayList<>(rows.size());
        for (Silence silence : rows) {
            try {
                compiled.add(CompiledSilence.compile(silence));
            } catch (ValidationException e) {
                log.warn("Ignoring silence {} with invalid stored matchers: {}", silence.getId(), e.getMessage());
            }
        }
        return compiled;
    }

    /**
     * Currently active silences, newest first.
     */
    public List<SilenceView> getActiveSilences() {
        return listSilences(SilenceFilter.builder()
                .statuses(EnumSet.of(SilenceStatus.ACTIVE))
                .size(properties.getSilences().getMaxPageSize())
                .build()).items();
    }

    // ==================== Administration ====================

    public SilenceView createSilence(SilenceRequest request) {
        List<Matcher> matchers = validator.validateCreate(request);
        Instant now = clock.instant();

        Silence silence = Silence.builder()
                .createdBy(request.getCreatedBy())
                .comment(request.getComment())
                .startsAt(request.getStartsAt())
                .endsAt(request.getEndsAt())
                .matchers(new ArrayList<>(matchers.stream().map(SilenceMatcher::from).toList()))
                .createdAt(now)
                .build();

        Silence saved = write("create", () -> silenceRepository.save(silence));
        snapshotCache.upsert(saved, clock.instant());
        metrics.recordSilenceAdmin("create");

        log.info("Created silence {} by {} ({} matchers, {} → {})",
                saved.getId(), saved.getCreatedBy(), matchers.size(), saved.getStartsAt(), saved.getEndsAt());
        return SilenceView.of(saved, clock.instant());
    }

    public SilenceView updateSilence(String id, SilenceUpdate update) {
        validator.validateId(id);
        if (update == null || update.isEmpty()) {
            throw new ValidationException("body", "required", "update must change comment, endsAt or matchers");
        }
        Silence silence = findExisting(id);
        Instant now = clock.instant();
        if (silence.statusAt(now) == SilenceStatus.EXPIRED) {
            throw new ValidationException("endsAt", "not_expired", "silence " + id + " has expired and can no longer be updated");
        }

        if (update.getComment() != null) {
            validator.validateComment(update.getComment());
            silence.setComment(update.getComment());
        }
        if (update.getEndsAt() != null) {
            validator.validateTimeRange(silence.getStartsAt(), update.getEndsAt());
            silence.setEndsAt(update.getEndsAt());
        }
        if (update.getMatchers() != null) {
            List<Matcher> matchers = validator.validateMatchers(update.getMatchers());
            silence.setMatchers(new ArrayList<>(matchers.stream().map(SilenceMatcher::from).toList()));
        }
        silence.setUpdatedAt(now);

        Silence saved = write("update", () -> silenceRepository.save(silence));
        snapshotCache.upsert(saved, clock.instant());
        metrics.recordSilenceAdmin("update");

        log.info("Updated silence {} (endsAt={})", id, saved.getEndsAt());
        return SilenceView.of(saved, clock.instant());
    }

    public void deleteSilence(String id) {
        validator.validateId(id);
        boolean exists = write("delete", () -> silenceRepository.existsById(id));
        if (!exists) {
            throw new NotFoundException("silence", id);
        }
        write("delete", () -> {
            silenceRepository.deleteById(id);
            return null;
        });
        snapshotCache.remove(id);
        metrics.recordSilenceAdmin("delete");
        log.info("Deleted silence {}", id);
    }

    public SilenceView getSilence(String id) {
        validator.validateId(id);
        return SilenceView.of(findExisting(id), clock.instant());
    }

    public SilencePage listSilences(SilenceFilter filter) {
        SilenceFilter f = filter != null ? filter : SilenceFilter.all();
        int size = f.getSize() <= 0 ? properties.getSilences().getDefaultPageSize() : f.getSize();
        if (size > properties.getSilences().getMaxPageSize()) {
            throw new ValidationException("size", "max", "page size must be at most " + properties.getSilences().getMaxPageSize());
        }
        if (f.getPage() < 0) {
            throw new ValidationException("page", "min", "page must not be negative");
        }
        Instant now = clock.instant();
        Sort.Direction direction = f.isDescending() ? Sort.Direction.DESC : Sort.Direction.ASC;
        Sort sort = Sort.by(direction, f.getSortBy().getProperty()).and(Sort.by(Sort.Direction.ASC, "id"));

        Page<Silence> page = write("list", () -> silenceRepository.findAll(
                SilenceSpecifications.matching(f, now), PageRequest.of(f.getPage(), size, sort)));

        List<SilenceView> items = page.getContent().stream().map(s -> SilenceView.of(s, now)).toList();
        return new SilencePage(items, page.getTotalElements(), f.getPage(), size);
    }

    /**
     * Each status is counted on its own and the total is their sum, so the figures always add up.
     */
    @Transactional(readOnly = true)
    public SilenceStats getStats() {
        Instant now = clock.instant();
        long pending = write("stats", () -> silenceRepository.countByStartsAtAfter(now));
        long active = write("stats", () -> silenceRepository.countActive(now));
        long expired = write("stats", () -> silenceRepository.countByEndsAtLessThanEqual(now));

        Map<String, Long> byStatus = new LinkedHashMap<>();
        byStatus.put(SilenceStatus.PENDING.toValue(), pending);
        byStatus.put(SilenceStatus.ACTIVE.toValue(), active);
        byStatus.put(SilenceStatus.EXPIRED.toValue(), expired);

        var snapshot = snapshotCache.snapshot();
        return new SilenceStats(pending + active + expired, byStatus,
                snapshot.map(SilenceSnapshot::size).orElse(0),
                snapshot.map(SilenceSnapshot::syncedAt).orElse(null));
    }

    // ==================== Snapshot sync ====================

    /**
     * Reloads the snapshot from the store, pruning expired silences.
     */
    public boolean syncCache() {
        if (!properties.getSilences().isCacheEnabled()) {
            return false;
        }
        long token = snapshotCache.beginSync();
        Instant now = clock.instant();
        List<Silence> unexpired = write("sync", () -> silenceRepository.findUnexpired(now));
        boolean rebuilt = snapshotCache.rebuild(token, unexpired, now);
        if (rebuilt) {
            log.debug("Silence cache synced: {} unexpired silences", unexpired.size());
        }
        return rebuilt;
    }

    private Silence findExisting(String id) {
        return write("get", () -> silenceRepository.findById(id))
                .orElseThrow(() -> new NotFoundException("silence", id));
    }

    /**
     * Runs a store call on the administrative path, where store errors are surfaced to the caller.
     */
    private <T> T write(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("silence was modified concurrently, retry the " + operation, e);
        } catch (DataAccessException e) {
            log.error("Silence store failure during {}: {}", operation, e.getMessage());
            throw new StateStoreException("silence store failure during " + operation, e);
        }
    }
}
