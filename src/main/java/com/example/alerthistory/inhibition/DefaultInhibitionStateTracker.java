package com.example.alerthistory.inhibition;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.InhibitionState;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.monitoring.SuppressionMetrics;
import com.example.alerthistory.repository.InhibitionStateRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JPA-backed state tracker with a concurrent in-memory mirror for reads.
 * The mirror is reloaded from the store at start-up, so active inhibitions survive restarts.
 * Writes go to the store first and are published to the mirror only once the store accepted them.
 * Writes for one target are serialized on a lock stripe; mirror reads never wait on the store.
 */
@Slf4j
@Service
public class DefaultInhibitionStateTracker implements InhibitionStateTracker {

    private final InhibitionStateRepository repository;
    private final SuppressionMetrics metrics;
    private final Clock clock;
    private final Duration ttl;

    private final Map<String, InhibitionState> states = new ConcurrentHashMap<>();
    private final Object[] stripes = new Object[64];

    public DefaultInhibitionStateTracker(InhibitionStateRepository repository,
                                         SuppressionMetrics metrics,
                                         AlertHistoryProperties properties,
                                         Clock clock) {
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
        this.ttl = Duration.ofHours(Math.max(0, properties.getInhibition().getStateTtlHours()));
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new Object();
        }
    }

    @PostConstruct
    public void init() {
        Instant now = clock.instant();
        int loaded = 0;
        for (InhibitionState state : repository.findAll()) {
            if (!state.isExpired(now)) {
                states.put(state.getTargetFingerprint(), state);
                loaded++;
            }
        }
        metrics.gauge("alerthistory.inhibitions.active", states, Map::size);
        log.info("Restored {} active inhibitions from the state store", loaded);
    }

    @Override
    public InhibitionState recordInhibition(InhibitionState state) {
        validate(state);
        String target = state.getTargetFingerprint();
        synchronized (lockFor(target)) {
            Instant now = clock.instant();
            InhibitionState existing = states.get(target);
            if (existing != null && !existing.isExpired(now) && existing.sameRelationship(state)) {
                return existing;
            }
            InhibitionState toSave = state.toBuilder()
                    .inhibitedAt(state.getInhibitedAt() != null ? state.getInhibitedAt() : now)
                    .expiresAt(state.getExpiresAt() != null ? state.getExpiresAt() : expiryFrom(now))
                    .build();
            InhibitionState saved = store("record", () -> repository.save(toSave));
            states.put(target, saved);
            if (existing != null && !existing.isExpired(now)) {
                log.info("Inhibition of {} changed: {} ({}) -> {} ({})", target,
                        existing.getSourceFingerprint(), existing.getRuleName(),
                        saved.getSourceFingerprint(), saved.getRuleName());
            } else {
                log.debug("Inhibition recorded: {} by {} via {}", target, saved.getSourceFingerprint(), saved.getRuleName());
            }
            return saved;
        }
    }

    @Override
    public Optional<InhibitionState> removeInhibition(String targetFingerprint) {
        InhibitionState removed;
        synchronized (lockFor(targetFingerprint)) {
            delete(targetFingerprint);
            removed = states.remove(targetFingerprint);
        }
        if (removed != null) {
            log.debug("Inhibition removed: {}", targetFingerprint);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public int removeInhibitionsBySource(String sourceFingerprint) {
        List<String> targets = states.values().stream()
                .filter(s -> s.getSourceFingerprint().equals(sourceFingerprint))
                .map(InhibitionState::getTargetFingerprint)
                .toList();
        int removed = 0;
        for (String target : targets) {
            synchronized (lockFor(target)) {
                // Only drop the record if it still names this source.
                InhibitionState existing = states.get(target);
                if (existing == null || !existing.getSourceFingerprint().equals(sourceFingerprint)) {
                    continue;
                }
                delete(target);
                states.remove(target);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} inhibitions sourced by {}", removed, sourceFingerprint);
        }
        return removed;
    }

    @Override
    public List<InhibitionState> getActiveInhibitions() {
        Instant now = clock.instant();
        return states.values().stream()
                .filter(s -> !s.isExpired(now))
                .sorted(Comparator.comparing(InhibitionState::getInhibitedAt)
                        .thenComparing(InhibitionState::getTargetFingerprint))
                .toList();
    }

    @Override
    public boolean isInhibited(String targetFingerprint) {
        return getInhibitionState(targetFingerprint).isPresent();
    }

    @Override
    public Optional<InhibitionState> getInhibitionState(String targetFingerprint) {
        InhibitionState state = states.get(targetFingerprint);
        return state == null || state.isExpired(clock.instant()) ? Optional.empty() : Optional.of(state);
    }

    @Override
    public Set<String> getInhibitedFingerprints() {
        Instant now = clock.instant();
        return states.values().stream()
                .filter(s -> !s.isExpired(now))
                .map(InhibitionState::getTargetFingerprint)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    @Transactional
    public int cleanupExpired() {
        Instant now = clock.instant();
        int deleted = store("cleanup", () -> repository.deleteExpired(now));
        int evicted = 0;
        for (InhibitionState state : states.values()) {
            if (state.isExpired(now) && states.remove(state.getTargetFingerprint(), state)) {
                evicted++;
            }
        }
        if (deleted > 0 || evicted > 0) {
            log.info("Inhibition cleanup: {} expired rows deleted, {} evicted from memory", deleted, evicted);
        }
        return Math.max(deleted, evicted);
    }

    private Object lockFor(String targetFingerprint) {
        return stripes[Math.floorMod(targetFingerprint.hashCode(), stripes.length)];
    }

    private void delete(String targetFingerprint) {
        store("remove", () -> {
            repository.deleteById(targetFingerprint);
            return null;
        });
    }

    private Instant expiryFrom(Instant now) {
        return ttl.isZero() ? null : now.plus(ttl);
    }

    private static void validate(InhibitionState state) {
        if (state == null) {
            throw new ValidationException("state", "required", "inhibition state is required");
        }
        if (isBlank(state.getTargetFingerprint())) {
            throw new ValidationException("targetFingerprint", "required", "targetFingerprint is required");
        }
        if (isBlank(state.getSourceFingerprint())) {
            throw new ValidationException("sourceFingerprint", "required", "sourceFingerprint is required");
        }
        if (isBlank(state.getRuleName())) {
            throw new ValidationException("ruleName", "required", "ruleName is required");
        }
        if (state.getTargetFingerprint().equals(state.getSourceFingerprint())) {
            throw new ValidationException("sourceFingerprint", "not_self", "an alert cannot inhibit itself");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            metrics.recordInhibitionStateError(operation);
            throw new StateStoreException("Inhibition state store failure during " + operation + ": " + e.getMessage(), e);
        }
    }
}
