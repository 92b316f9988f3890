package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Silence;
import com.example.alerthistory.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link SilenceSnapshot}. Readers take the reference without locking.
 * Writers (administrative deltas and the sync worker) serialize on a short critical section
 * that never covers a store read, so the alert path is never blocked by administration.
 */
@Slf4j
@Component
public class SilenceSnapshotCache {

    private final AtomicReference<SilenceSnapshot> current = new AtomicReference<>();
    private final AtomicLong writes = new AtomicLong();

    /** Empty until the first successful sync */
    public Optional<SilenceSnapshot> snapshot() {
        return Optional.ofNullable(current.get());
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    /**
     * Marks the start of a full sync; pass the returned token to {@link #rebuild}.
     */
    public long beginSync() {
        return writes.get();
    }

    /**
     * Replaces the snapshot unless a write was published after {@code syncToken} was taken,
     * in which case the loaded rows may be stale and the rebuild is skipped.
     */
    public boolean rebuild(long syncToken, List<Silence> unexpired, Instant syncedAt) {
        List<CompiledSilence> compiled = new ArrayList<>(unexpired.size());
        for (Silence silence : unexpired) {
            try {
                compiled.add(CompiledSilence.compile(silence));
            } catch (ValidationException e) {
                log.warn("Skipping silence {} with invalid stored matchers: {}", silence.getId(), e.getMessage());
            }
        }
        synchronized (this) {
            if (writes.get() != syncToken) {
                log.debug("Silence snapshot rebuild skipped, concurrent write detected");
                return false;
            }
            current.set(SilenceSnapshot.of(compiled, syncedAt));
        }
        log.debug("Silence snapshot rebuilt with {} silences", compiled.size());
        return true;
    }

    /**
     * Publishes a created or updated silence; an expired one is dropped from the snapshot instead.
     */
    public void upsert(Silence silence, Instant now) {
        if (silence.statusAt(now) == SilenceStatus.EXPIRED) {
            remove(silence.getId());
            return;
        }
        CompiledSilence compiled = CompiledSilence.compile(silence);
        synchronized (this) {
            writes.incrementAndGet();
            current.updateAndGet(snapshot -> snapshot == null ? null : snapshot.with(compiled));
        }
    }

    public void remove(String id) {
        synchronized (this) {
            writes.incrementAndGet();
            current.updateAndGet(snapshot -> snapshot == null ? null : snapshot.without(id));
        }
    }

    public void invalidate() {
        synchronized (this) {
            writes.incrementAndGet();
            current.set(null);
        }
    }
}
