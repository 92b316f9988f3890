package com.example.alerthistory.silencing;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Copy-on-write view of the non-expired silences. Never mutated after construction;
 * writers derive a new snapshot and swap it in.
 */
public final class SilenceSnapshot {

    private final Map<String, CompiledSilence> silences;
    private final Instant syncedAt;

    private SilenceSnapshot(Map<String, CompiledSilence> silences, Instant syncedAt) {
        this.silences = silences;
        this.syncedAt = syncedAt;
    }

    public static SilenceSnapshot of(Collection<CompiledSilence> silences, Instant syncedAt) {
        Map<String, CompiledSilence> byId = new HashMap<>();
        for (CompiledSilence silence : silences) {
            byId.put(silence.id(), silence);
        }
        return new SilenceSnapshot(Map.copyOf(byId), syncedAt);
    }

    public SilenceSnapshot with(CompiledSilence silence) {
        Map<String, CompiledSilence> copy = new HashMap<>(silences);
        copy.put(silence.id(), silence);
        return new SilenceSnapshot(Map.copyOf(copy), syncedAt);
    }

    public SilenceSnapshot without(String id) {
        if (!silences.containsKey(id)) {
            return this;
        }
        Map<String, CompiledSilence> copy = new HashMap<>(silences);
        copy.remove(id);
        return new SilenceSnapshot(Map.copyOf(copy), syncedAt);
    }

    public Collection<CompiledSilence> silences() {
        return silences.values();
    }

    public boolean contains(String id) {
        return silences.containsKey(id);
    }

    public int size() {
        return silences.size();
    }

    public Instant syncedAt() {
        return syncedAt;
    }
}
