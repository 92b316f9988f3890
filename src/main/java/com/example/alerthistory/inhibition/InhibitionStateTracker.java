package com.example.alerthistory.inhibition;

import com.example.alerthistory.domain.InhibitionState;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of which alerts are currently inhibited, and by what.
 * At most one state is kept per target fingerprint.
 */
public interface InhibitionStateTracker {

    /**
     * Records an inhibition. An identical (target, source, rule) triple is a no-op that keeps the
     * original {@code inhibitedAt}; a different triple for the same target replaces it.
     *
     * @return the state now recorded for the target
     */
    InhibitionState recordInhibition(InhibitionState state);

    Optional<InhibitionState> removeInhibition(String targetFingerprint);

    int removeInhibitionsBySource(String sourceFingerprint);

    List<InhibitionState> getActiveInhibitions();

    boolean isInhibited(String targetFingerprint);

    Optional<InhibitionState> getInhibitionState(String targetFingerprint);

    Set<String> getInhibitedFingerprints();

    /**
     * Drops states past their expiry.
     *
     * @return number of states removed
     */
    int cleanupExpired();
}
