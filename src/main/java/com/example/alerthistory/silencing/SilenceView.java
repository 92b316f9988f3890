package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Silence;

import java.time.Instant;
import java.util.List;

/**
 * Read model of a silence with its status derived at read time.
 */
public record SilenceView(
        String id,
        String createdBy,
        String comment,
        Instant startsAt,
        Instant endsAt,
        List<MatcherSpec> matchers,
        SilenceStatus status,
        Instant createdAt,
        Instant updatedAt) {

    public static SilenceView of(Silence silence, Instant now) {
        return new SilenceView(
                silence.getId(),
                silence.getCreatedBy(),
                silence.getComment(),
                silence.getStartsAt(),
                silence.getEndsAt(),
                silence.getMatchers().stream().map(MatcherSpec::from).toList(),
                silence.statusAt(now),
                silence.getCreatedAt(),
                silence.getUpdatedAt());
    }
}
