package com.example.alerthistory.silencing;

import com.example.alerthistory.domain.Silence;
import com.example.alerthistory.domain.SilenceMatcher;
import com.example.alerthistory.matcher.Matcher;
import com.example.alerthistory.matcher.MatcherEvaluator;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable, pre-compiled copy of a silence as held by the matching snapshot.
 */
public record CompiledSilence(String id, Instant startsAt, Instant endsAt, List<Matcher> matchers) {

    public CompiledSilence {
        matchers = List.copyOf(matchers);
    }

    public static CompiledSilence compile(Silence silence) {
        List<Matcher> compiled = silence.getMatchers().stream().map(SilenceMatcher::compile).toList();
        return new CompiledSilence(silence.getId(), silence.getStartsAt(), silence.getEndsAt(), compiled);
    }

    public SilenceStatus statusAt(Instant now) {
        return SilenceStatus.of(startsAt, endsAt, now);
    }

    public boolean isActiveAt(Instant now) {
        return statusAt(now) == SilenceStatus.ACTIVE;
    }

    public boolean matches(Map<String, String> labels) {
        return MatcherEvaluator.matchAll(matchers, labels);
    }
}
