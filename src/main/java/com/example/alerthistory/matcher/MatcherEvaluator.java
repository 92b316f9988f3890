package com.example.alerthistory.matcher;

import java.util.List;
import java.util.Map;

/**
 * Stateless evaluation of matcher lists against label sets.
 */
public final class MatcherEvaluator {

    private MatcherEvaluator() {
    }

    /**
     * Conjunction over all matchers. An empty list matches every label set.
     */
    public static boolean matchAll(List<Matcher> matchers, Map<String, String> labels) {
        for (Matcher matcher : matchers) {
            if (!matcher.matches(labels)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the matchers would also match an alert without any labels,
     * i.e. the list is effectively a catch-all.
     */
    public static boolean matchesEmpty(List<Matcher> matchers) {
        return matchAll(matchers, Map.of());
    }
}
