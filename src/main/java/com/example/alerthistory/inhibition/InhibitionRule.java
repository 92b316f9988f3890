package com.example.alerthistory.inhibition;

import com.example.alerthistory.matcher.Matcher;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A validated inhibition rule. While an alert matching the source conditions is firing,
 * alerts matching the target conditions that agree on every {@code equal} label are suppressed.
 *
 * Conditions require the label to be present: an alert without {@code severity} never satisfies
 * {@code severity: ""}.
 */
public final class InhibitionRule {

    private final String name;
    private final Map<String, String> sourceMatch;
    private final Map<String, String> sourceMatchRe;
    private final Map<String, String> targetMatch;
    private final Map<String, String> targetMatchRe;
    private final List<String> equal;

    private final List<Matcher> sourceMatchers;
    private final List<Matcher> targetMatchers;

    InhibitionRule(String name,
                   Map<String, String> sourceMatch, Map<String, String> sourceMatchRe,
                   Map<String, String> targetMatch, Map<String, String> targetMatchRe,
                   List<String> equal,
                   List<Matcher> sourceMatchers, List<Matcher> targetMatchers) {
        this.name = Objects.requireNonNull(name, "name");
        this.sourceMatch = freeze(sourceMatch);
        this.sourceMatchRe = freeze(sourceMatchRe);
        this.targetMatch = freeze(targetMatch);
        this.targetMatchRe = freeze(targetMatchRe);
        this.equal = equal == null ? List.of() : List.copyOf(equal);
        this.sourceMatchers = List.copyOf(sourceMatchers);
        this.targetMatchers = List.copyOf(targetMatchers);
    }

    private static Map<String, String> freeze(Map<String, String> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public boolean matchesTarget(Map<String, String> labels) {
        return allPresentAndMatching(targetMatchers, labels);
    }

    public boolean matchesSource(Map<String, String> labels) {
        return allPresentAndMatching(sourceMatchers, labels);
    }

    /**
     * Every {@code equal} label must be present on both alerts with the same value.
     */
    public boolean equalLabelsMatch(Map<String, String> source, Map<String, String> target) {
        for (String label : equal) {
            String s = source.get(label);
            if (s == null || !s.equals(target.get(label))) {
                return false;
            }
        }
        return true;
    }

    private static boolean allPresentAndMatching(List<Matcher> matchers, Map<String, String> labels) {
        for (Matcher m : matchers) {
            if (!labels.containsKey(m.getName()) || !m.matches(labels)) {
                return false;
            }
        }
        return true;
    }

    public String getName() {
        return name;
    }

    @JsonProperty("source_match")
    public Map<String, String> getSourceMatch() {
        return sourceMatch;
    }

    @JsonProperty("source_match_re")
    public Map<String, String> getSourceMatchRe() {
        return sourceMatchRe;
    }

    @JsonProperty("target_match")
    public Map<String, String> getTargetMatch() {
        return targetMatch;
    }

    @JsonProperty("target_match_re")
    public Map<String, String> getTargetMatchRe() {
        return targetMatchRe;
    }

    public List<String> getEqual() {
        return equal;
    }

    @Override
    public String toString() {
        return "InhibitionRule{" + name + ": " + sourceMatchers + " -> " + targetMatchers + " equal " + equal + "}";
    }
}
