package com.example.alerthistory.inhibition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered set of rules. Order matters: the first satisfied rule wins.
 */
public record InhibitionRuleSet(List<InhibitionRule> rules, String source, Instant loadedAt) {

    public InhibitionRuleSet {
        rules = List.copyOf(rules);
    }

    public static InhibitionRuleSet empty() {
        return new InhibitionRuleSet(List.of(), "none", Instant.EPOCH);
    }

    public Optional<InhibitionRule> find(String name) {
        return rules.stream().filter(r -> r.getName().equals(name)).findFirst();
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
