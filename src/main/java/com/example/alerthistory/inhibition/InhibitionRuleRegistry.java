package com.example.alerthistory.inhibition;

import com.example.alerthistory.error.ValidationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link InhibitionRuleSet}. A reload swaps the whole set in one step;
 * readers see either the old or the new set, never a mix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InhibitionRuleRegistry {

    private final InhibitionRuleLoader loader;
    private final AtomicReference<InhibitionRuleSet> current = new AtomicReference<>(InhibitionRuleSet.empty());

    @PostConstruct
    public void init() {
        current.set(loader.load());
    }

    public InhibitionRuleSet current() {
        return current.get();
    }

    /**
     * Reloads rules from configuration. On failure the previous set stays active and the error is rethrown.
     */
    public InhibitionRuleSet reload() {
        try {
            InhibitionRuleSet loaded = loader.load();
            InhibitionRuleSet previous = current.getAndSet(loaded);
            log.info("Inhibition rules reloaded: {} -> {} rules", previous.size(), loaded.size());
            return loaded;
        } catch (ValidationException e) {
            log.warn("Inhibition rule reload rejected, keeping {} active rules: {}", current.get().size(), e.getMessage());
            throw e;
        }
    }

    /**
     * Replaces the active set directly, e.g. with rules parsed from an uploaded document.
     */
    public void replace(InhibitionRuleSet rules) {
        InhibitionRuleSet previous = current.getAndSet(rules);
        log.info("Inhibition rules replaced: {} -> {} rules from {}", previous.size(), rules.size(), rules.source());
    }
}
