package com.example.alerthistory.inhibition;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.domain.InhibitionState;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.suppression.InhibitionVerdict;
import com.example.alerthistory.suppression.QueryContext;
import com.example.alerthistory.suppression.StateStoreReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a target alert is inhibited by a firing source alert.
 *
 * Rules are tried in configured order and the first satisfied rule wins. Within a rule the
 * earliest-started source wins, ties broken by fingerprint. An alert never inhibits itself and a
 * resolved target is never inhibited.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InhibitionMatcher {

    private static final Comparator<Alert> EARLIEST_FIRST = Comparator
            .comparing((Alert a) -> a.startsAt() == null ? Instant.MAX : a.startsAt())
            .thenComparing(Alert::fingerprint);

    private final InhibitionRuleRegistry ruleRegistry;
    private final FiringAlertStore firingAlerts;
    private final InhibitionStateTracker stateTracker;
    private final StateStoreReader storeReader;
    private final Clock clock;

    public InhibitionVerdict shouldInhibit(QueryContext ctx, Alert target) {
        requireAlert(target);
        if (!target.isFiring()) {
            return InhibitionVerdict.notInhibited();
        }
        InhibitionRuleSet rules = ruleRegistry.current();
        if (rules.isEmpty()) {
            return InhibitionVerdict.notInhibited();
        }
        List<Alert> firing = storeReader.read(ctx, "firing alert lookup", firingAlerts::getFiringAlerts);

        for (InhibitionRule rule : rules.rules()) {
            ctx.checkDeadline("inhibition matching");
            if (!rule.matchesTarget(target.labels())) {
                continue;
            }
            Optional<Alert> source = firing.stream()
                    .filter(candidate -> inhibits(rule, candidate, target))
                    .min(EARLIEST_FIRST);
            if (source.isPresent()) {
                record(ctx, target, source.get(), rule);
                log.debug("Alert {} inhibited by {} via rule {}", target.fingerprint(), source.get().fingerprint(), rule.getName());
                return InhibitionVerdict.inhibitedBy(source.get(), rule);
            }
        }
        return InhibitionVerdict.notInhibited();
    }

    /**
     * Every (source, rule) pair currently inhibiting the target, in rule order then source order.
     * Nothing is recorded.
     */
    public List<InhibitorMatch> findInhibitors(QueryContext ctx, Alert target) {
        requireAlert(target);
        List<InhibitorMatch> matches = new ArrayList<>();
        if (!target.isFiring()) {
            return matches;
        }
        List<Alert> firing = storeReader.read(ctx, "firing alert lookup", firingAlerts::getFiringAlerts);
        for (InhibitionRule rule : ruleRegistry.current().rules()) {
            ctx.checkDeadline("inhibitor search");
            if (!rule.matchesTarget(target.labels())) {
                continue;
            }
            firing.stream()
                    .filter(candidate -> inhibits(rule, candidate, target))
                    .sorted(EARLIEST_FIRST)
                    .forEach(source -> matches.add(new InhibitorMatch(source, rule.getName())));
        }
        return matches;
    }

    private static boolean inhibits(InhibitionRule rule, Alert source, Alert target) {
        return source.isFiring()
                && !source.fingerprint().equals(target.fingerprint())
                && rule.matchesSource(source.labels())
                && rule.equalLabelsMatch(source.labels(), target.labels());
    }

    /**
     * Records the relationship within the caller's deadline. A store failure does not change the
     * verdict: the inhibition holds, it is just not yet durable. Running out of time raises
     * {@link com.example.alerthistory.error.SuppressionTimeoutException}.
     */
    private void record(QueryContext ctx, Alert target, Alert source, InhibitionRule rule) {
        InhibitionState state = InhibitionState.builder()
                .targetFingerprint(target.fingerprint())
                .sourceFingerprint(source.fingerprint())
                .ruleName(rule.getName())
                .inhibitedAt(clock.instant())
                .build();
        try {
            storeReader.write(ctx, "inhibition recording", () -> stateTracker.recordInhibition(state));
        } catch (StateStoreException e) {
            log.warn("Failed to record inhibition of {} by {}: {}", target.fingerprint(), source.fingerprint(), e.getMessage());
        }
    }

    private static void requireAlert(Alert alert) {
        if (alert == null) {
            throw new ValidationException("alert", "required", "alert is required");
        }
    }
}
