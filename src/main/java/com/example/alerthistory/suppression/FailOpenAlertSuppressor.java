package com.example.alerthistory.suppression;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.error.AlertHistoryException;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.monitoring.SuppressionMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Applies the fail-open policy around the raw suppressor: when a query cannot be answered because
 * the state store failed or the deadline passed, the alert is reported as not suppressed and the
 * error is attached to the verdict. Caller misuse ({@link ValidationException}) is still thrown.
 */
@Slf4j
@Primary
@Component
public class FailOpenAlertSuppressor implements AlertSuppressor {

    private final AlertSuppressor delegate;
    private final SuppressionMetrics metrics;

    public FailOpenAlertSuppressor(@Qualifier("defaultAlertSuppressor") AlertSuppressor delegate,
                                   SuppressionMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public SilenceVerdict isAlertSilenced(QueryContext ctx, Alert alert) {
        SilenceVerdict verdict = guarded("silence", alert,
                () -> delegate.isAlertSilenced(ctx, alert), SilenceVerdict::failedOpen);
        metrics.recordSilenceCheck(verdict.hasError() ? "error" : verdict.silenced() ? "silenced" : "not_silenced");
        return verdict;
    }

    @Override
    public InhibitionVerdict shouldInhibit(QueryContext ctx, Alert alert) {
        InhibitionVerdict verdict = guarded("inhibition", alert,
                () -> delegate.shouldInhibit(ctx, alert), InhibitionVerdict::failedOpen);
        metrics.recordInhibitionCheck(verdict.hasError() ? "error" : verdict.inhibited() ? "inhibited" : "not_inhibited");
        return verdict;
    }

    private <V> V guarded(String query, Alert alert, Supplier<V> call, Function<AlertHistoryException, V> failOpen) {
        try {
            return metrics.time(query, call);
        } catch (ValidationException e) {
            throw e;
        } catch (AlertHistoryException e) {
            metrics.recordFailOpen(query, e.getCode());
            log.warn("{} query failed open for alert {}: {}", query, fingerprint(alert), e.getMessage());
            return failOpen.apply(e);
        } catch (RuntimeException e) {
            metrics.recordFailOpen(query, "internal_error");
            log.error("{} query failed unexpectedly for alert {}, failing open", query, fingerprint(alert), e);
            return failOpen.apply(new StateStoreException("unexpected " + query + " failure: " + e.getMessage(), e));
        }
    }

    private static String fingerprint(Alert alert) {
        return alert == null ? "<none>" : alert.fingerprint();
    }
}
