package com.example.alerthistory.suppression;

import com.example.alerthistory.domain.Alert;

/**
 * Query surface of the suppression engine. Both queries are independent; callers combine them
 * with OR semantics, or use {@link #evaluate}.
 */
public interface AlertSuppressor {

    SilenceVerdict isAlertSilenced(QueryContext ctx, Alert alert);

    InhibitionVerdict shouldInhibit(QueryContext ctx, Alert alert);

    default SuppressionDecision evaluate(QueryContext ctx, Alert alert) {
        SilenceVerdict silence = isAlertSilenced(ctx, alert);
        InhibitionVerdict inhibition = shouldInhibit(ctx, alert);
        return new SuppressionDecision(alert.fingerprint(), silence, inhibition);
    }
}
