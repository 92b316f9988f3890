package com.example.alerthistory.suppression;

import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.inhibition.InhibitionMatcher;
import com.example.alerthistory.silencing.SilenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Raw suppression queries. Store and deadline failures propagate as exceptions;
 * use the primary {@link AlertSuppressor} bean for fail-open answers.
 */
@Component
@RequiredArgsConstructor
public class DefaultAlertSuppressor implements AlertSuppressor {

    private final SilenceService silenceService;
    private final InhibitionMatcher inhibitionMatcher;

    @Override
    public SilenceVerdict isAlertSilenced(QueryContext ctx, Alert alert) {
        return silenceService.isAlertSilenced(ctx, alert);
    }

    @Override
    public InhibitionVerdict shouldInhibit(QueryContext ctx, Alert alert) {
        return inhibitionMatcher.shouldInhibit(ctx, alert);
    }
}
