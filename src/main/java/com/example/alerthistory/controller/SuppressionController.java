package com.example.alerthistory.controller;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.inhibition.AlertLifecycleService;
import com.example.alerthistory.suppression.AlertSuppressor;
import com.example.alerthistory.suppression.QueryContext;
import com.example.alerthistory.suppression.SuppressionDecision;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Suppression queries and alert transitions for ingestion collaborators.
 */
@RestController
@RequestMapping("/api/v2")
@RequiredArgsConstructor
public class SuppressionController {

    private final AlertSuppressor alertSuppressor;
    private final AlertLifecycleService lifecycleService;
    private final AlertHistoryProperties properties;

    @PostMapping("/suppression/check")
    public ResponseEntity<SuppressionDecision> check(@RequestBody Alert alert) {
        requireLabels(alert);
        QueryContext ctx = QueryContext.withTimeoutMillis(properties.getSuppression().getQueryTimeoutMs());
        return ResponseEntity.ok(alertSuppressor.evaluate(ctx, alert));
    }

    @PostMapping("/alerts")
    public ResponseEntity<Map<String, String>> observe(@RequestBody Alert alert) {
        requireLabels(alert);
        lifecycleService.observe(alert);
        return ResponseEntity.accepted().body(Map.of(
                "fingerprint", alert.fingerprint(),
                "status", alert.status().toValue()));
    }

    private static void requireLabels(Alert alert) {
        if (alert == null || alert.labels().isEmpty()) {
            throw new ValidationException("labels", "required", "alert must carry at least one label");
        }
    }
}
