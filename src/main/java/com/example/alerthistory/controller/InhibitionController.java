package com.example.alerthistory.controller;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.domain.InhibitionState;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.inhibition.InhibitionMatcher;
import com.example.alerthistory.inhibition.InhibitionRuleRegistry;
import com.example.alerthistory.inhibition.InhibitionRuleSet;
import com.example.alerthistory.inhibition.InhibitionStateTracker;
import com.example.alerthistory.inhibition.InhibitorMatch;
import com.example.alerthistory.suppression.QueryContext;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Inhibition introspection and rule management REST API.
 */
@RestController
@RequestMapping("/api/v2/inhibitions")
@RequiredArgsConstructor
public class InhibitionController {

    private final InhibitionStateTracker stateTracker;
    private final InhibitionRuleRegistry ruleRegistry;
    private final InhibitionMatcher inhibitionMatcher;
    private final AlertHistoryProperties properties;

    @GetMapping
    public ResponseEntity<List<InhibitionState>> getActiveInhibitions() {
        return ResponseEntity.ok(stateTracker.getActiveInhibitions());
    }

    @GetMapping("/{fingerprint}")
    public ResponseEntity<InhibitionState> getInhibition(@PathVariable String fingerprint) {
        return stateTracker.getInhibitionState(fingerprint)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/rules")
    public ResponseEntity<Map<String, Object>> getRules() {
        InhibitionRuleSet rules = ruleRegistry.current();
        return ResponseEntity.ok(Map.of(
                "rules", rules.rules(),
                "count", rules.size(),
                "source", rules.source(),
                "loadedAt", rules.loadedAt()));
    }

    @PostMapping("/rules/reload")
    public ResponseEntity<Map<String, Object>> reloadRules() {
        InhibitionRuleSet rules = ruleRegistry.reload();
        return ResponseEntity.ok(Map.of(
                "status", "reloaded",
                "count", rules.size(),
                "source", rules.source()));
    }

    @PostMapping("/inhibitors")
    public ResponseEntity<List<InhibitorMatch>> findInhibitors(@RequestBody Alert alert) {
        if (alert == null || alert.labels().isEmpty()) {
            throw new ValidationException("labels", "required", "alert must carry at least one label");
        }
        QueryContext ctx = QueryContext.withTimeoutMillis(properties.getSuppression().getQueryTimeoutMs());
        return ResponseEntity.ok(inhibitionMatcher.findInhibitors(ctx, alert));
    }
}
