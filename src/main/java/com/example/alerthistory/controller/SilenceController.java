package com.example.alerthistory.controller;

import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.silencing.SilenceFilter;
import com.example.alerthistory.silencing.SilencePage;
import com.example.alerthistory.silencing.SilenceRequest;
import com.example.alerthistory.silencing.SilenceService;
import com.example.alerthistory.silencing.SilenceStats;
import com.example.alerthistory.silencing.SilenceStatus;
import com.example.alerthistory.silencing.SilenceUpdate;
import com.example.alerthistory.silencing.SilenceView;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Silence administration REST API.
 */
@RestController
@RequestMapping("/api/v2/silences")
@RequiredArgsConstructor
public class SilenceController {

    private final SilenceService silenceService;

    @GetMapping
    public ResponseEntity<SilencePage> listSilences(
            @RequestParam(required = false) List<String> status,
            @RequestParam(required = false) String createdBy,
            @RequestParam(required = false) String matcherName,
            @RequestParam(required = false) String matcherValue,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startsAfter,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startsBefore,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endsAfter,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endsBefore,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "0") int size,
            @RequestParam(required = false) String sort,
            @RequestParam(defaultValue = "desc") String order) {

        SilenceFilter filter = SilenceFilter.builder()
                .statuses(parseStatuses(status))
                .createdBy(createdBy)
                .matcherName(matcherName)
                .matcherValue(matcherValue)
                .startsAfter(startsAfter)
                .startsBefore(startsBefore)
                .endsAfter(endsAfter)
                .endsBefore(endsBefore)
                .page(page)
                .size(size)
                .sortBy(SilenceFilter.SortField.parse(sort))
                .descending(parseDescending(order))
                .build();
        return ResponseEntity.ok(silenceService.listSilences(filter));
    }

    @PostMapping
    public ResponseEntity<SilenceView> createSilence(@RequestBody SilenceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(silenceService.createSilence(request));
    }

    @GetMapping("/active")
    public ResponseEntity<List<SilenceView>> getActiveSilences() {
        return ResponseEntity.ok(silenceService.getActiveSilences());
    }

    @GetMapping("/stats")
    public ResponseEntity<SilenceStats> getStats() {
        return ResponseEntity.ok(silenceService.getStats());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SilenceView> getSilence(@PathVariable String id) {
        return ResponseEntity.ok(silenceService.getSilence(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SilenceView> updateSilence(@PathVariable String id, @RequestBody SilenceUpdate update) {
        return ResponseEntity.ok(silenceService.updateSilence(id, update));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSilence(@PathVariable String id) {
        silenceService.deleteSilence(id);
        return ResponseEntity.noContent().build();
    }

    private static Set<SilenceStatus> parseStatuses(List<String> values) {
        Set<SilenceStatus> statuses = EnumSet.noneOf(SilenceStatus.class);
        if (values == null) {
            return statuses;
        }
        for (String value : values) {
            if (value == null || value.isBlank()) continue;
            try {
                statuses.add(SilenceStatus.fromValue(value));
            } catch (IllegalArgumentException e) {
                throw new ValidationException("status", "valid_status",
                        "Unknown silence status " + value + " (allowed: pending, active, expired)");
            }
        }
        return statuses;
    }

    private static boolean parseDescending(String order) {
        if ("desc".equalsIgnoreCase(order)) return true;
        if ("asc".equalsIgnoreCase(order)) return false;
        throw new ValidationException("order", "valid_order", "order must be asc or desc, got " + order);
    }
}
