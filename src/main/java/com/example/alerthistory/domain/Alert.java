package com.example.alerthistory.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * An alert as handed over by the ingestion pipeline. Not owned by the engine.
 * Labels are copied on construction so they cannot change during an evaluation.
 * A missing fingerprint is derived from the sorted label set.
 */
public record Alert(Map<String, String> labels, String fingerprint, AlertStatus status, Instant startsAt) {

    public Alert {
        labels = copyLabels(labels);
        if (fingerprint == null || fingerprint.isBlank()) {
            fingerprint = fingerprintOf(labels);
        }
        if (status == null) status = AlertStatus.FIRING;
    }

    public static Alert firing(Map<String, String> labels, Instant startsAt) {
        return new Alert(labels, null, AlertStatus.FIRING, startsAt);
    }

    public static Alert firing(String fingerprint, Map<String, String> labels, Instant startsAt) {
        return new Alert(labels, fingerprint, AlertStatus.FIRING, startsAt);
    }

    @JsonIgnore
    public boolean isFiring() {
        return status == AlertStatus.FIRING;
    }

    public String label(String name) {
        return labels.get(name);
    }

    public Alert withStatus(AlertStatus newStatus) {
        return new Alert(labels, fingerprint, newStatus, startsAt);
    }

    private static Map<String, String> copyLabels(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) return Map.of();
        Map<String, String> copy = new TreeMap<>();
        labels.forEach((name, value) -> {
            if (name != null && value != null) copy.put(name, value);
        });
        return Map.copyOf(copy);
    }

    /**
     * SHA-256 over the label pairs in name order; stable for equal label sets.
     */
    public static String fingerprintOf(Map<String, String> labels) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
                digest.update(e.getKey().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '=');
                digest.update(e.getValue().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            return HexFormat.of().formatHex(digest.digest()).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
