package com.example.alerthistory.inhibition;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory firing-alert population. When full, the alert that started earliest is evicted.
 */
@Slf4j
@Component
public class InMemoryFiringAlertStore implements FiringAlertStore {

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final int capacity;

    public InMemoryFiringAlertStore(AlertHistoryProperties properties) {
        this.capacity = Math.max(1, properties.getInhibition().getFiringAlertCapacity());
    }

    @Override
    public List<Alert> getFiringAlerts() {
        return List.copyOf(alerts.values());
    }

    @Override
    public synchronized void addFiringAlert(Alert alert) {
        if (!alert.isFiring()) {
            alerts.remove(alert.fingerprint());
            return;
        }
        alerts.put(alert.fingerprint(), alert);
        while (alerts.size() > capacity) {
            evictOldest();
        }
    }

    @Override
    public synchronized Optional<Alert> removeAlert(String fingerprint) {
        return Optional.ofNullable(alerts.remove(fingerprint));
    }

    @Override
    public int size() {
        return alerts.size();
    }

    private void evictOldest() {
        alerts.values().stream()
                .min(Comparator.comparing((Alert a) -> a.startsAt() == null ? Instant.MIN : a.startsAt())
                        .thenComparing(Alert::fingerprint))
                .ifPresent(oldest -> {
                    alerts.remove(oldest.fingerprint());
                    log.debug("Firing alert store full ({}), evicted {}", capacity, oldest.fingerprint());
                });
    }
}
