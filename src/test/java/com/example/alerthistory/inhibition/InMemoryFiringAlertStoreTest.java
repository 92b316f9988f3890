package com.example.alerthistory.inhibition;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.domain.Alert;
import com.example.alerthistory.domain.AlertStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryFiringAlertStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryFiringAlertStore store(int capacity) {
        AlertHistoryProperties properties = new AlertHistoryProperties();
        properties.getInhibition().setFiringAlertCapacity(capacity);
        return new InMemoryFiringAlertStore(properties);
    }

    @Test
    void evictsOldestWhenFull() {
        InMemoryFiringAlertStore store = store(2);
        store.addFiringAlert(Alert.firing("b", Map.of("alertname", "B"), T0.plusSeconds(10)));
        store.addFiringAlert(Alert.firing("a", Map.of("alertname", "A"), T0));
        store.addFiringAlert(Alert.firing("c", Map.of("alertname", "C"), T0.plusSeconds(20)));

        assertEquals(2, store.size());
        assertTrue(store.getFiringAlerts().stream().noneMatch(a -> a.fingerprint().equals("a")));
    }

    @Test
    void sameFingerprintReplacesEntry() {
        InMemoryFiringAlertStore store = store(10);
        store.addFiringAlert(Alert.firing("a", Map.of("alertname", "A"), T0));
        store.addFiringAlert(Alert.firing("a", Map.of("alertname", "A", "node", "n1"), T0));

        assertEquals(1, store.size());
        assertEquals("n1", store.getFiringAlerts().get(0).label("node"));
    }

    @Test
    void resolvedAlertsAreNotKept() {
        InMemoryFiringAlertStore store = store(10);
        Alert alert = Alert.firing("a", Map.of("alertname", "A"), T0);
        store.addFiringAlert(alert);
        store.addFiringAlert(alert.withStatus(AlertStatus.RESOLVED));

        assertEquals(0, store.size());
        assertTrue(store.removeAlert("a").isEmpty());
    }
}
