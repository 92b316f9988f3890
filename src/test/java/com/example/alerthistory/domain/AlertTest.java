package com.example.alerthistory.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void firingAlertKeepsTheGivenStartTime() {
        Alert alert = Alert.firing(Map.of("alertname", "HighCPU"), T0);

        assertEquals(T0, alert.startsAt());
        assertTrue(alert.isFiring());
    }

    @Test
    void fingerprintIsDerivedFromLabelsWhenMissing() {
        Alert a = Alert.firing(Map.of("alertname", "HighCPU", "instance", "a"), T0);
        Alert b = Alert.firing(Map.of("instance", "a", "alertname", "HighCPU"), T0.plusSeconds(60));

        assertEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a.fingerprint(), Alert.firing(Map.of("alertname", "HighMem"), T0).fingerprint());
    }
}
