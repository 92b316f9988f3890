package com.example.alerthistory.silencing;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SilenceStatusTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant END = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void pendingStrictlyBeforeStart() {
        assertEquals(SilenceStatus.PENDING, SilenceStatus.of(START, END, START.minusNanos(1)));
    }

    @Test
    void activeFromStartInclusive() {
        assertEquals(SilenceStatus.ACTIVE, SilenceStatus.of(START, END, START));
        assertEquals(SilenceStatus.ACTIVE, SilenceStatus.of(START, END, END.minusNanos(1)));
    }

    @Test
    void expiredFromEndInclusive() {
        assertEquals(SilenceStatus.EXPIRED, SilenceStatus.of(START, END, END));
        assertEquals(SilenceStatus.EXPIRED, SilenceStatus.of(START, END, END.plusSeconds(3600)));
    }

    @Test
    void parsesLowercaseValues() {
        assertEquals(SilenceStatus.ACTIVE, SilenceStatus.fromValue("active"));
        assertEquals("expired", SilenceStatus.EXPIRED.toValue());
        assertThrows(IllegalArgumentException.class, () -> SilenceStatus.fromValue("muted"));
    }
}
