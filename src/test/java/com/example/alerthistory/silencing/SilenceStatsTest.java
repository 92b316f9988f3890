package com.example.alerthistory.silencing;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.monitoring.SuppressionMetrics;
import com.example.alerthistory.repository.SilenceRepository;
import com.example.alerthistory.suppression.StateStoreReader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SilenceStatsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void everyStatusIsCountedDirectlyAndTheTotalIsTheirSum() {
        SilenceRepository repository = mock(SilenceRepository.class);
        // a total taken separately can lag behind the per-status counts
        when(repository.count()).thenReturn(1L);
        when(repository.countByStartsAtAfter(NOW)).thenReturn(1L);
        when(repository.countActive(NOW)).thenReturn(2L);
        when(repository.countByEndsAtLessThanEqual(NOW)).thenReturn(1L);

        AlertHistoryProperties properties = new AlertHistoryProperties();
        SilenceService service = new SilenceService(repository, new SilenceValidator(properties),
                new SilenceSnapshotCache(), mock(StateStoreReader.class), properties,
                new SuppressionMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));

        SilenceStats stats = service.getStats();

        assertEquals(2, stats.count(SilenceStatus.ACTIVE));
        assertEquals(1, stats.count(SilenceStatus.PENDING));
        assertEquals(1, stats.count(SilenceStatus.EXPIRED));
        assertEquals(4, stats.total());
        verify(repository, never()).count();
    }
}
