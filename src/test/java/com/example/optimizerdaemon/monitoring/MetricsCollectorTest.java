package com.example.optimizerdaemon.monitoring;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsCollectorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T08:30:00Z");

    @Mock
    private HostMetricsSource source;

    private DaemonProperties properties;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        properties = new DaemonProperties();
        properties.getMetrics().setDiskPath("/data");
        properties.getMetrics().setCpuSampleMillis(250);
        collector = new MetricsCollector(source, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Full sample carries every field and no degradation")
    void fullSample() {
        when(source.cpuPercent(250)).thenReturn(42.5);
        when(source.memory()).thenReturn(MetricsSnapshot.Memory.of(1000, 250));
        when(source.disk("/data")).thenReturn(MetricsSnapshot.Disk.of("/data", 2000, 500));
        when(source.network()).thenReturn(new MetricsSnapshot.Network(1, 2, 3, 4, 0, 0, 0));
        when(source.processCount()).thenReturn(321);

        MetricsSnapshot snapshot = collector.sample();

        assertEquals(42.5, snapshot.cpuPercent());
        assertEquals(75.0, snapshot.memory().percent());
        assertEquals(750, snapshot.memory().used());
        assertEquals(75.0, snapshot.disk().percent());
        assertEquals(321, snapshot.processCount());
        assertEquals(NOW, snapshot.capturedAt());
        assertFalse(snapshot.isDegraded());
    }

    @Test
    @DisplayName("Failed queries fall back to sentinels and are reported")
    void failedQueriesUseSentinels() {
        when(source.cpuPercent(anyLong())).thenReturn(90.0);
        when(source.memory()).thenThrow(new IllegalStateException("meminfo unreadable"));
        when(source.disk(anyString())).thenThrow(new UncheckedIOException(new IOException("no such mount")));
        when(source.network()).thenReturn(null);
        when(source.processCount()).thenReturn(10);

        MetricsSnapshot snapshot = collector.sample();

        assertEquals(90.0, snapshot.cpuPercent());
        assertEquals(MetricsSnapshot.Memory.UNKNOWN, snapshot.memory());
        assertEquals(MetricsSnapshot.Disk.unknown("/data"), snapshot.disk());
        assertEquals(MetricsSnapshot.Network.UNKNOWN, snapshot.network());
        assertEquals(List.of("memory", "disk", "network"), snapshot.unavailable());
        assertTrue(snapshot.isDegraded());
    }

    @Test
    @DisplayName("Sampling never throws even when every query fails")
    void everyQueryFailing() {
        when(source.cpuPercent(anyLong())).thenThrow(new IllegalStateException("cpu"));
        when(source.memory()).thenThrow(new IllegalStateException("memory"));
        when(source.disk(anyString())).thenThrow(new IllegalStateException("disk"));
        when(source.network()).thenThrow(new IllegalStateException("network"));
        when(source.processCount()).thenThrow(new IllegalStateException("processes"));

        MetricsSnapshot snapshot = assertDoesNotThrow(() -> collector.sample());

        assertEquals(0.0, snapshot.cpuPercent());
        assertEquals(0, snapshot.processCount());
        assertEquals(List.of("cpu_percent", "memory", "disk", "network", "process_count"), snapshot.unavailable());
    }
}
