package com.example.optimizerdaemon.monitoring;

import com.example.optimizerdaemon.config.DaemonProperties;
import com.example.optimizerdaemon.domain.MetricsSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Samples host resource state into a {@link MetricsSnapshot}.
 *
 * Sampling never fails: a query that throws leaves a sentinel in its field,
 * the field is listed in {@link MetricsSnapshot#unavailable()} and a warning is logged.
 * CPU sampling blocks for the configured window, so {@link #sample()} is a scheduling point.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsCollector {

    private final HostMetricsSource source;
    private final DaemonProperties properties;
    private final Clock clock;

    public MetricsSnapshot sample() {
        List<String> unavailable = new ArrayList<>();
        String diskPath = properties.getMetrics().getDiskPath();

        double cpu = read("cpu_percent", () -> source.cpuPercent(properties.getMetrics().getCpuSampleMillis()),
                0.0, unavailable);
        MetricsSnapshot.Memory memory = read("memory", source::memory, MetricsSnapshot.Memory.UNKNOWN, unavailable);
        MetricsSnapshot.Disk disk = read("disk", () -> source.disk(diskPath),
                MetricsSnapshot.Disk.unknown(diskPath), unavailable);
        MetricsSnapshot.Network network = read("network", source::network,
                MetricsSnapshot.Network.UNKNOWN, unavailable);
        int processCount = read("process_count", source::processCount, 0, unavailable);

        MetricsSnapshot snapshot = new MetricsSnapshot(cpu, memory, disk, network, processCount,
                clock.instant(), unavailable);
        log.debug("Sampled metrics: cpu={}%, memory={}%, disk={}%, processes={}",
                cpu, memory.percent(), disk.percent(), processCount);
        return snapshot;
    }

    private <T> T read(String field, Supplier<T> query, T sentinel, List<String> unavailable) {
        try {
            T value = query.get();
            if (value == null) {
                throw new IllegalStateException("no value returned");
            }
            return value;
        } catch (RuntimeException e) {
            log.warn("Metric {} unavailable, using sentinel: {}", field, e.getMessage());
            unavailable.add(field);
            return sentinel;
        }
    }
}
