package com.example.optimizerdaemon.monitoring;

import com.example.optimizerdaemon.domain.MetricsSnapshot;

/**
 * Raw access to host resource state. Each query may fail independently;
 * failures surface as unchecked exceptions and are absorbed by {@link MetricsCollector}.
 */
public interface HostMetricsSource {

    /**
     * CPU utilization in percent (0-100), observed over a window of the given length.
     * Blocks for the whole window.
     */
    double cpuPercent(long windowMillis);

    MetricsSnapshot.Memory memory();

    MetricsSnapshot.Disk disk(String path);

    MetricsSnapshot.Network network();

    int processCount();
}
