package com.example.optimizerdaemon.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Host resource state captured at one instant.
 * Fields that could not be read hold sentinel values and are named in {@code unavailable}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricsSnapshot(
        double cpuPercent,
        Memory memory,
        Disk disk,
        Network network,
        int processCount,
        Instant capturedAt,
        List<String> unavailable
) {

    public MetricsSnapshot {
        unavailable = unavailable == null ? List.of() : List.copyOf(unavailable);
    }

    @JsonIgnore
    public boolean isDegraded() {
        return !unavailable.isEmpty();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Memory(long total, long available, long used, double percent) {
        public static final Memory UNKNOWN = new Memory(0, 0, 0, 0.0);

        public static Memory of(long total, long available) {
            long used = total - available;
            return new Memory(total, available, used, percentOf(used, total));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Disk(String path, long total, long used, long free, double percent) {
        public static Disk unknown(String path) {
            return new Disk(path, 0, 0, 0, 0.0);
        }

        public static Disk of(String path, long total, long free) {
            long used = total - free;
            return new Disk(path, total, used, free, percentOf(used, total));
        }
    }

    /**
     * Counters are monotonic since boot, summed over all interfaces.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Network(long bytesSent, long bytesRecv, long packetsSent, long packetsRecv,
                          long errin, long errout, long dropin) {
        public static final Network UNKNOWN = new Network(0, 0, 0, 0, 0, 0, 0);
    }

    static double percentOf(long part, long total) {
        if (total <= 0) return 0.0;
        return Math.round(part * 1000.0 / total) / 10.0;
    }
}
