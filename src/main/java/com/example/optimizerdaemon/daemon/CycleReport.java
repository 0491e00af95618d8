package com.example.optimizerdaemon.daemon;

import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.ExecutionResult;
import com.example.optimizerdaemon.domain.MetricsSnapshot;

import java.util.List;

/**
 * Summary of one completed cycle. {@code decision} is null when no decision could be obtained.
 */
public record CycleReport(
        long cycle,
        MetricsSnapshot snapshot,
        Decision decision,
        String unavailableReason,
        List<ExecutionResult> results
) {

    public CycleReport {
        results = List.copyOf(results);
    }

    static CycleReport decided(long cycle, MetricsSnapshot snapshot, Decision decision, List<ExecutionResult> results) {
        return new CycleReport(cycle, snapshot, decision, null, results);
    }

    static CycleReport undecided(long cycle, MetricsSnapshot snapshot, String reason) {
        return new CycleReport(cycle, snapshot, null, reason, List.of());
    }

    public boolean decided() {
        return decision != null;
    }
}
