package com.example.optimizerdaemon.daemon;

import com.example.optimizerdaemon.domain.ActionKind;
import com.example.optimizerdaemon.domain.ExecutionResult;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Count of executed actions per kind and status.
 * Written only by the loop thread; readers get an immutable copy.
 * Kinds outside the known vocabulary are counted together under {@value #UNMAPPED}.
 */
public class ActionTally {

    public static final String UNMAPPED = "unmapped";

    private final Map<String, Map<ExecutionResult.Status, Long>> counts = new TreeMap<>();

    static String key(String kind) {
        return ActionKind.fromName(kind).map(ActionKind::getName).orElse(UNMAPPED);
    }

    synchronized void record(ExecutionResult result) {
        counts.computeIfAbsent(key(result.kind()), k -> new EnumMap<>(ExecutionResult.Status.class))
                .merge(result.status(), 1L, Long::sum);
    }

    public synchronized Map<String, Map<ExecutionResult.Status, Long>> snapshot() {
        Map<String, Map<ExecutionResult.Status, Long>> copy = new LinkedHashMap<>();
        counts.forEach((kind, byStatus) -> copy.put(kind, Map.copyOf(byStatus)));
        return Map.copyOf(copy);
    }

    public synchronized long count(String kind, ExecutionResult.Status status) {
        return counts.getOrDefault(key(kind), Map.of()).getOrDefault(status, 0L);
    }
}
