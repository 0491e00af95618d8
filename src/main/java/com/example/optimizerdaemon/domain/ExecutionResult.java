package com.example.optimizerdaemon.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of one attempted action. Exactly one per request that reaches the executor.
 */
public record ExecutionResult(Status status, String kind, String detail) {

    @Getter
    @RequiredArgsConstructor
    public enum Status {
        DONE("[DONE]"),
        SKIPPED("[SKIPPED]"),
        ERROR("[ERROR]");

        private final String label;
    }

    public static ExecutionResult done(String kind, String detail) {
        return new ExecutionResult(Status.DONE, kind, detail);
    }

    public static ExecutionResult skipped(String kind, String detail) {
        return new ExecutionResult(Status.SKIPPED, kind, detail);
    }

    public static ExecutionResult error(String kind, String detail) {
        return new ExecutionResult(Status.ERROR, kind, detail);
    }

    /**
     * Audit line form, e.g. {@code [DONE] clear_cache: caches dropped}.
     */
    public String toLogLine() {
        return status.getLabel() + " " + kind + ": " + detail;
    }
}
