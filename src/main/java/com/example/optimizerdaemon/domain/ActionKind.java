package com.example.optimizerdaemon.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed vocabulary of remediation actions the daemon knows how to run.
 * Anything outside this set is treated as unsafe by the executor.
 */
@Getter
@RequiredArgsConstructor
public enum ActionKind {

    NO_OP("no_op", false),
    CLEAR_CACHE("clear_cache", false),
    CLEANUP_TMP("cleanup_tmp", false),
    ARCHIVE_OLD_LOGS("archive_old_logs", false),
    RESTART_NETWORK("restart_network", false),
    /** Terminates the process named by {@code details.pid}. */
    KILL_HIGH_CPU("kill_high_cpu", true);

    /** Wire name used by the decision service and in configuration keys. */
    private final String name;

    /** Whether the action reads a value from {@link ActionRequest#details()}. */
    private final boolean parameterized;

    public static Optional<ActionKind> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(kind -> kind.name.equals(name))
                .findFirst();
    }
}
