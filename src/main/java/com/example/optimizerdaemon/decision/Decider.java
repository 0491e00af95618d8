package com.example.optimizerdaemon.decision;

import com.example.optimizerdaemon.domain.Decision;
import com.example.optimizerdaemon.domain.MetricsSnapshot;

/**
 * Maps a snapshot to an ordered list of recommended actions.
 * Local and remote implementations are interchangeable for the daemon loop.
 */
public interface Decider {

    /**
     * @throws DecisionUnavailableException when no decision could be obtained
     */
    Decision decide(MetricsSnapshot snapshot);

    /**
     * Abort a decision in progress, if any. Called on shutdown.
     */
    default void cancel() {
    }

    /**
     * Accept decisions again after {@link #cancel()}. Called on start.
     */
    default void resume() {
    }
}
