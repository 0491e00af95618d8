package com.example.optimizerdaemon.daemon;

/**
 * Phases of one daemon cycle. IDLE covers the wait between cycles.
 */
public enum DaemonState {
    IDLE,
    SAMPLING,
    DECIDING,
    EXECUTING,
    LOGGING
}
