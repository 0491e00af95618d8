package com.example.optimizerdaemon.decision;

/**
 * No decision could be obtained for a snapshot: transport failure, timeout,
 * non-2xx status or an unparseable body. Never means "nothing to do".
 */
public class DecisionUnavailableException extends RuntimeException {

    public DecisionUnavailableException(String message) {
        super(message);
    }

    public DecisionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
