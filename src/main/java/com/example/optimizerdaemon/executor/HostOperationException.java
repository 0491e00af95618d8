package com.example.optimizerdaemon.executor;

/**
 * An allow-listed host operation ran and failed at the OS level.
 */
public class HostOperationException extends Exception {

    public HostOperationException(String message) {
        super(message);
    }

    public HostOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
