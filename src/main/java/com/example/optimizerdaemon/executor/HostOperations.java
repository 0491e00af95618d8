package com.example.optimizerdaemon.executor;

/**
 * Concrete host operations behind the executor's allow-list.
 * None of them accept request-supplied strings; the only external value is a process id,
 * already validated by the executor.
 * Each operation returns a short human-readable summary of what it did.
 */
public interface HostOperations {

    String dropCaches() throws HostOperationException;

    String cleanupTmp() throws HostOperationException;

    String archiveOldLogs() throws HostOperationException;

    String restartNetwork() throws HostOperationException;

    boolean isRunning(long pid);

    /**
     * Request termination of a running process.
     */
    String terminate(long pid) throws HostOperationException;
}
