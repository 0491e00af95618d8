package com.example.optimizerdaemon.config;

import lombok.Getter;

/**
 * Raised at startup when a configuration value is missing or invalid.
 * The only error in the daemon that is allowed to stop the process.
 */
@Getter
public class DaemonConfigurationException extends RuntimeException {

    /** Offending key, relative to the 'optimizer-daemon' prefix. */
    private final String key;

    public DaemonConfigurationException(String key, String message) {
        super("Invalid configuration 'optimizer-daemon." + key + "': " + message);
        this.key = key;
    }
}
