package com.powerscheduler.scheduler.scale;

/**
 * Raised when a request cannot run because required configuration is missing.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
