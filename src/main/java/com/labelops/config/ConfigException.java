package com.labelops.config;

/**
 * Base type for configuration problems that stop the process from starting.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
