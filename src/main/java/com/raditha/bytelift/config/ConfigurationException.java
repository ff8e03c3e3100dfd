package com.raditha.bytelift.config;

import com.raditha.bytelift.ByteliftException;

/**
 * Raised when a configuration file cannot be read or holds values that make no sense.
 */
public class ConfigurationException extends ByteliftException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
