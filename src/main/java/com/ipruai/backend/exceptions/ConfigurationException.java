package com.ipruai.backend.exceptions;

/**
 * Malformed or missing parser configuration. Raised while the application context starts,
 * never while serving a request.
 */
public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
