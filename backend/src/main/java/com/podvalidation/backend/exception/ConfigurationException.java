package com.podvalidation.backend.exception;

/**
 * The rule registry cannot serve a request: it is not initialized, or neither the client nor the
 * default has a validator or rule set.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
