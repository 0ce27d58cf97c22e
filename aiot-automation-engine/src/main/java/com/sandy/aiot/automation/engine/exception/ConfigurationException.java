package com.sandy.aiot.automation.engine.exception;

/**
 * Malformed rule, condition, action, schedule or threshold definition.
 * Raised when the definition is saved, never while it is being evaluated.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
