package com.sandy.aiot.automation.engine.exception;

/**
 * A collection snapshot could not be written. The in-memory copy stays authoritative
 * and the write is retried on the next flush.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
