package com.omniva.pglistener.engine.fault;

/**
 * Exception thrown when listener options are missing or malformed
 */
public class ListenerConfigurationException extends PgListenerException {
    public ListenerConfigurationException(String message) {
        super(message);
    }

    public ListenerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
