package com.omniva.pglistener.engine.fault;

/**
 * Exception thrown when the initial connect or LISTEN fails
 */
public class ListenerStartupException extends PgListenerException {
    public ListenerStartupException(String message) {
        super(message);
    }

    public ListenerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
