package com.omniva.pglistener.engine.fault;

/**
 * Reported when the active notification connection fails while waiting for a notification.
 */
public class ConnectionLostException extends PgListenerException {
    public ConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
