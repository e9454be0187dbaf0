package com.omniva.pglistener.engine.fault;

/**
 * Reported for each failed reconnect attempt. The supervisor keeps retrying.
 */
public class ReconnectException extends PgListenerException {
    public ReconnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
