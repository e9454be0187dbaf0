package com.omniva.pglistener.engine.fault;

/**
 * Base runtime exception for all pg-listener errors
 */
public class PgListenerException extends RuntimeException {
    public PgListenerException(String message) {
        super(message);
    }

    public PgListenerException(String message, Throwable cause) {
        super(message, cause);
    }
}
