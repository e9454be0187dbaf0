package com.omniva.pglistener.engine.fault;

import lombok.Getter;

/**
 * Exception reported when the message handler fails for a payload.
 * Delivery of later payloads is not affected.
 */
@Getter
public class NotificationHandlingException extends PgListenerException {
    private final String channel;
    private final String payload;

    public NotificationHandlingException(String message, String channel, String payload, Throwable cause) {
        super(message, cause);
        this.channel = channel;
        this.payload = payload;
    }
}
