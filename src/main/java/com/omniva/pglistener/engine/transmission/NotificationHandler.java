package com.omniva.pglistener.engine.transmission;

/**
 * The drivetrain - application code that receives notification payloads.
 * Never invoked concurrently with itself for the same listener.
 */
@FunctionalInterface
public interface NotificationHandler {
    /**
     * @param payload the notification payload, never null
     * @throws Exception reported through {@code onError}; delivery of later payloads continues
     */
    void handle(String payload) throws Exception;
}
