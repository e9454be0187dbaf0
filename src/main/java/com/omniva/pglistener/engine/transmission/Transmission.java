package com.omniva.pglistener.engine.transmission;

import com.omniva.pglistener.engine.fault.ErrorReporter;
import com.omniva.pglistener.engine.sensors.ListenerSensorProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification Transmission - power transfer to the handler
 * <p>
 * Like a transmission in a car, this component:
 * - Transfers power (payloads) from the engine (dispatch loop) to the wheels (application handler)
 * - Absorbs shocks: a failing handler is reported and never stalls the engine
 */
public class Transmission {

    private static final Logger log = LoggerFactory.getLogger(Transmission.class);

    private final String channel;
    private final NotificationHandler drivetrain;
    private final ErrorReporter errorReporter;
    private final ListenerSensorProbe sensorProbe;

    public Transmission(String channel,
                        NotificationHandler drivetrain,
                        ErrorReporter errorReporter,
                        ListenerSensorProbe sensorProbe) {
        this.channel = channel;
        this.drivetrain = drivetrain;
        this.errorReporter = errorReporter;
        this.sensorProbe = sensorProbe;
    }

    /**
     * Deliver one payload to the handler. Handler failures are reported, not thrown.
     */
    public void transfer(String payload) {
        try {
            drivetrain.handle(payload);
            sensorProbe.recordDelivery();
            log.debug("Delivered notification on channel {}: {}", channel, payload);
        } catch (Exception e) {
            sensorProbe.recordHandlerError();
            errorReporter.reportHandlerFailure(payload, e);
        }
    }
}
