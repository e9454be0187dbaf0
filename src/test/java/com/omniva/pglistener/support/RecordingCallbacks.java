package com.omniva.pglistener.support;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.fault.PgListenerException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Captures every callback a listener makes
 */
public class RecordingCallbacks {

    public final List<String> messages = new CopyOnWriteArrayList<>();
    public final List<PgListenerException> errors = new CopyOnWriteArrayList<>();
    public final AtomicInteger connectionLosses = new AtomicInteger();
    public final AtomicInteger reconnects = new AtomicInteger();

    /**
     * Options wired to this recorder; the handler records every payload
     */
    public ListenOptions.ListenOptionsBuilder options(FakeNotificationDriver driver, String channel) {
        return ListenOptions.builder()
                .driver(driver)
                .channel(channel)
                .onMessage(messages::add)
                .onError(errors::add)
                .onConnectionLoss(connectionLosses::incrementAndGet)
                .onReconnect(reconnects::incrementAndGet);
    }
}
