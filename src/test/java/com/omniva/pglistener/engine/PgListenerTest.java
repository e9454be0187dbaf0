package com.omniva.pglistener.engine;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.crankshaft.SupervisorState;
import com.omniva.pglistener.engine.crankshaft.policy.FixedBackoffPolicy;
import com.omniva.pglistener.engine.fault.ConnectionLostException;
import com.omniva.pglistener.engine.fault.ListenerConfigurationException;
import com.omniva.pglistener.engine.fault.ListenerStartupException;
import com.omniva.pglistener.engine.fault.NotificationHandlingException;
import com.omniva.pglistener.engine.fault.ReconnectException;
import com.omniva.pglistener.support.FakeNotificationDriver;
import com.omniva.pglistener.support.RecordingCallbacks;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class PgListenerTest {

    private static final String CHANNEL = "orders";
    private static final Duration POLL = Duration.ofMillis(20);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeNotificationDriver driver;
    private RecordingCallbacks recorder;
    private ListenerHandle handle;

    @BeforeEach
    void setUp() {
        driver = new FakeNotificationDriver();
        recorder = new RecordingCallbacks();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (handle != null) {
            handle.close();
            handle.awaitTermination(TIMEOUT);
        }
    }

    private ListenOptions.ListenOptionsBuilder options() {
        return recorder.options(driver, CHANNEL)
                .pollInterval(POLL)
                .reconnectPolicy(new FixedBackoffPolicy(Duration.ofMillis(50)));
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        void deliversEveryPayloadInOrderWithoutDebounce() {
            handle = PgListener.listen(options().build());

            List<String> sent = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                sent.add("message_" + i);
                driver.publish(CHANNEL, "message_" + i);
            }

            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == sent.size());
            assertEquals(sent, recorder.messages);
            assertTrue(handle.isHealthy());
            assertEquals(20, handle.getSensor().getMessagesDelivered());
        }

        @Test
        void ignoresOtherChannels() throws InterruptedException {
            handle = PgListener.listen(options().build());

            driver.publish("invoices", "not for us");
            driver.publish(CHANNEL, "for us");

            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("for us"));
            Thread.sleep(100);
            assertEquals(List.of("for us"), recorder.messages);
        }

        @Test
        void handlerFailureDoesNotBlockNextPayload() {
            handle = PgListener.listen(options()
                    .onMessage(payload -> {
                        if (payload.equals("bad")) {
                            throw new IllegalStateException("boom");
                        }
                        recorder.messages.add(payload);
                    })
                    .build());

            driver.publish(CHANNEL, "bad");
            driver.publish(CHANNEL, "good");

            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("good"));
            await().atMost(TIMEOUT).until(() -> !recorder.errors.isEmpty());

            NotificationHandlingException error = assertInstanceOf(NotificationHandlingException.class,
                    recorder.errors.get(0));
            assertEquals(CHANNEL, error.getChannel());
            assertEquals("bad", error.getPayload());
            assertEquals("pg-listener: handling notification channel=orders msg=bad error=boom", error.getMessage());
            assertInstanceOf(IllegalStateException.class, error.getCause());
            assertEquals(1, handle.getSensor().getHandlerErrors());
        }

        @Test
        void handlerIsNeverInvokedConcurrently() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            handle = PgListener.listen(options()
                    .debounceInterval(Duration.ofMillis(30))
                    .onMessage(payload -> {
                        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                        Thread.sleep(10);
                        inFlight.decrementAndGet();
                        recorder.messages.add(payload);
                    })
                    .build());

            for (int i = 0; i < 10; i++) {
                driver.publish(CHANNEL, "p" + i);
            }

            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == 10);
            assertEquals(1, maxInFlight.get());
        }
    }

    @Nested
    @DisplayName("debounce")
    class Debounce {

        @Test
        void collapsesDuplicatesWithinInterval() throws InterruptedException {
            handle = PgListener.listen(options().debounceInterval(Duration.ofMillis(200)).build());

            for (int i = 0; i < 5; i++) {
                driver.publish(CHANNEL, "refresh");
            }
            driver.publish(CHANNEL, "other");

            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("refresh")
                    && recorder.messages.contains("other"));
            Thread.sleep(400);

            assertEquals(1, recorder.messages.stream().filter("refresh"::equals).count());
            assertEquals(4, handle.getSensor().getMessagesSuppressed());
        }

        @Test
        void deliversAgainAfterWindowCloses() {
            handle = PgListener.listen(options().debounceInterval(Duration.ofMillis(50)).build());

            driver.publish(CHANNEL, "refresh");
            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == 1);

            driver.publish(CHANNEL, "refresh");
            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == 2);

            assertEquals(List.of("refresh", "refresh"), recorder.messages);
        }

        @Test
        void holdsDeliveryUntilIntervalElapses() throws InterruptedException {
            handle = PgListener.listen(options().debounceInterval(Duration.ofMillis(300)).build());

            driver.publish(CHANNEL, "refresh");
            Thread.sleep(100);
            assertTrue(recorder.messages.isEmpty());

            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == 1);
        }
    }

    @Nested
    @DisplayName("reconnect")
    class Reconnect {

        @Test
        void resumesDeliveryAfterConnectionLoss() {
            handle = PgListener.listen(options().build());

            driver.publish(CHANNEL, "message_0");
            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("message_0"));

            driver.terminateBackends();

            await().atMost(TIMEOUT).until(() -> recorder.reconnects.get() == 1);
            assertEquals(1, recorder.connectionLosses.get());
            assertTrue(recorder.errors.stream().anyMatch(ConnectionLostException.class::isInstance));
            assertTrue(recorder.errors.get(0).getMessage()
                    .startsWith("pg-listener: waiting for notification channel=orders error="));

            driver.publish(CHANNEL, "message_1");
            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("message_1"));

            assertEquals(List.of("message_0", "message_1"), recorder.messages);
            assertEquals(SupervisorState.CONNECTED, handle.getState());
            assertEquals(1, driver.getListeningConnectionCount(CHANNEL));
        }

        @Test
        void retriesFailedAttemptsUntilConnected() {
            handle = PgListener.listen(options().build());

            driver.refuseConnections(3);
            driver.terminateBackends();

            await().atMost(TIMEOUT).until(() -> recorder.reconnects.get() == 1);

            long reconnectErrors = recorder.errors.stream().filter(ReconnectException.class::isInstance).count();
            assertEquals(3, reconnectErrors);
            assertTrue(recorder.errors.stream()
                    .filter(ReconnectException.class::isInstance)
                    .allMatch(e -> e.getMessage().startsWith("pg-listener: reconnecting channel=orders error=")));
            assertEquals(3, handle.getSensor().getFailedReconnectAttempts());
            assertEquals(1, handle.getSensor().getReconnects());
        }

        @Test
        void handlerCallInProgressFinishesBeforeNewSubscriptionDelivers() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            handle = PgListener.listen(options()
                    .onMessage(payload -> {
                        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                        try {
                            if (payload.equals("slow")) {
                                Thread.sleep(1500);
                            }
                            recorder.messages.add(payload);
                        } finally {
                            inFlight.decrementAndGet();
                        }
                    })
                    .build());

            driver.publish(CHANNEL, "slow");
            await().atMost(TIMEOUT).until(() -> inFlight.get() == 1);

            driver.terminateBackends();
            await().atMost(TIMEOUT).until(() -> recorder.reconnects.get() == 1);

            driver.publish(CHANNEL, "fast");
            await().atMost(TIMEOUT).until(() -> recorder.messages.size() == 2);

            assertEquals(List.of("slow", "fast"), recorder.messages);
            assertEquals(1, maxInFlight.get());
        }

        @Test
        void handlerErrorTriggersResubscribe() {
            handle = PgListener.listen(options()
                    .onMessage(payload -> {
                        if (payload.equals("fatal")) {
                            throw new AssertionError("handler bug");
                        }
                        recorder.messages.add(payload);
                    })
                    .build());

            driver.publish(CHANNEL, "fatal");
            await().atMost(TIMEOUT).until(() -> recorder.reconnects.get() == 1);

            driver.publish(CHANNEL, "next");
            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("next"));
            assertTrue(recorder.errors.stream().anyMatch(e -> e.getCause() instanceof AssertionError));
            assertEquals(0, recorder.connectionLosses.get());
        }

        @Test
        void survivesRepeatedConnectionLoss() {
            handle = PgListener.listen(options().build());

            for (int round = 1; round <= 3; round++) {
                int expected = round;
                driver.terminateBackends();
                await().atMost(TIMEOUT).until(() -> recorder.reconnects.get() == expected);
            }

            driver.publish(CHANNEL, "after");
            await().atMost(TIMEOUT).until(() -> recorder.messages.contains("after"));
            assertEquals(3, recorder.connectionLosses.get());
        }

        @Test
        void cancellationStopsReconnectLoop() throws InterruptedException {
            handle = PgListener.listen(options().build());

            driver.refuseConnections(Integer.MAX_VALUE);
            driver.terminateBackends();
            await().atMost(TIMEOUT).until(() -> recorder.errors.stream().anyMatch(ReconnectException.class::isInstance));
            assertEquals(SupervisorState.RECONNECTING, handle.getState());

            handle.close();

            assertTrue(handle.awaitTermination(TIMEOUT));
            assertEquals(SupervisorState.TERMINATED, handle.getState());
            assertEquals(0, recorder.reconnects.get());
        }
    }

    @Nested
    @DisplayName("startup")
    class Startup {

        @Test
        void failedFirstConnectIsThrown() {
            driver.refuseConnections(1);

            ListenerStartupException error = assertThrows(ListenerStartupException.class,
                    () -> PgListener.listen(options().build()));

            assertTrue(error.getMessage().contains("channel=orders"));
            assertTrue(recorder.errors.isEmpty());
        }

        @Test
        void failedListenClosesConnection() {
            driver.failListen(true);

            assertThrows(ListenerStartupException.class, () -> PgListener.listen(options().build()));

            assertEquals(1, driver.getConnectAttempts());
            assertEquals(0, driver.getOpenConnectionCount());
        }

        @Test
        void rejectsMissingChannel() {
            assertThrows(ListenerConfigurationException.class,
                    () -> PgListener.listen(options().channel("").build()));
        }

        @Test
        void rejectsMissingHandler() {
            assertThrows(ListenerConfigurationException.class,
                    () -> PgListener.listen(options().onMessage(null).build()));
        }

        @Test
        void rejectsNegativeDebounce() {
            assertThrows(ListenerConfigurationException.class,
                    () -> PgListener.listen(options().debounceInterval(Duration.ofMillis(-1)).build()));
        }

        @Test
        void rejectsMalformedUrlWithoutConnecting() {
            ListenOptions options = options().driver(null).connectionUrl("mysql://localhost/db").build();

            assertThrows(ListenerConfigurationException.class, () -> PgListener.listen(options));
            assertEquals(0, driver.getConnectAttempts());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void closingTwiceIsHarmless() throws InterruptedException {
            handle = PgListener.listen(options().build());

            handle.close();
            handle.close();

            assertTrue(handle.awaitTermination(TIMEOUT));
            assertFalse(handle.isActive());
            assertFalse(handle.isHealthy());
            assertEquals(SupervisorState.TERMINATED, handle.getState());
        }

        @Test
        void nothingIsDeliveredAfterCancellation() throws InterruptedException {
            CancellationSignal cancellation = new CancellationSignal();
            handle = PgListener.listen(options().cancellation(cancellation).build());

            cancellation.cancel();
            cancellation.cancel();
            assertTrue(handle.awaitTermination(TIMEOUT));

            driver.publish(CHANNEL, "late");
            Thread.sleep(100);

            assertTrue(recorder.messages.isEmpty());
            assertTrue(recorder.errors.isEmpty());
            assertEquals(0, driver.getOpenConnectionCount());
            assertEquals(0, driver.getListeningConnectionCount(CHANNEL));
        }

        @Test
        void pendingDebounceIsAbandoned() throws InterruptedException {
            handle = PgListener.listen(options().debounceInterval(Duration.ofMillis(200)).build());

            driver.publish(CHANNEL, "refresh");
            await().atMost(TIMEOUT).until(() -> handle.getSensor().getNotificationsReceived() == 1);
            handle.close();
            assertTrue(handle.awaitTermination(TIMEOUT));

            Thread.sleep(300);
            assertTrue(recorder.messages.isEmpty());
        }
    }
}
