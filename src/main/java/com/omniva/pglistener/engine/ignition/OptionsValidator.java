package com.omniva.pglistener.engine.ignition;

import com.omniva.pglistener.config.ListenOptions;
import com.omniva.pglistener.engine.fault.ListenerConfigurationException;
import com.omniva.pglistener.engine.fuelsystem.NotificationDriver;
import com.omniva.pglistener.engine.fuelsystem.PgJdbcNotificationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Ignition checks - validates listener options before any connection is opened.
 */
public final class OptionsValidator {
    private static final Logger log = LoggerFactory.getLogger(OptionsValidator.class);

    /** PostgreSQL truncates identifiers longer than NAMEDATALEN - 1 */
    public static final int MAX_CHANNEL_LENGTH = 63;

    private OptionsValidator() {
    }

    /**
     * Validate the options and resolve where notification connections come from.
     *
     * @return the driver to open notification connections with
     * @throws ListenerConfigurationException if any option is missing or malformed
     */
    public static NotificationDriver validate(ListenOptions options) {
        if (options == null) {
            throw new ListenerConfigurationException("Listen options are required");
        }

        String channel = options.getChannel();
        if (channel == null || channel.isEmpty()) {
            throw new ListenerConfigurationException("Channel is required");
        }
        if (channel.length() > MAX_CHANNEL_LENGTH) {
            throw new ListenerConfigurationException(
                    "Channel name exceeds " + MAX_CHANNEL_LENGTH + " characters: " + channel);
        }
        if (options.getOnMessage() == null) {
            throw new ListenerConfigurationException("Message handler is required for channel " + channel);
        }

        requireNonNegative("Debounce interval", options.getDebounceInterval());
        requirePositive("Poll interval", options.getPollInterval());

        if (options.getCancellation() == null) {
            throw new ListenerConfigurationException("Cancellation signal cannot be null");
        }
        if (options.getReconnectPolicy() == null) {
            throw new ListenerConfigurationException("Reconnect policy cannot be null");
        }

        if (options.getDriver() != null) {
            log.debug("Using supplied notification driver for channel {}", channel);
            return options.getDriver();
        }
        return new PgJdbcNotificationDriver(PgConnectionUrls.toJdbcUrl(options.getConnectionUrl()));
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ListenerConfigurationException(name + " cannot be null or negative: " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ListenerConfigurationException(name + " must be positive: " + value);
        }
    }
}
