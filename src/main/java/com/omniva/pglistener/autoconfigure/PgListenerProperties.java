package com.omniva.pglistener.autoconfigure;

import com.omniva.pglistener.config.ListenOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "pg-listener")
public class PgListenerProperties {

    private boolean enabled = true;

    @NestedConfigurationProperty
    private DataSourceConfig datasource = new DataSourceConfig();

    @NestedConfigurationProperty
    private ReconnectConfig reconnect = new ReconnectConfig();

    @NestedConfigurationProperty
    private ReceiveConfig receive = new ReceiveConfig();

    @NestedConfigurationProperty
    private ShutdownConfig shutdown = new ShutdownConfig();

    @Data
    public static class DataSourceConfig {
        /** JDBC or postgres:// URL */
        private String url;
        private String username;
        private String password;

        @NestedConfigurationProperty
        private HikariProperties hikari = new HikariProperties();

        @Data
        public static class HikariProperties {
            private int maximumPoolSize = 10; // One connection held per channel
            private int minimumIdle = 1;
            private long connectionTimeout = 5000; // Bounds how long a reconnect attempt ignores cancellation
            private long idleTimeout = 0; // Listening connections sit idle by nature
            private long maxLifetime = 0; // Never retire a subscribed connection
            private String poolName = "PgListenerPool";
            private long initializationFailTimeout = 1;
            private Map<String, String> dataSourceProperties = getDefaultDataSourceProperties();

            private static Map<String, String> getDefaultDataSourceProperties() {
                Map<String, String> defaults = new HashMap<>();
                defaults.put("ApplicationName", "pg-listener");
                defaults.put("tcpKeepAlive", "true");
                defaults.put("connectTimeout", "5");
                defaults.put("loginTimeout", "5");
                return defaults;
            }
        }
    }

    @Data
    public static class ReconnectConfig {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private boolean exponential = false;
    }

    @Data
    public static class ReceiveConfig {
        private Duration pollInterval = ListenOptions.DEFAULT_POLL_INTERVAL;
    }

    @Data
    public static class ShutdownConfig {
        private Duration gracefulTimeout = Duration.ofSeconds(10);
    }
}
