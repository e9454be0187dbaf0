package com.omniva.pglistener.autoconfigure;

import com.omniva.pglistener.engine.PgListenerEngine;
import com.omniva.pglistener.engine.crankshaft.policy.ExponentialBackoffPolicy;
import com.omniva.pglistener.engine.crankshaft.policy.FixedBackoffPolicy;
import com.omniva.pglistener.engine.crankshaft.policy.ReconnectPolicy;
import com.omniva.pglistener.engine.fuelsystem.DataSourceNotificationDriver;
import com.omniva.pglistener.engine.fuelsystem.NotificationDriver;
import com.omniva.pglistener.engine.ignition.PgConnectionUrls;
import com.omniva.pglistener.messaging.listener.ChannelListenerRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the PG Listener Engine
 * Enabled by default, can be disabled with: pg-listener.enabled=false
 * <p>
 * Notification connections come from a dedicated HikariCP pool built from
 * {@code pg-listener.datasource.*}. Supplying a {@link NotificationDriver} bean replaces it.
 */
@AutoConfiguration
@ConditionalOnClass(PgListenerEngine.class)
@ConditionalOnProperty(prefix = "pg-listener", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PgListenerProperties.class)
public class PgListenerAutoConfiguration {

    // 1. Data layer

    @Bean("pgListenerHikariConfig")
    @ConditionalOnMissingBean(name = "pgListenerHikariConfig")
    @ConditionalOnProperty(prefix = "pg-listener.datasource", name = "url")
    public HikariConfig pgListenerHikariConfig(PgListenerProperties properties) {
        HikariConfig hikariConfig = new HikariConfig();
        PgListenerProperties.DataSourceConfig datasource = properties.getDatasource();
        PgListenerProperties.DataSourceConfig.HikariProperties hikariProps = datasource.getHikari();

        // Basic connection settings
        hikariConfig.setJdbcUrl(PgConnectionUrls.toJdbcUrl(datasource.getUrl()));
        hikariConfig.setUsername(datasource.getUsername());
        hikariConfig.setPassword(datasource.getPassword());
        hikariConfig.setDriverClassName("org.postgresql.Driver");

        // Pool settings
        hikariConfig.setMaximumPoolSize(hikariProps.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(hikariProps.getMinimumIdle());
        hikariConfig.setConnectionTimeout(hikariProps.getConnectionTimeout());
        hikariConfig.setIdleTimeout(hikariProps.getIdleTimeout());
        hikariConfig.setMaxLifetime(hikariProps.getMaxLifetime());
        hikariConfig.setPoolName(hikariProps.getPoolName());
        hikariConfig.setInitializationFailTimeout(hikariProps.getInitializationFailTimeout());
        // LISTEN only takes effect outside a transaction block
        hikariConfig.setAutoCommit(true);

        if (hikariProps.getDataSourceProperties() != null) {
            hikariProps.getDataSourceProperties().forEach(hikariConfig::addDataSourceProperty);
        }
        return hikariConfig;
    }

    @Bean(name = "pgListenerDataSource", destroyMethod = "close")
    @ConditionalOnMissingBean(name = "pgListenerDataSource")
    @ConditionalOnProperty(prefix = "pg-listener.datasource", name = "url")
    public HikariDataSource pgListenerDataSource(@Qualifier("pgListenerHikariConfig") HikariConfig config) {
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "pg-listener.datasource", name = "url")
    public NotificationDriver pgListenerNotificationDriver(@Qualifier("pgListenerDataSource") DataSource dataSource) {
        return new DataSourceNotificationDriver(dataSource);
    }

    // 2. Configuration

    @Bean
    @ConditionalOnMissingBean
    public ReconnectPolicy pgListenerReconnectPolicy(PgListenerProperties properties) {
        PgListenerProperties.ReconnectConfig reconnect = properties.getReconnect();
        if (reconnect.isExponential()) {
            return new ExponentialBackoffPolicy(reconnect.getBaseDelay(), reconnect.getMaxDelay());
        }
        return new FixedBackoffPolicy(reconnect.getBaseDelay());
    }

    // 3. Listener discovery and engine

    @Bean
    @ConditionalOnMissingBean
    public ChannelListenerRegistry channelListenerRegistry(ApplicationContext applicationContext) {
        return new ChannelListenerRegistry(applicationContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public PgListenerEngine pgListenerEngine(ChannelListenerRegistry listenerRegistry,
                                             ObjectProvider<NotificationDriver> driver,
                                             ReconnectPolicy reconnectPolicy,
                                             PgListenerProperties properties) {
        return new PgListenerEngine(
                listenerRegistry,
                driver.getIfAvailable(),
                reconnectPolicy,
                properties.getReceive().getPollInterval(),
                properties.getShutdown().getGracefulTimeout()
        );
    }
}
