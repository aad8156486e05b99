package io.relay.spring.boot;

import io.relay.Relay;
import io.relay.RelayConfig;
import io.relay.RelayConfigException;
import io.relay.jdbc.JdbcKeyValueStore;
import io.relay.ledger.RolloverListener;
import io.relay.poll.DeviceConfig;
import io.relay.poll.EnvelopeComposer;
import io.relay.retry.ExponentialBackoffRetryPolicy;
import io.relay.spi.DeviceClient;
import io.relay.spi.KeyValueStore;
import io.relay.spi.MetricsExporter;
import io.relay.spi.Sink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the telemetry relay.
 *
 * <p>Builds a {@link RelayConfig} from {@link RelayProperties}, a JDBC-backed
 * {@link KeyValueStore} when a {@link DataSource} is present, and a {@link Relay} once the
 * application supplies a {@link DeviceClient} and a {@link Sink}.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Relay.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    @ConditionalOnBean(DataSource.class)
    public JdbcKeyValueStore relayKeyValueStore(DataSource dataSource, RelayProperties props) {
        JdbcKeyValueStore store = JdbcKeyValueStore.create(dataSource, props.getLedger().getTableName());
        if (props.getLedger().isCreateTable()) {
            store.createTableIfMissing();
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public RelayConfig relayConfig(RelayProperties props) {
        RelayConfig.Builder builder = RelayConfig.builder();
        for (RelayProperties.Device device : props.getDevices()) {
            builder.device(toDeviceConfig(device));
        }
        RelayProperties.Poll poll = props.getPoll();
        RelayProperties.Publisher publisher = props.getPublisher();
        return builder
                .pollPeriod(poll.getPeriod())
                .cycleTimeout(poll.getCycleTimeout())
                .workerCount(poll.getWorkerCount())
                .pollRetry(toPolicy("relay.poll.retry", poll.getRetry()))
                .deviceBreaker(props.getDeviceBreaker().getFailureThreshold(),
                        props.getDeviceBreaker().getOpenDuration())
                .sinkBreaker(props.getSinkBreaker().getFailureThreshold(),
                        props.getSinkBreaker().getOpenDuration())
                .queueCapacity(publisher.getQueueCapacity())
                .batchSize(publisher.getBatchSize())
                .maxSendAttempts(publisher.getMaxSendAttempts())
                .throttleInterval(publisher.getThrottleInterval())
                .drainTimeout(publisher.getDrainTimeout())
                .destinationPrefix(publisher.getDestinationPrefix())
                .connectRetry(toPolicy("relay.publisher.connect-retry", publisher.getConnectRetry()))
                .resetHour(props.getLedger().getResetHour())
                .timezone(props.getLedger().getTimezone())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({DeviceClient.class, Sink.class})
    public Relay relay(RelayConfig config,
                       RelayProperties props,
                       DeviceClient deviceClient,
                       Sink sink,
                       ObjectProvider<KeyValueStore> storeProvider,
                       ObjectProvider<MetricsExporter> metricsProvider,
                       ObjectProvider<EnvelopeComposer> composerProvider,
                       ObjectProvider<RolloverListener> rolloverListenerProvider) {
        KeyValueStore store = storeProvider.getIfAvailable();
        if (store == null) {
            throw new IllegalStateException(
                    "Relay needs a KeyValueStore bean or a DataSource to build one from");
        }
        Relay.Builder builder = Relay.builder()
                .config(config)
                .deviceClient(deviceClient)
                .sink(sink)
                .store(store);
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        EnvelopeComposer composer = composerProvider.getIfAvailable();
        if (composer != null) {
            builder.composer(composer);
        }
        RolloverListener rolloverListener = rolloverListenerProvider.getIfAvailable();
        if (rolloverListener != null) {
            builder.rolloverListener(rolloverListener);
        }
        Relay relay = builder.build();
        if (props.isAutoStart()) {
            relay.start();
        }
        return relay;
    }

    private static DeviceConfig toDeviceConfig(RelayProperties.Device device) {
        try {
            return new DeviceConfig(device.getId(), device.getHost(), device.getPort(),
                    device.getUnitId(), device.getTimeout());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new RelayConfigException("invalid relay.devices entry " + device.getId()
                    + ": " + e.getMessage(), e);
        }
    }

    private static ExponentialBackoffRetryPolicy toPolicy(String name, RelayProperties.Retry retry) {
        try {
            return new ExponentialBackoffRetryPolicy(retry.getMaxAttempts(), retry.getBaseDelayMs(),
                    retry.getMultiplier(), retry.getMaxDelayMs(), retry.getJitter());
        } catch (IllegalArgumentException e) {
            throw new RelayConfigException("invalid " + name + ": " + e.getMessage(), e);
        }
    }
}
