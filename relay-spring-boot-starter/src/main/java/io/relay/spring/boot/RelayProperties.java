package io.relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the telemetry relay.
 *
 * <pre>
 * relay.devices[0].id=inverter-roof
 * relay.devices[0].host=192.168.1.50
 * relay.poll.period=60s
 * relay.ledger.reset-hour=23
 * </pre>
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Start polling and publishing as soon as the context is ready.
     */
    private boolean autoStart = true;

    private List<Device> devices = new ArrayList<>();
    private final Poll poll = new Poll();
    private final Breaker deviceBreaker = new Breaker(5, Duration.ofSeconds(60));
    private final Breaker sinkBreaker = new Breaker(5, Duration.ofSeconds(30));
    private final Publisher publisher = new Publisher();
    private final Ledger ledger = new Ledger();
    private final Metrics metrics = new Metrics();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public List<Device> getDevices() {
        return devices;
    }

    public void setDevices(List<Device> devices) {
        this.devices = devices;
    }

    public Poll getPoll() {
        return poll;
    }

    public Breaker getDeviceBreaker() {
        return deviceBreaker;
    }

    public Breaker getSinkBreaker() {
        return sinkBreaker;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Device {
        private String id;
        private String host;
        private int port = 502;
        private int unitId = 1;
        private Duration timeout = Duration.ofSeconds(10);

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getUnitId() {
            return unitId;
        }

        public void setUnitId(int unitId) {
            this.unitId = unitId;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Poll {
        private Duration period = Duration.ofSeconds(60);
        /**
         * Deadline for one cycle. Defaults to the period when unset.
         */
        private Duration cycleTimeout;
        /**
         * Worker threads; 0 means one per device.
         */
        private int workerCount = 0;
        private final Retry retry = new Retry(3, 500, 5000);

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        public Duration getCycleTimeout() {
            return cycleTimeout;
        }

        public void setCycleTimeout(Duration cycleTimeout) {
            this.cycleTimeout = cycleTimeout;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Retry getRetry() {
            return retry;
        }
    }

    public static class Retry {
        private int maxAttempts;
        private long baseDelayMs;
        private double multiplier = 2.0;
        private long maxDelayMs;
        private double jitter = 0.2;

        Retry(int maxAttempts, long baseDelayMs, long maxDelayMs) {
            this.maxAttempts = maxAttempts;
            this.baseDelayMs = baseDelayMs;
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class Breaker {
        private int failureThreshold;
        private Duration openDuration;

        Breaker(int failureThreshold, Duration openDuration) {
            this.failureThreshold = failureThreshold;
            this.openDuration = openDuration;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getOpenDuration() {
            return openDuration;
        }

        public void setOpenDuration(Duration openDuration) {
            this.openDuration = openDuration;
        }
    }

    public static class Publisher {
        private int queueCapacity = 1000;
        private int batchSize = 50;
        private int maxSendAttempts = 10;
        private Duration throttleInterval = Duration.ofMillis(100);
        private Duration drainTimeout = Duration.ofSeconds(5);
        private String destinationPrefix = "telemetry";
        private final Retry connectRetry = new Retry(5, 1000, 30000);

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxSendAttempts() {
            return maxSendAttempts;
        }

        public void setMaxSendAttempts(int maxSendAttempts) {
            this.maxSendAttempts = maxSendAttempts;
        }

        public Duration getThrottleInterval() {
            return throttleInterval;
        }

        public void setThrottleInterval(Duration throttleInterval) {
            this.throttleInterval = throttleInterval;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public String getDestinationPrefix() {
            return destinationPrefix;
        }

        public void setDestinationPrefix(String destinationPrefix) {
            this.destinationPrefix = destinationPrefix;
        }

        public Retry getConnectRetry() {
            return connectRetry;
        }
    }

    public static class Ledger {
        private int resetHour = 23;
        private String timezone = "UTC";
        /**
         * Key-value table used when the store is created from the DataSource.
         */
        private String tableName = "relay_kv";
        private boolean createTable = true;

        public int getResetHour() {
            return resetHour;
        }

        public void setResetHour(int resetHour) {
            this.resetHour = resetHour;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public boolean isCreateTable() {
            return createTable;
        }

        public void setCreateTable(boolean createTable) {
            this.createTable = createTable;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
