package io.relay;

import io.relay.breaker.BreakerSettings;
import io.relay.ledger.DailyResetCalendar;
import io.relay.poll.DeviceConfig;
import io.relay.retry.ExponentialBackoffRetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated, immutable configuration of a {@link Relay}.
 *
 * <p>All checks run in {@link Builder#build()}; any violation is reported as a
 * {@link RelayConfigException} naming the offending setting.
 */
public final class RelayConfig {
  private final List<DeviceConfig> devices;
  private final Duration pollPeriod;
  private final Duration cycleTimeout;
  private final int workerCount;
  private final BreakerSettings deviceBreaker;
  private final BreakerSettings sinkBreaker;
  private final ExponentialBackoffRetryPolicy pollRetry;
  private final ExponentialBackoffRetryPolicy connectRetry;
  private final int queueCapacity;
  private final int batchSize;
  private final int maxSendAttempts;
  private final Duration throttleInterval;
  private final Duration drainTimeout;
  private final DailyResetCalendar calendar;
  private final String destinationPrefix;

  private RelayConfig(Builder b) {
    this.devices = List.copyOf(b.devices);
    this.pollPeriod = b.pollPeriod;
    this.cycleTimeout = b.cycleTimeout != null ? b.cycleTimeout : b.pollPeriod;
    this.workerCount = b.workerCount;
    this.deviceBreaker = b.deviceBreaker;
    this.sinkBreaker = b.sinkBreaker;
    this.pollRetry = b.pollRetry;
    this.connectRetry = b.connectRetry;
    this.queueCapacity = b.queueCapacity;
    this.batchSize = b.batchSize;
    this.maxSendAttempts = b.maxSendAttempts;
    this.throttleInterval = b.throttleInterval;
    this.drainTimeout = b.drainTimeout;
    this.calendar = b.calendar;
    this.destinationPrefix = b.destinationPrefix;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<DeviceConfig> devices() {
    return devices;
  }

  public Duration pollPeriod() {
    return pollPeriod;
  }

  public Duration cycleTimeout() {
    return cycleTimeout;
  }

  /** Worker pool size; {@code 0} means one worker per device. */
  public int workerCount() {
    return workerCount;
  }

  public BreakerSettings deviceBreaker() {
    return deviceBreaker;
  }

  public BreakerSettings sinkBreaker() {
    return sinkBreaker;
  }

  public ExponentialBackoffRetryPolicy pollRetry() {
    return pollRetry;
  }

  public ExponentialBackoffRetryPolicy connectRetry() {
    return connectRetry;
  }

  public int queueCapacity() {
    return queueCapacity;
  }

  public int batchSize() {
    return batchSize;
  }

  public int maxSendAttempts() {
    return maxSendAttempts;
  }

  public Duration throttleInterval() {
    return throttleInterval;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public DailyResetCalendar calendar() {
    return calendar;
  }

  public String destinationPrefix() {
    return destinationPrefix;
  }

  /** Builder for {@link RelayConfig}. Defaults follow a typical 60-second polling deployment. */
  public static final class Builder {
    private final List<DeviceConfig> devices = new ArrayList<>();
    private Duration pollPeriod = Duration.ofSeconds(60);
    private Duration cycleTimeout;
    private int workerCount;
    private int deviceFailureThreshold = BreakerSettings.DEVICE_DEFAULTS.failureThreshold();
    private Duration deviceOpenDuration = BreakerSettings.DEVICE_DEFAULTS.openDuration();
    private int sinkFailureThreshold = BreakerSettings.SINK_DEFAULTS.failureThreshold();
    private Duration sinkOpenDuration = BreakerSettings.SINK_DEFAULTS.openDuration();
    private ExponentialBackoffRetryPolicy pollRetry = ExponentialBackoffRetryPolicy.devicePolls();
    private ExponentialBackoffRetryPolicy connectRetry = ExponentialBackoffRetryPolicy.sinkConnects();
    private int queueCapacity = 1000;
    private int batchSize = 50;
    private int maxSendAttempts = 10;
    private Duration throttleInterval = Duration.ofMillis(100);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private int resetHour = 23;
    private String timezone = "UTC";
    private String destinationPrefix = "telemetry";

    private BreakerSettings deviceBreaker;
    private BreakerSettings sinkBreaker;
    private DailyResetCalendar calendar;

    private Builder() {
    }

    public Builder device(DeviceConfig device) {
      devices.add(device);
      return this;
    }

    public Builder devices(List<DeviceConfig> devices) {
      this.devices.addAll(devices);
      return this;
    }

    public Builder pollPeriod(Duration pollPeriod) {
      this.pollPeriod = pollPeriod;
      return this;
    }

    /** Defaults to the poll period. */
    public Builder cycleTimeout(Duration cycleTimeout) {
      this.cycleTimeout = cycleTimeout;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder deviceBreaker(int failureThreshold, Duration openDuration) {
      this.deviceFailureThreshold = failureThreshold;
      this.deviceOpenDuration = openDuration;
      return this;
    }

    public Builder sinkBreaker(int failureThreshold, Duration openDuration) {
      this.sinkFailureThreshold = failureThreshold;
      this.sinkOpenDuration = openDuration;
      return this;
    }

    public Builder pollRetry(ExponentialBackoffRetryPolicy pollRetry) {
      this.pollRetry = pollRetry;
      return this;
    }

    public Builder connectRetry(ExponentialBackoffRetryPolicy connectRetry) {
      this.connectRetry = connectRetry;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxSendAttempts(int maxSendAttempts) {
      this.maxSendAttempts = maxSendAttempts;
      return this;
    }

    public Builder throttleInterval(Duration throttleInterval) {
      this.throttleInterval = throttleInterval;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /** Hour (0-23) at which the daily counters reset. Defaults to 23. */
    public Builder resetHour(int resetHour) {
      this.resetHour = resetHour;
      return this;
    }

    /** Timezone id used for the daily reset. Defaults to {@code UTC}. */
    public Builder timezone(String timezone) {
      this.timezone = timezone;
      return this;
    }

    public Builder destinationPrefix(String destinationPrefix) {
      this.destinationPrefix = destinationPrefix;
      return this;
    }

    /**
     * @throws RelayConfigException if any setting is invalid
     */
    public RelayConfig build() {
      if (devices.isEmpty()) {
        throw new RelayConfigException("at least one device must be configured");
      }
      Set<String> ids = new HashSet<>();
      for (DeviceConfig device : devices) {
        if (device == null) {
          throw new RelayConfigException("devices cannot contain null");
        }
        if (!ids.add(device.id())) {
          throw new RelayConfigException("duplicate device id: " + device.id());
        }
      }
      requirePositive("pollPeriod", pollPeriod);
      if (cycleTimeout != null) {
        requirePositive("cycleTimeout", cycleTimeout);
      }
      requirePositive("throttleInterval", throttleInterval);
      if (drainTimeout == null || drainTimeout.isNegative()) {
        throw new RelayConfigException("drainTimeout must be >= 0");
      }
      if (workerCount < 0) {
        throw new RelayConfigException("workerCount must be >= 0, got: " + workerCount);
      }
      if (queueCapacity <= 0) {
        throw new RelayConfigException("queueCapacity must be > 0, got: " + queueCapacity);
      }
      if (batchSize <= 0) {
        throw new RelayConfigException("batchSize must be > 0, got: " + batchSize);
      }
      if (maxSendAttempts < 1) {
        throw new RelayConfigException("maxSendAttempts must be >= 1, got: " + maxSendAttempts);
      }
      if (pollRetry == null || connectRetry == null) {
        throw new RelayConfigException("retry policies must be set");
      }
      if (pollRetry.maxAttempts() == 0) {
        throw new RelayConfigException("device polls need a bounded attempt budget");
      }
      if (destinationPrefix == null || destinationPrefix.isBlank()) {
        throw new RelayConfigException("destinationPrefix must be set");
      }
      deviceBreaker = breaker("device", deviceFailureThreshold, deviceOpenDuration);
      sinkBreaker = breaker("sink", sinkFailureThreshold, sinkOpenDuration);
      calendar = DailyResetCalendar.of(resetHour, timezone);
      return new RelayConfig(this);
    }

    private static BreakerSettings breaker(String target, int threshold, Duration openDuration) {
      try {
        return new BreakerSettings(threshold, openDuration);
      } catch (IllegalArgumentException | NullPointerException e) {
        throw new RelayConfigException("invalid " + target + " breaker settings: " + e.getMessage(), e);
      }
    }

    private static void requirePositive(String name, Duration value) {
      if (value == null || value.isNegative() || value.isZero()) {
        throw new RelayConfigException(name + " must be positive, got: " + value);
      }
    }
  }
}
