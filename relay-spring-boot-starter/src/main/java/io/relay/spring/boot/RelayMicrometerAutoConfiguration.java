package io.relay.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.relay.micrometer.MicrometerMetricsExporter;
import io.relay.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists, and {@code relay.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link RelayAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link io.relay.Relay}.
 */
@AutoConfiguration(before = RelayAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "relay.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  @ConditionalOnBean(MeterRegistry.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, RelayProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
