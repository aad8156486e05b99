/**
 * Service Provider Interfaces (SPI) that integrators implement to plug in devices,
 * downstream sinks, persistence, and metrics.
 *
 * @see io.relay.spi.DeviceClient
 * @see io.relay.spi.Sink
 * @see io.relay.spi.KeyValueStore
 * @see io.relay.spi.MetricsExporter
 */
package io.relay.spi;
