package io.relay.spi;

import java.util.Map;

/**
 * One channel's counters as reported by a device.
 *
 * @param channelId channel (port) number on the device
 * @param today     energy produced so far in the current business day
 * @param total     lifetime cumulative energy
 * @param metadata  extra values forwarded with the telemetry (power, voltage, ...)
 */
public record Reading(int channelId, double today, double total, Map<String, Object> metadata) {

  public Reading {
    if (channelId < 0) {
      throw new IllegalArgumentException("channelId must be >= 0, got: " + channelId);
    }
    if (!Double.isFinite(today) || !Double.isFinite(total)) {
      throw new IllegalArgumentException("today and total must be finite, got: " + today + ", " + total);
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public Reading(int channelId, double today, double total) {
    this(channelId, today, total, Map.of());
  }
}
