package io.relay.poll;

import io.relay.ledger.ProductionRecord;
import io.relay.publish.Envelope;
import io.relay.publish.Priority;
import io.relay.spi.Reading;
import io.relay.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON envelopes: one per read on {@code <prefix>/<deviceId>} with a {@code channels} array,
 * and day summaries on {@code <prefix>/<deviceId>/daily}. Summary ids are derived from the
 * device, channel and date, so a resent summary carries the same id.
 */
public final class DefaultEnvelopeComposer implements EnvelopeComposer {
  public static final String DEFAULT_PREFIX = "telemetry";

  private final String prefix;
  private final JsonCodec json;

  public DefaultEnvelopeComposer() {
    this(DEFAULT_PREFIX, JsonCodec.getDefault());
  }

  public DefaultEnvelopeComposer(String prefix, JsonCodec json) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public List<Envelope> compose(DeviceConfig device, List<Reading> readings, Instant observedAt) {
    if (readings.isEmpty()) {
      return List.of();
    }
    List<Map<String, Object>> channels = new ArrayList<>(readings.size());
    for (Reading reading : readings) {
      Map<String, Object> channel = new LinkedHashMap<>(reading.metadata());
      channel.put("channelId", reading.channelId());
      channel.put("today", reading.today());
      channel.put("total", reading.total());
      channels.add(channel);
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", "reading");
    body.put("deviceId", device.id());
    body.put("observedAt", observedAt.toString());
    body.put("channels", channels);
    return List.of(Envelope.builder(prefix + "/" + device.id())
        .payload(json.toJson(body).getBytes(StandardCharsets.UTF_8))
        .createdAt(observedAt)
        .build());
  }

  @Override
  public Envelope daySummary(LocalDate finalizedDate, double finalizedToday, ProductionRecord record) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", "daySummary");
    body.put("deviceId", record.deviceId());
    body.put("channelId", record.channelId());
    body.put("date", finalizedDate.toString());
    body.put("today", finalizedToday);
    body.put("total", record.total());
    return Envelope.builder(prefix + "/" + record.deviceId() + "/daily")
        .envelopeId("daily-" + record.deviceId() + "-" + record.channelId() + "-" + finalizedDate)
        .payload(json.toJson(body).getBytes(StandardCharsets.UTF_8))
        .priority(Priority.HIGH)
        .createdAt(record.lastUpdated())
        .build();
  }
}
