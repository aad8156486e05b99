package io.relay.ledger;

import io.relay.util.JsonCodec;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat JSON form of {@link ProductionRecord}.
 */
final class RecordCodec {
  private static final int FORMAT_VERSION = 1;

  private final JsonCodec json;

  RecordCodec(JsonCodec json) {
    this.json = json;
  }

  String encode(ProductionRecord record) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("v", FORMAT_VERSION);
    map.put("deviceId", record.deviceId());
    map.put("channelId", record.channelId());
    map.put("total", record.total());
    map.put("today", record.today());
    map.put("lastResetDate", record.lastResetDate().toString());
    map.put("lastUpdated", record.lastUpdated() == null ? null : record.lastUpdated().toString());
    map.put("anomalies", record.anomalies());
    return json.toJson(map);
  }

  ProductionRecord decode(String text) {
    Map<String, Object> map = json.parseObject(text);
    Object lastUpdated = map.get("lastUpdated");
    return new ProductionRecord(
        (String) required(map, "deviceId"),
        number(map, "channelId").intValue(),
        number(map, "total").doubleValue(),
        number(map, "today").doubleValue(),
        LocalDate.parse((String) required(map, "lastResetDate")),
        lastUpdated == null ? null : Instant.parse((String) lastUpdated),
        map.containsKey("anomalies") ? number(map, "anomalies").longValue() : 0L);
  }

  private static Number number(Map<String, Object> map, String key) {
    Object value = required(map, key);
    if (!(value instanceof Number n)) {
      throw new IllegalArgumentException("Field " + key + " is not a number: " + value);
    }
    return n;
  }

  private static Object required(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing field " + key);
    }
    return value;
  }
}
