package io.relay.util;

import java.util.Map;

/**
 * Codec between JSON text and plain Java maps.
 *
 * <p>Used for ledger records and outbound telemetry payloads. The default implementation
 * ({@link DefaultJsonCodec}) has no dependencies. Applications that already ship Jackson or
 * Gson can implement this interface and hand it to the ledger and envelope composer.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object.
     *
     * <p>Values may be {@code null}, strings, numbers, booleans, nested maps with string keys,
     * or collections of those.
     *
     * @param object the map to encode
     * @return JSON object text, {@code "{}"} for a null or empty map
     * @throws IllegalArgumentException if a key is null or a value has an unsupported type
     */
    String toJson(Map<String, ?> object);

    /**
     * Parses a flat JSON object. String values stay strings, integral numbers become
     * {@link Long}, other numbers {@link Double}, {@code true}/{@code false} become
     * {@link Boolean}. Members whose value is {@code null} are omitted.
     *
     * @param json the JSON text
     * @return the parsed members in document order (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, Object> parseObject(String json);
}
