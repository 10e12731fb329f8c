package eventsource.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} records to/from JSON.
 *
 * <p>Used for the file event log, filesystem snapshots and relational notification
 * envelopes. The default implementation ({@link DefaultJsonCodec}) has no dependencies
 * and only supports flat objects whose values are strings, numbers, booleans or null.
 * Applications that already carry Jackson or Gson can implement this interface to
 * delegate to their preferred library.
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
     * Encodes a flat record as a JSON object string. Entry order follows the map's
     * iteration order; {@code null} values are written as JSON {@code null}.
     *
     * @param record the record to encode
     * @return JSON string, or {@code null} if {@code record} is null
     */
    String toJson(Map<String, String> record);

    /**
     * Parses a flat JSON object into a string map. Number and boolean values are
     * returned as their literal text; {@code null} values are omitted.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null}); empty for {@code null}, blank or {@code "null"} input
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
