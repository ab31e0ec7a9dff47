package relay.util;

import java.util.Map;

/**
 * Codec for the JSON documents stored in the outbox {@code payload} column.
 *
 * <p>The default implementation delegates to Jackson. Supply another implementation to
 * reuse an application-wide {@code ObjectMapper}.
 *
 * @see #getDefault()
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map (values may be nested maps, lists, strings, numbers or booleans).
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    String toJson(Map<String, ?> value);

    /**
     * Parses a JSON object.
     *
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
