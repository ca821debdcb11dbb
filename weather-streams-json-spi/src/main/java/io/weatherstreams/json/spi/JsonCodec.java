package io.weatherstreams.json.spi;

import java.util.Map;

/**
 * JSON support needed by the stream client: encoding request bodies and decoding the
 * {@code data} payload of individual frames.
 *
 * <p>Payloads are small and loosely typed, so they decode to plain maps instead of bound classes.
 * Implementations are looked up through {@link JsonCodecs} and must be thread-safe.
 */
public interface JsonCodec {

    /**
     * @param value a map, list, record or bean to encode
     * @return UTF-8 JSON
     * @throws JsonException if the value cannot be represented as JSON
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Decodes a JSON object. Member order is preserved; nested objects become maps and arrays
     * become lists.
     *
     * @param json the text of one frame payload
     * @return the members of the object
     * @throws JsonException if the text is blank, malformed, or not an object
     */
    Map<String, Object> readObject(String json) throws JsonException;
}
