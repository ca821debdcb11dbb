package io.weatherstreams.json.spi;

/**
 * A stream payload could not be decoded, or a request body could not be encoded.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
