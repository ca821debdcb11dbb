package io.weatherstreams.http.spi;

import java.io.InputStream;
import java.util.Optional;

/**
 * An open exchange whose body is still streaming.
 */
public interface HttpClientResponse extends AutoCloseable {

    int statusCode();

    /** @return {@code true} for 2xx statuses */
    default boolean isSuccessful() {
        int status = statusCode();
        return status >= 200 && status < 300;
    }

    /**
     * @param name header name, matched case-insensitively
     * @return the first value, if the header was sent
     */
    Optional<String> header(String name);

    /**
     * The raw body. Reads block until the server sends more bytes, the server ends the body, or
     * {@link #close()} is called.
     */
    InputStream body();

    /** Releases the connection. Idempotent and callable from any thread. */
    @Override
    void close();
}
