package io.weatherstreams.http.spi;

import java.net.URI;
import java.time.Duration;

/** The response headers did not arrive within {@link HttpClientRequest#timeout()}. */
public class HttpTimeoutException extends HttpClientException {

    private final Duration timeout;

    public HttpTimeoutException(URI uri, Duration timeout, Throwable cause) {
        super(uri, timeout == null ? "timed out" : "no response within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    /** @return the timeout that elapsed, or {@code null} if the client default applied */
    public Duration timeout() {
        return timeout;
    }
}
