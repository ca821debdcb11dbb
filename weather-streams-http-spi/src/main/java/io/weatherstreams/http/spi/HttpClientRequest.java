package io.weatherstreams.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A request whose response body is read as a stream.
 *
 * <p>Immutable. Header names are case-insensitive; setting a header twice keeps the last value.
 * Only {@code GET} (subscriptions) and {@code POST} (request-scoped streams) are supported, and
 * only a {@code POST} carries a body.
 */
public final class HttpClientRequest {

    public static final String GET = "GET";
    public static final String POST = "POST";

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder b) {
        this.uri = b.uri;
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new TreeMap<>(b.headers));
        this.body = b.body;
        this.timeout = b.timeout;
    }

    public static Builder get(URI uri) {
        return new Builder(uri, GET);
    }

    public static Builder post(URI uri) {
        return new Builder(uri, POST);
    }

    public URI uri() {
        return uri;
    }

    public String method() {
        return method;
    }

    /** @return all headers, keyed case-insensitively */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /** @return the request body, or {@code null} for a {@code GET} */
    public byte[] body() {
        return body;
    }

    /**
     * Time allowed until the response headers arrive. Reading the body is not bounded by it.
     *
     * @return the timeout, or {@code null} for the client's default
     */
    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = Objects.requireNonNull(uri, "uri");
            this.method = method;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder body(byte[] body) {
            if (body != null && !POST.equals(method)) {
                throw new IllegalArgumentException(method + " requests carry no body");
            }
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be > 0");
            }
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
