package io.weatherstreams.http.spi;

import java.net.URI;

/**
 * A streaming request could not be sent or its response headers never arrived.
 *
 * <p>Adapters wrap the client library's own exception as the cause.
 */
public class HttpClientException extends Exception {

    private final URI uri;

    public HttpClientException(URI uri, String message) {
        this(uri, message, null);
    }

    public HttpClientException(URI uri, String message, Throwable cause) {
        super(uri == null ? message : message + " (" + uri + ")", cause);
        this.uri = uri;
    }

    /** @return the request target, or {@code null} if unknown */
    public URI uri() {
        return uri;
    }
}
