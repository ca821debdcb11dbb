package io.weatherstreams.http.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter over {@code java.net.http.HttpClient}, used when no other client is configured.
 *
 * <p>The request timeout bounds the wait for the response head only. Once the head is in, the
 * body has no read deadline, so a quiet stream stays open until the server or the caller ends it.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpClientAdapter.class);

    private final HttpClient client;

    private JdkHttpClientAdapter(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public static JdkHttpClientAdapter create(HttpClient client) {
        return new JdkHttpClientAdapter(client);
    }

    @Override
    public HttpClientResponse open(HttpClientRequest request) throws HttpClientException {
        HttpRequest outgoing;
        try {
            outgoing = buildRequest(request);
        } catch (IllegalArgumentException e) {
            throw new HttpClientException(request.uri(), "invalid request: " + e.getMessage(), e);
        }
        try {
            return new JdkResponse(client.send(outgoing, HttpResponse.BodyHandlers.ofInputStream()));
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(request.uri(), "request interrupted", e);
        } catch (IOException e) {
            throw new HttpClientException(request.uri(), "request failed: " + e.getMessage(), e);
        }
    }

    private static HttpRequest buildRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());
        for (var header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        if (HttpClientRequest.POST.equals(request.method())) {
            byte[] body = request.body() == null ? new byte[0] : request.body();
            builder.POST(HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.GET();
        }
        return builder.build();
    }

    private static final class JdkResponse implements HttpClientResponse {
        private final HttpResponse<InputStream> delegate;
        private final AtomicBoolean released = new AtomicBoolean();

        JdkResponse(HttpResponse<InputStream> delegate) {
            this.delegate = delegate;
        }

        @Override
        public int statusCode() {
            return delegate.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return delegate.headers().firstValue(name);
        }

        @Override
        public InputStream body() {
            return delegate.body();
        }

        @Override
        public void close() {
            if (released.getAndSet(true)) return;
            try (InputStream in = delegate.body()) {
                log.trace("Releasing stream from {}", delegate.uri());
            } catch (IOException e) {
                log.debug("Failed to release stream from {}", delegate.uri(), e);
            }
        }
    }
}
