package io.weatherstreams.client;

import io.weatherstreams.core.FrameReader;
import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;
import io.weatherstreams.http.spi.HttpClientAdapter;
import io.weatherstreams.http.spi.HttpClientException;
import io.weatherstreams.http.spi.HttpClientRequest;
import io.weatherstreams.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Internal implementation of a request-scoped stream.
 *
 * <p>Sends one request, reads its event-stream body to the end and reports each frame. There is no
 * reconnect. Callbacks are dispatched under a lock that {@link #cancel()} also takes, so nothing is
 * delivered once cancel has returned.
 */
public final class RequestStream implements StreamHandle {

    private static final Logger log = LoggerFactory.getLogger(RequestStream.class);

    private final HttpClientRequest request;
    private final HttpClientAdapter http;
    private final RequestStreamListener listener;

    private final Object lock = new Object();

    // guarded by lock
    private boolean started;
    private boolean closed;
    private HttpClientResponse response;
    private Future<?> readTask;

    public RequestStream(HttpClientRequest request, HttpClientAdapter http, RequestStreamListener listener) {
        this.request = Objects.requireNonNull(request, "request");
        this.http = Objects.requireNonNull(http, "http");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Sends the request on a task of {@code executor}. Only the first call has an effect.
     *
     * @param executor the executor running the read loop
     */
    public void start(ExecutorService executor) {
        synchronized (lock) {
            if (started || closed) return;
            started = true;
            log.info("Starting request stream {} {}", request.method(), request.uri());
            readTask = executor.submit(this::run);
        }
    }

    @Override
    public void cancel() {
        HttpClientResponse open;
        Future<?> task;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            open = response;
            response = null;
            task = readTask;
            readTask = null;
            log.info("Request stream {} aborted", request.uri());
            dispatch(listener::onComplete);
        }
        if (open != null) open.close();
        if (task != null) task.cancel(true);
    }

    @Override
    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void run() {
        HttpClientResponse resp;
        try {
            resp = http.open(request);
        } catch (HttpClientException e) {
            finish(new WeatherStreamsException.ConnectionLost("request to " + request.uri() + " failed", e));
            return;
        }

        synchronized (lock) {
            if (closed) {
                resp.close();
                return;
            }
            response = resp;
        }

        try {
            if (!resp.isSuccessful()) {
                String detail = Responses.errorDetail(resp, log);
                finish(new WeatherStreamsException.UnexpectedStatus(resp.statusCode(), detail));
                return;
            }
            InputStream body = resp.body();
            if (body == null) {
                finish(new WeatherStreamsException.ConnectionLost("response of " + request.uri() + " has no body"));
                return;
            }
            Responses.checkEventStream(resp, request.uri(), log);

            try (FrameReader reader = new FrameReader(body)) {
                StreamFrame frame;
                while ((frame = reader.nextFrame()) != null) {
                    if (!deliver(frame)) return;
                }
            }
            log.info("Request stream {} completed", request.uri());
            finish(null);
        } catch (IOException e) {
            finish(new WeatherStreamsException.ConnectionLost("reading " + request.uri() + " failed", e));
        } finally {
            resp.close();
        }
    }

    private boolean deliver(StreamFrame frame) {
        synchronized (lock) {
            if (closed) return false;
            log.debug("Request stream {} frame event={} ({} chars)", request.uri(), frame.event(), frame.data().length());
            dispatch(() -> listener.onMessage(frame));
            return !closed;
        }
    }

    private void finish(WeatherStreamsException error) {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            response = null;
            readTask = null;
            if (error != null) {
                log.error("Request stream {} failed", request.uri(), error);
                dispatch(() -> listener.onError(error));
            }
            dispatch(listener::onComplete);
        }
    }

    private void dispatch(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Listener of request stream {} failed", request.uri(), e);
        }
    }
}
