package io.weatherstreams.client;

import io.weatherstreams.core.Protocol;
import io.weatherstreams.core.WeatherStreamsException;
import io.weatherstreams.http.spi.HttpClientAdapter;
import io.weatherstreams.http.spi.HttpClientRequest;
import io.weatherstreams.json.spi.JsonCodec;
import io.weatherstreams.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

final class DefaultWeatherStreamsClient implements WeatherStreamsClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultWeatherStreamsClient.class);

    private final HttpClientAdapter http;
    private final JsonCodec json;
    private final WeatherStreamsSettings settings;
    private final ExecutorService executor;
    private final ReconnectScheduler scheduler;
    private final RagEventInterpreter interpreter;
    private final ExecutorService ownedExecutor;
    private final ScheduledExecutorService ownedTimer;

    private final Set<StreamHandle> open = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    DefaultWeatherStreamsClient(HttpClientAdapter http,
                                JsonCodec json,
                                WeatherStreamsSettings settings,
                                ExecutorService executor,
                                ReconnectScheduler scheduler,
                                RagEventInterpreter interpreter,
                                ExecutorService ownedExecutor,
                                ScheduledExecutorService ownedTimer) {
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.ownedExecutor = ownedExecutor;
        this.ownedTimer = ownedTimer;
    }

    @Override
    public EventStreamConnection subscribe(URI url, StreamOptions options, EventStreamListener listener) {
        ensureOpen();
        requireStreaming();
        EventStreamConnection connection = new EventStreamConnection(url, options, http, executor, scheduler, listener);
        track(connection);
        connection.connect();
        return connection;
    }

    @Override
    public StreamHandle post(URI url, Object body, RequestStreamListener listener) {
        ensureOpen();
        requireStreaming();
        return startRequest(url, body, listener);
    }

    @Override
    public StreamHandle ragStream(URI url, Object body, RagStreamListener listener) {
        ensureOpen();
        if (!settings.ragEnabled()) {
            throw new WeatherStreamsException.FeatureDisabled("rag");
        }
        requireStreaming();
        return startRequest(url, body, new RagEventDispatcher(interpreter, Objects.requireNonNull(listener, "listener")));
    }

    @Override
    public WeatherStreamsSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        List<StreamHandle> handles = new ArrayList<>(open);
        open.clear();
        log.info("Closing weather streams client ({} open streams)", handles.size());
        for (StreamHandle handle : handles) {
            handle.cancel();
        }
        if (ownedTimer != null) ownedTimer.shutdownNow();
        if (ownedExecutor != null) ownedExecutor.shutdownNow();
    }

    private StreamHandle startRequest(URI url, Object body, RequestStreamListener listener) {
        Objects.requireNonNull(url, "url");
        HttpClientRequest request = HttpClientRequest.post(url)
                .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, Protocol.NO_CACHE)
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .headers(settings.streamOptions().headers())
                .timeout(settings.streamOptions().connectTimeout())
                .body(encode(body))
                .build();
        RequestStream stream = new RequestStream(request, http, listener);
        track(stream);
        stream.start(executor);
        return stream;
    }

    private byte[] encode(Object body) {
        Objects.requireNonNull(body, "body");
        if (body instanceof byte[] bytes) return bytes;
        if (body instanceof String text) return text.getBytes(StandardCharsets.UTF_8);
        try {
            return json.writeBytes(body);
        } catch (JsonException e) {
            throw new IllegalArgumentException("cannot encode request body of type " + body.getClass().getName(), e);
        }
    }

    private void track(StreamHandle handle) {
        open.removeIf(StreamHandle::isClosed);
        open.add(handle);
    }

    private void requireStreaming() {
        if (!settings.streamingEnabled()) {
            throw new WeatherStreamsException.FeatureDisabled("streaming");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("client is closed");
        }
    }
}
