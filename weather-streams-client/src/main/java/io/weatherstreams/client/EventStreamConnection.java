package io.weatherstreams.client;

import io.weatherstreams.core.FrameReader;
import io.weatherstreams.core.Protocol;
import io.weatherstreams.core.ReconnectPolicy;
import io.weatherstreams.core.StreamConnectionState;
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
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * One reconnecting event-stream subscription.
 *
 * <p>Every open attempt builds a fresh request and response and reads it on a task of the
 * executor. When the connection fails, the server ends the body, or the stall watchdog fires, the
 * subscription backs off according to its {@link ReconnectPolicy} and tries again; the attempt
 * counter resets whenever a connection is accepted. Once attempts run out the subscription reports
 * a fatal error and closes.
 *
 * <p>State changes and listener callbacks happen under one lock. Each attempt carries a
 * generation number; work belonging to an older generation (a cancelled read, a timer that lost
 * the race) is discarded, which is what keeps callbacks from firing after {@link #cancel()}.
 */
public final class EventStreamConnection implements StreamHandle {

    private static final Logger log = LoggerFactory.getLogger(EventStreamConnection.class);

    private final URI url;
    private final StreamOptions options;
    private final HttpClientAdapter http;
    private final ExecutorService executor;
    private final ReconnectScheduler scheduler;
    private final EventStreamListener listener;

    private final Object lock = new Object();

    // guarded by lock
    private StreamConnectionState state = StreamConnectionState.DISCONNECTED;
    private long generation;
    private int attempts;
    private ReconnectPolicy policy;
    private String lastEventId;
    private HttpClientResponse response;
    private Future<?> readTask;
    private ReconnectScheduler.Cancellable pendingReconnect;
    private ReconnectScheduler.Cancellable watchdog;

    public EventStreamConnection(URI url,
                                 StreamOptions options,
                                 HttpClientAdapter http,
                                 ExecutorService executor,
                                 ReconnectScheduler scheduler,
                                 EventStreamListener listener) {
        this.url = Objects.requireNonNull(url, "url");
        this.options = Objects.requireNonNull(options, "options");
        this.http = Objects.requireNonNull(http, "http");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.policy = options.reconnectPolicy();
    }

    /**
     * Opens the stream. Calling it again while the subscription is connecting, connected or
     * waiting to reconnect has no effect.
     *
     * @throws IllegalStateException if the subscription was closed
     */
    public void connect() {
        synchronized (lock) {
            if (state.isActive()) {
                log.debug("Stream {} is already {}, ignoring connect()", url, state);
                return;
            }
            if (state == StreamConnectionState.CLOSED) {
                throw new IllegalStateException("Stream " + url + " is closed; open a new subscription");
            }
            log.info("Connecting to event stream {}", url);
            transition(StreamConnectionState.CONNECTING);
            startAttempt();
        }
    }

    /** Same as {@link #cancel()}. */
    public void disconnect() {
        cancel();
    }

    @Override
    public void cancel() {
        HttpClientResponse open;
        Future<?> task;
        synchronized (lock) {
            if (state == StreamConnectionState.CLOSED) return;
            generation++;
            cancelTimers();
            open = response;
            response = null;
            task = readTask;
            readTask = null;
            log.info("Disconnecting from event stream {}", url);
            transition(StreamConnectionState.CLOSED);
            dispatch(listener::onClose);
        }
        if (open != null) open.close();
        if (task != null) task.cancel(true);
    }

    @Override
    public boolean isClosed() {
        return state() == StreamConnectionState.CLOSED;
    }

    public URI url() {
        return url;
    }

    public StreamConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    /** @return reconnect attempts made since the last accepted connection */
    public int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    /** @return the most recent frame id, sent as {@code Last-Event-ID} when reconnecting */
    public String lastEventId() {
        synchronized (lock) {
            return lastEventId;
        }
    }

    /** @return the policy in effect, including any server {@code retry} hint */
    public ReconnectPolicy reconnectPolicy() {
        synchronized (lock) {
            return policy;
        }
    }

    // guarded by lock
    private void startAttempt() {
        long gen = generation;
        HttpClientRequest request = buildRequest();
        try {
            readTask = executor.submit(() -> runAttempt(gen, request));
        } catch (RejectedExecutionException e) {
            fail(new WeatherStreamsException.ConnectionLost("stream executor is shut down", e), true);
        }
    }

    private HttpClientRequest buildRequest() {
        HttpClientRequest.Builder builder = HttpClientRequest.get(url)
                .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, Protocol.NO_CACHE)
                .headers(options.headers())
                .timeout(options.connectTimeout());
        if (lastEventId != null) {
            builder.header(Protocol.H_LAST_EVENT_ID, lastEventId);
        }
        return builder.build();
    }

    private void runAttempt(long gen, HttpClientRequest request) {
        HttpClientResponse resp;
        try {
            resp = http.open(request);
        } catch (HttpClientException e) {
            onFailure(gen, new WeatherStreamsException.ConnectionLost("connecting to " + url + " failed", e));
            return;
        }

        boolean stale;
        synchronized (lock) {
            stale = gen != generation;
            if (!stale) response = resp;
        }
        if (stale) {
            resp.close();
            return;
        }

        try {
            if (!resp.isSuccessful()) {
                String detail = Responses.errorDetail(resp, log);
                onFailure(gen, new WeatherStreamsException.UnexpectedStatus(resp.statusCode(), detail));
                return;
            }
            InputStream body = resp.body();
            if (body == null) {
                onFailure(gen, new WeatherStreamsException.ConnectionLost("response of " + url + " has no body"));
                return;
            }
            Responses.checkEventStream(resp, url, log);
            if (!opened(gen)) return;

            try (FrameReader reader = new FrameReader(body, () -> chunkReceived(gen))) {
                StreamFrame frame;
                while ((frame = reader.nextFrame()) != null) {
                    if (!deliver(gen, frame)) return;
                }
            }
            onFailure(gen, new WeatherStreamsException.ConnectionLost("server closed the stream"));
        } catch (IOException e) {
            onFailure(gen, new WeatherStreamsException.ConnectionLost("reading " + url + " failed", e));
        } finally {
            resp.close();
        }
    }

    private boolean opened(long gen) {
        synchronized (lock) {
            if (gen != generation) return false;
            log.info("Event stream {} connected", url);
            attempts = 0;
            transition(StreamConnectionState.CONNECTED);
            resetWatchdog(gen);
            dispatch(listener::onOpen);
            return gen == generation;
        }
    }

    private boolean deliver(long gen, StreamFrame frame) {
        synchronized (lock) {
            if (gen != generation || state != StreamConnectionState.CONNECTED) return false;
            if (frame.id() != null) {
                lastEventId = frame.id();
            }
            if (frame.retry() != null && options.honorServerRetry()) {
                policy = policy.withBaseInterval(Duration.ofMillis(frame.retry()));
            }
            log.debug("Stream {} frame event={} id={} ({} chars)", url, frame.event(), frame.id(), frame.data().length());
            dispatch(() -> listener.onMessage(frame));
            return gen == generation;
        }
    }

    private void chunkReceived(long gen) {
        synchronized (lock) {
            if (gen == generation && state == StreamConnectionState.CONNECTED) {
                resetWatchdog(gen);
            }
        }
    }

    private void onFailure(long gen, WeatherStreamsException error) {
        synchronized (lock) {
            if (gen != generation || state == StreamConnectionState.CLOSED) {
                log.debug("Ignoring failure of a superseded attempt on {}: {}", url, error.getMessage());
                return;
            }
            generation++;
            cancelTimers();
            HttpClientResponse open = response;
            response = null;
            readTask = null;
            if (open != null) open.close();

            if (!options.reconnect()) {
                fail(error, false);
                return;
            }
            if (attempts >= policy.maxAttempts()) {
                fail(new WeatherStreamsException.RetriesExhausted(attempts, error), false);
                return;
            }

            attempts++;
            Duration delay = policy.delayForAttempt(attempts);
            log.warn("Event stream {} lost ({}); reconnecting in {}ms (attempt {}/{})",
                    url, error.getMessage(), delay.toMillis(), attempts, policy.maxAttempts());
            transition(StreamConnectionState.RECONNECTING);
            long next = generation;
            dispatch(() -> listener.onError(error, false));
            if (next != generation) return;
            pendingReconnect = scheduler.schedule(delay, () -> reconnect(next));
        }
    }

    private void reconnect(long gen) {
        synchronized (lock) {
            if (gen != generation || state != StreamConnectionState.RECONNECTING) return;
            pendingReconnect = null;
            log.info("Reconnecting to event stream {} (attempt {})", url, attempts);
            transition(StreamConnectionState.CONNECTING);
            startAttempt();
        }
    }

    private void stalled(long gen) {
        synchronized (lock) {
            if (gen != generation || state != StreamConnectionState.CONNECTED) return;
            Duration timeout = options.stallTimeout();
            log.warn("Event stream {} stalled: nothing received for {}ms", url, timeout.toMillis());
            onFailure(gen, new WeatherStreamsException.StreamStalled(timeout));
        }
    }

    // guarded by lock
    private void fail(WeatherStreamsException error, boolean invalidate) {
        if (invalidate) generation++;
        cancelTimers();
        log.error("Event stream {} failed permanently", url, error);
        transition(StreamConnectionState.CLOSED);
        dispatch(() -> listener.onError(error, true));
        dispatch(listener::onClose);
    }

    // guarded by lock
    private void resetWatchdog(long gen) {
        Duration timeout = options.stallTimeout();
        if (timeout == null) return;
        if (watchdog != null) watchdog.cancel();
        watchdog = scheduler.schedule(timeout, () -> stalled(gen));
    }

    // guarded by lock
    private void cancelTimers() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
        if (watchdog != null) {
            watchdog.cancel();
            watchdog = null;
        }
    }

    // guarded by lock
    private void transition(StreamConnectionState next) {
        StreamConnectionState previous = state;
        if (previous == next) return;
        state = next;
        dispatch(() -> listener.onStateChange(previous, next));
    }

    private void dispatch(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Listener of event stream {} failed", url, e);
        }
    }
}
