package io.weatherstreams.client;

import io.weatherstreams.core.StreamConnectionState;
import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps an in-memory log of a subscription: every frame received, the current state and the last
 * error. Callbacks are forwarded to an optional delegate.
 */
public final class EventStreamRecorder implements EventStreamListener {

    private static final EventStreamListener NO_DELEGATE = new EventStreamListener() {};

    private final EventStreamListener delegate;
    private final Object lock = new Object();

    private final List<StreamFrame> frames = new ArrayList<>();
    private StreamConnectionState state = StreamConnectionState.DISCONNECTED;
    private WeatherStreamsException lastError;

    public EventStreamRecorder() {
        this(NO_DELEGATE);
    }

    public EventStreamRecorder(EventStreamListener delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /** @return the frames received so far, oldest first */
    public List<StreamFrame> frames() {
        synchronized (lock) {
            return List.copyOf(frames);
        }
    }

    public Optional<StreamFrame> lastFrame() {
        synchronized (lock) {
            return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
        }
    }

    public StreamConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        return state() == StreamConnectionState.CONNECTED;
    }

    public Optional<WeatherStreamsException> lastError() {
        synchronized (lock) {
            return Optional.ofNullable(lastError);
        }
    }

    /** Drops recorded frames and the last error; the state is kept. */
    public void clear() {
        synchronized (lock) {
            frames.clear();
            lastError = null;
        }
    }

    @Override
    public void onOpen() {
        synchronized (lock) {
            lastError = null;
        }
        delegate.onOpen();
    }

    @Override
    public void onMessage(StreamFrame frame) {
        synchronized (lock) {
            frames.add(frame);
        }
        delegate.onMessage(frame);
    }

    @Override
    public void onError(WeatherStreamsException error, boolean fatal) {
        synchronized (lock) {
            lastError = error;
        }
        delegate.onError(error, fatal);
    }

    @Override
    public void onStateChange(StreamConnectionState previous, StreamConnectionState current) {
        synchronized (lock) {
            state = current;
        }
        delegate.onStateChange(previous, current);
    }

    @Override
    public void onClose() {
        delegate.onClose();
    }
}
