package io.weatherstreams.client;

import io.weatherstreams.core.StreamConnectionState;
import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;

/**
 * Callbacks of a reconnecting subscription.
 *
 * <p>Callbacks of one subscription never run concurrently and arrive in stream order. They are
 * invoked while the subscription holds its lock, so a slow callback delays
 * {@link StreamHandle#cancel()} issued from another thread. Exceptions thrown by a callback are
 * logged and otherwise ignored.
 */
public interface EventStreamListener {

    /** The server accepted the stream. Fired again after every successful reconnect. */
    default void onOpen() {}

    /**
     * A frame arrived.
     *
     * @param frame the parsed frame
     */
    default void onMessage(StreamFrame frame) {}

    /**
     * The connection failed.
     *
     * @param error what went wrong
     * @param fatal {@code false} while a reconnect is scheduled, {@code true} when the subscription
     *              gives up and closes
     */
    default void onError(WeatherStreamsException error, boolean fatal) {}

    /**
     * The subscription changed state.
     *
     * @param previous the state before
     * @param current the state now
     */
    default void onStateChange(StreamConnectionState previous, StreamConnectionState current) {}

    /** The subscription closed for good. Fired exactly once. */
    default void onClose() {}
}
