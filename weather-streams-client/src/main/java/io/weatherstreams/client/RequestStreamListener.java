package io.weatherstreams.client;

import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;

/**
 * Callbacks of a request-scoped stream (a POST whose response body is an event stream).
 *
 * <p>Request-scoped streams are never resumed: after {@link #onError} the caller has to issue a new
 * request.
 */
public interface RequestStreamListener {

    /**
     * A frame arrived.
     *
     * @param frame the parsed frame
     */
    default void onMessage(StreamFrame frame) {}

    /**
     * The request failed. Not called for cancellation.
     *
     * @param error what went wrong
     */
    default void onError(WeatherStreamsException error) {}

    /** The stream ended: normally, after {@link #onError}, or because it was cancelled. Fired exactly once. */
    default void onComplete() {}
}
