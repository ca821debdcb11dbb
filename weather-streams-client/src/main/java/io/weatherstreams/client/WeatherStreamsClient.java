package io.weatherstreams.client;

import java.net.URI;

/**
 * Entry point for event streams of the weather back end.
 *
 * <p>Subscriptions ({@link #subscribe}) are long-lived GET streams that reconnect with backoff.
 * Request streams ({@link #post}, {@link #ragStream}) send a body once and read the response until
 * it ends.
 */
public interface WeatherStreamsClient extends AutoCloseable {

    /**
     * Opens a subscription with the configured default options.
     */
    default EventStreamConnection subscribe(URI url, EventStreamListener listener) {
        return subscribe(url, settings().streamOptions(), listener);
    }

    /**
     * Opens a subscription. The returned connection is already connecting.
     *
     * @throws io.weatherstreams.core.WeatherStreamsException.FeatureDisabled if streaming is switched off
     */
    EventStreamConnection subscribe(URI url, StreamOptions options, EventStreamListener listener);

    /**
     * Posts {@code body} and streams the response frames. A {@code byte[]} is sent as is, a
     * {@code String} as UTF-8 text, anything else is encoded as JSON.
     *
     * @throws io.weatherstreams.core.WeatherStreamsException.FeatureDisabled if streaming is switched off
     */
    StreamHandle post(URI url, Object body, RequestStreamListener listener);

    /**
     * Posts {@code body} and delivers the response as typed RAG events.
     *
     * @throws io.weatherstreams.core.WeatherStreamsException.FeatureDisabled if RAG or streaming is switched off
     */
    StreamHandle ragStream(URI url, Object body, RagStreamListener listener);

    WeatherStreamsSettings settings();

    /** Cancels every open stream and releases the threads the client created itself. */
    @Override
    void close();

    static WeatherStreamsClient create() {
        return builder().build();
    }

    static WeatherStreamsClient create(java.net.http.HttpClient httpClient) {
        return builder().jdkHttpClient(httpClient).build();
    }

    static WeatherStreamsClientBuilder builder() {
        return new WeatherStreamsClientBuilder();
    }
}
