package io.weatherstreams.core;

import java.time.Duration;

/**
 * Base class for stream client failures.
 *
 * <p>Subclasses describe why a stream stopped delivering frames. Subscriptions report the
 * recoverable ones as non-fatal errors while reconnect attempts remain.
 */
public abstract class WeatherStreamsException extends RuntimeException {

    protected WeatherStreamsException(String message) {
        super(message);
    }

    protected WeatherStreamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the server answers a stream request with a non-2xx status.
     */
    public static class UnexpectedStatus extends WeatherStreamsException {
        private final int status;

        public UnexpectedStatus(int status, String detail) {
            super(detail == null || detail.isBlank()
                    ? "stream status=" + status
                    : "stream status=" + status + ": " + detail);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }

    /**
     * Raised when the transport fails or the server ends the stream body.
     */
    public static class ConnectionLost extends WeatherStreamsException {
        public ConnectionLost(String message) {
            super(message);
        }

        public ConnectionLost(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when no bytes arrived within the configured stall timeout.
     */
    public static class StreamStalled extends WeatherStreamsException {
        public StreamStalled(Duration timeout) {
            super("no data received for " + timeout.toMillis() + "ms");
        }
    }

    /**
     * Raised once a subscription gives up reconnecting. Always fatal.
     */
    public static class RetriesExhausted extends WeatherStreamsException {
        private final int attempts;

        public RetriesExhausted(int attempts, Throwable lastFailure) {
            super("giving up after " + attempts + " reconnect attempt(s)", lastFailure);
            this.attempts = attempts;
        }

        public int attempts() {
            return attempts;
        }
    }

    /**
     * Raised when streaming or the RAG feature is switched off by configuration.
     */
    public static class FeatureDisabled extends WeatherStreamsException {
        public FeatureDisabled(String feature) {
            super(feature + " feature is not enabled");
        }
    }
}
