package io.weatherstreams.client;

import io.weatherstreams.core.ReconnectPolicy;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-subscription options.
 *
 * <p>Defaults: reconnect enabled with {@link ReconnectPolicy#defaults()}, 30 s connect timeout,
 * no stall timeout, server {@code retry} hints honored.
 */
public final class StreamOptions {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    private static final StreamOptions DEFAULTS = builder().build();

    private final boolean reconnect;
    private final ReconnectPolicy reconnectPolicy;
    private final Map<String, String> headers;
    private final Duration connectTimeout;
    private final Duration stallTimeout;
    private final boolean honorServerRetry;

    private StreamOptions(Builder b) {
        this.reconnect = b.reconnect;
        this.reconnectPolicy = new ReconnectPolicy(b.baseInterval, b.maxAttempts, b.multiplier);
        this.headers = Map.copyOf(b.headers);
        this.connectTimeout = b.connectTimeout;
        this.stallTimeout = b.stallTimeout;
        this.honorServerRetry = b.honorServerRetry;
    }

    public static StreamOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return whether dropped connections are reopened */
    public boolean reconnect() {
        return reconnect;
    }

    public ReconnectPolicy reconnectPolicy() {
        return reconnectPolicy;
    }

    /** @return extra request headers, never {@code null} */
    public Map<String, String> headers() {
        return headers;
    }

    /** @return time allowed until the response headers arrive, or {@code null} for no limit */
    public Duration connectTimeout() {
        return connectTimeout;
    }

    /** @return maximum silence on an open connection before it is dropped, or {@code null} if unbounded */
    public Duration stallTimeout() {
        return stallTimeout;
    }

    /** @return whether a frame's {@code retry} field replaces the base reconnect interval */
    public boolean honorServerRetry() {
        return honorServerRetry;
    }

    public Builder toBuilder() {
        return new Builder()
                .reconnect(reconnect)
                .baseInterval(reconnectPolicy.baseInterval())
                .maxAttempts(reconnectPolicy.maxAttempts())
                .multiplier(reconnectPolicy.multiplier())
                .headers(headers)
                .connectTimeout(connectTimeout)
                .stallTimeout(stallTimeout)
                .honorServerRetry(honorServerRetry);
    }

    public static final class Builder {
        private boolean reconnect = true;
        private Duration baseInterval = ReconnectPolicy.DEFAULT_BASE_INTERVAL;
        private int maxAttempts = ReconnectPolicy.DEFAULT_MAX_ATTEMPTS;
        private double multiplier = ReconnectPolicy.DEFAULT_MULTIPLIER;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration stallTimeout;
        private boolean honorServerRetry = true;

        private Builder() {}

        public Builder reconnect(boolean reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        public Builder baseInterval(Duration baseInterval) {
            this.baseInterval = Objects.requireNonNull(baseInterval, "baseInterval");
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder reconnectPolicy(ReconnectPolicy policy) {
            Objects.requireNonNull(policy, "policy");
            this.baseInterval = policy.baseInterval();
            this.maxAttempts = policy.maxAttempts();
            this.multiplier = policy.multiplier();
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach(this::header);
            }
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder stallTimeout(Duration stallTimeout) {
            if (stallTimeout != null && (stallTimeout.isZero() || stallTimeout.isNegative())) {
                throw new IllegalArgumentException("stallTimeout must be > 0");
            }
            this.stallTimeout = stallTimeout;
            return this;
        }

        public Builder honorServerRetry(boolean honorServerRetry) {
            this.honorServerRetry = honorServerRetry;
            return this;
        }

        public StreamOptions build() {
            return new StreamOptions(this);
        }
    }
}
