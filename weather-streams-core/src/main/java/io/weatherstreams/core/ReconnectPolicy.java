package io.weatherstreams.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff applied when a subscription drops unexpectedly.
 *
 * <p>The delay before reconnect attempt {@code n} (1-based) is
 * {@code baseInterval * multiplier^(n-1)}. After {@code maxAttempts} unsuccessful reconnects the
 * subscription fails for good.
 */
public final class ReconnectPolicy {

    public static final Duration DEFAULT_BASE_INTERVAL = Duration.ofMillis(5000);
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private static final ReconnectPolicy DEFAULTS =
            new ReconnectPolicy(DEFAULT_BASE_INTERVAL, DEFAULT_MAX_ATTEMPTS, DEFAULT_MULTIPLIER);

    private final Duration baseInterval;
    private final int maxAttempts;
    private final double multiplier;

    /**
     * Creates a policy.
     *
     * @param baseInterval the delay before the first reconnect
     * @param maxAttempts the number of reconnects tried before giving up, {@code 0} disables reconnect
     * @param multiplier the growth factor between consecutive delays, at least {@code 1}
     */
    public ReconnectPolicy(Duration baseInterval, int maxAttempts, double multiplier) {
        this.baseInterval = Objects.requireNonNull(baseInterval, "baseInterval");
        if (baseInterval.isNegative()) {
            throw new IllegalArgumentException("baseInterval must be >= 0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.multiplier = multiplier;
    }

    /** @return 5000 ms base interval, 5 attempts, multiplier 2 */
    public static ReconnectPolicy defaults() {
        return DEFAULTS;
    }

    /** @return a policy that never reconnects */
    public static ReconnectPolicy disabled() {
        return new ReconnectPolicy(DEFAULT_BASE_INTERVAL, 0, DEFAULT_MULTIPLIER);
    }

    public Duration baseInterval() {
        return baseInterval;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Returns the delay before the given reconnect attempt.
     *
     * @param attempt the 1-based attempt number
     * @return the backoff delay
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double millis = baseInterval.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= Long.MAX_VALUE) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(millis));
    }

    /**
     * Returns a copy with a different base interval, e.g. from a server {@code retry} hint.
     *
     * @param baseInterval the new base interval
     * @return the adjusted policy
     */
    public ReconnectPolicy withBaseInterval(Duration baseInterval) {
        return new ReconnectPolicy(baseInterval, maxAttempts, multiplier);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof ReconnectPolicy)) return false;
        ReconnectPolicy that = (ReconnectPolicy) other;
        return maxAttempts == that.maxAttempts
                && Double.compare(multiplier, that.multiplier) == 0
                && baseInterval.equals(that.baseInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseInterval, maxAttempts, multiplier);
    }

    @Override
    public String toString() {
        return "ReconnectPolicy{baseInterval=" + baseInterval.toMillis() + "ms, maxAttempts=" + maxAttempts
                + ", multiplier=" + multiplier + "}";
    }
}
