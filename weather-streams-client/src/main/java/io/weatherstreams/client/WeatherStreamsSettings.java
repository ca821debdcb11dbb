package io.weatherstreams.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Application-level switches and stream defaults.
 *
 * <p>Configure via {@code weather-streams.properties} on the classpath; JVM system properties with
 * the same keys take precedence:
 * <pre>
 * weather-streams.streaming.enabled=true
 * weather-streams.rag.enabled=true
 * weather-streams.reconnect.enabled=true
 * weather-streams.reconnect.base-interval-ms=5000
 * weather-streams.reconnect.max-attempts=5
 * weather-streams.reconnect.multiplier=2
 * weather-streams.connect-timeout-ms=30000
 * weather-streams.stall-timeout-ms=0
 * </pre>
 * A stall timeout of {@code 0} disables the watchdog.
 */
public final class WeatherStreamsSettings {

    private static final Logger log = LoggerFactory.getLogger(WeatherStreamsSettings.class);

    public static final String RESOURCE = "weather-streams.properties";
    public static final String PREFIX = "weather-streams.";

    static final String STREAMING_ENABLED = PREFIX + "streaming.enabled";
    static final String RAG_ENABLED = PREFIX + "rag.enabled";
    static final String RECONNECT_ENABLED = PREFIX + "reconnect.enabled";
    static final String RECONNECT_BASE_INTERVAL_MS = PREFIX + "reconnect.base-interval-ms";
    static final String RECONNECT_MAX_ATTEMPTS = PREFIX + "reconnect.max-attempts";
    static final String RECONNECT_MULTIPLIER = PREFIX + "reconnect.multiplier";
    static final String CONNECT_TIMEOUT_MS = PREFIX + "connect-timeout-ms";
    static final String STALL_TIMEOUT_MS = PREFIX + "stall-timeout-ms";

    private final boolean streamingEnabled;
    private final boolean ragEnabled;
    private final StreamOptions streamOptions;

    public WeatherStreamsSettings(boolean streamingEnabled, boolean ragEnabled, StreamOptions streamOptions) {
        this.streamingEnabled = streamingEnabled;
        this.ragEnabled = ragEnabled;
        this.streamOptions = Objects.requireNonNull(streamOptions, "streamOptions");
    }

    /** @return everything enabled, {@link StreamOptions#defaults()} */
    public static WeatherStreamsSettings defaults() {
        return new WeatherStreamsSettings(true, true, StreamOptions.defaults());
    }

    /**
     * Loads {@value #RESOURCE} from the context class loader and applies system property overrides.
     *
     * @return the settings, built-in defaults for every key that is not set
     */
    public static WeatherStreamsSettings load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = WeatherStreamsSettings.class.getClassLoader();
        return load(cl, System.getProperties());
    }

    static WeatherStreamsSettings load(ClassLoader cl, Properties overrides) {
        Properties props = new Properties();
        try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, overrides.getProperty(name));
            }
        }
        return from(props);
    }

    /**
     * Builds settings from already loaded properties.
     *
     * @param props the properties, keys carry the {@value #PREFIX} prefix
     * @return the settings
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static WeatherStreamsSettings from(Properties props) {
        Objects.requireNonNull(props, "props");
        StreamOptions.Builder options = StreamOptions.builder()
                .reconnect(bool(props, RECONNECT_ENABLED, true))
                .baseInterval(Duration.ofMillis(number(props, RECONNECT_BASE_INTERVAL_MS, 5000L)))
                .maxAttempts((int) number(props, RECONNECT_MAX_ATTEMPTS, 5L))
                .multiplier(decimal(props, RECONNECT_MULTIPLIER, 2.0));

        long connectTimeout = number(props, CONNECT_TIMEOUT_MS, StreamOptions.DEFAULT_CONNECT_TIMEOUT.toMillis());
        options.connectTimeout(connectTimeout > 0 ? Duration.ofMillis(connectTimeout) : null);

        long stallTimeout = number(props, STALL_TIMEOUT_MS, 0L);
        options.stallTimeout(stallTimeout > 0 ? Duration.ofMillis(stallTimeout) : null);

        return new WeatherStreamsSettings(
                bool(props, STREAMING_ENABLED, true),
                bool(props, RAG_ENABLED, true),
                options.build());
    }

    public boolean streamingEnabled() {
        return streamingEnabled;
    }

    public boolean ragEnabled() {
        return ragEnabled;
    }

    /** @return the options used when a subscription does not pass its own */
    public StreamOptions streamOptions() {
        return streamOptions;
    }

    private static boolean bool(Properties props, String key, boolean def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        String t = v.trim();
        if ("true".equalsIgnoreCase(t)) return true;
        if ("false".equalsIgnoreCase(t)) return false;
        throw new IllegalArgumentException(key + " must be true or false, got '" + v + "'");
    }

    private static long number(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + v + "'", e);
        }
    }

    private static double decimal(Properties props, String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got '" + v + "'", e);
        }
    }
}
