package io.weatherstreams.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Resolves a {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>The first registered {@link JsonCodecProvider} wins. Applications that build native images or
 * want a specific codec should pass one explicitly instead.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Finds a codec using the given class loader.
     *
     * @param cl the class loader to search
     * @return the first registered codec, if any
     */
    public static Optional<JsonCodec> find(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) return Optional.of(codec);
        }
        return Optional.empty();
    }

    /**
     * Finds a codec using the context class loader.
     *
     * @return the codec
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = JsonCodecs.class.getClassLoader();
        return find(cl).orElseThrow(() -> new IllegalStateException(
                "No JsonCodecProvider registered; add weather-streams-json-jackson or pass a codec explicitly"));
    }
}
