package io.weatherstreams.json.jackson;

import io.weatherstreams.json.spi.JsonCodec;
import io.weatherstreams.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}. All lookups share one codec, since its
 * {@code ObjectMapper} is thread-safe once configured.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    private static final JacksonJsonCodec SHARED = new JacksonJsonCodec();

    @Override
    public JsonCodec codec() {
        return SHARED;
    }
}
