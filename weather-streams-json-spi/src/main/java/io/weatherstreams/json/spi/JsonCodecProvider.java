package io.weatherstreams.json.spi;

/**
 * {@link java.util.ServiceLoader} entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    /**
     * @return a ready-to-use codec
     */
    JsonCodec codec();
}
