package io.weatherstreams.client;

import io.weatherstreams.core.Protocol;
import io.weatherstreams.http.spi.HttpClientResponse;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

final class Responses {
    private Responses() {}

    private static final int MAX_ERROR_DETAIL_BYTES = 512;

    /** Reads the start of an error body for diagnostics; never fails. */
    static String errorDetail(HttpClientResponse response, Logger log) {
        InputStream body = response.body();
        if (body == null) return "";
        try {
            byte[] bytes = body.readNBytes(MAX_ERROR_DETAIL_BYTES);
            return new String(bytes, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("Could not read error body", e);
            return "";
        }
    }

    static void checkEventStream(HttpClientResponse response, URI url, Logger log) {
        String contentType = response.header(Protocol.H_CONTENT_TYPE).orElse("");
        if (!contentType.toLowerCase(Locale.ROOT).startsWith(Protocol.CT_EVENT_STREAM)) {
            log.warn("Stream {} answered with Content-Type '{}', reading it as {} anyway",
                    url, contentType, Protocol.CT_EVENT_STREAM);
        }
    }
}
