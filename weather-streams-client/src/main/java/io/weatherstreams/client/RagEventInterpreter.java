package io.weatherstreams.client;

import io.weatherstreams.core.Protocol;
import io.weatherstreams.core.RagStreamEvent;
import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.json.spi.JsonCodec;
import io.weatherstreams.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Interprets frames of a RAG answer stream as {@link RagStreamEvent}s.
 *
 * <p>Data that looks like a JSON object is decoded and mapped by its {@code type}; anything else,
 * including JSON that fails to decode, is a plain-text token. A plain-text token without a frame id
 * gets a generated request id.
 */
public final class RagEventInterpreter {

    private static final Logger log = LoggerFactory.getLogger(RagEventInterpreter.class);

    static final String UNKNOWN_ERROR = "Unknown stream error";

    private final JsonCodec json;
    private final Supplier<String> requestIds;

    public RagEventInterpreter(JsonCodec json) {
        this(json, () -> UUID.randomUUID().toString());
    }

    public RagEventInterpreter(JsonCodec json, Supplier<String> requestIds) {
        this.json = Objects.requireNonNull(json, "json");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
    }

    /**
     * @param frame the frame to interpret
     * @return the typed event, or empty if the frame carries no payload
     */
    public Optional<RagStreamEvent> interpret(StreamFrame frame) {
        String data = frame.data();
        if (data.isEmpty()) {
            log.warn("Dropping RAG frame without payload (id={}, event={})", frame.id(), frame.event());
            return Optional.empty();
        }

        String trimmed = data.trim();
        if (trimmed.startsWith("{")) {
            try {
                return Optional.of(fromObject(json.readObject(trimmed), frame));
            } catch (JsonException e) {
                log.debug("RAG frame payload is not a JSON object, treating it as text (id={})", frame.id(), e);
            }
        }

        String requestId = frame.id() != null ? frame.id() : requestIds.get();
        return Optional.of(new RagStreamEvent.Token(data, requestId, Map.of()));
    }

    private static RagStreamEvent fromObject(Map<String, Object> payload, StreamFrame frame) {
        String type = text(payload, Protocol.K_TYPE);
        String requestId = text(payload, Protocol.K_REQUEST_ID);
        if (requestId == null) requestId = frame.id();
        Map<String, Object> metadata = metadata(payload);
        String content = text(payload, Protocol.K_CONTENT);

        if (type == null) {
            return new RagStreamEvent.Token(content != null ? content : frame.data(), requestId, metadata);
        }
        return switch (type) {
            case Protocol.TYPE_START -> new RagStreamEvent.Start(requestId, metadata);
            case Protocol.TYPE_TOKEN -> new RagStreamEvent.Token(content != null ? content : "", requestId, metadata);
            case Protocol.TYPE_DONE -> new RagStreamEvent.Done(requestId, metadata);
            case Protocol.TYPE_ERROR -> new RagStreamEvent.Error(errorMessage(payload, content), requestId, metadata);
            default -> {
                log.debug("Unknown RAG payload type '{}', treating it as a token", type);
                yield new RagStreamEvent.Token(content != null ? content : frame.data(), requestId, metadata);
            }
        };
    }

    private static String errorMessage(Map<String, Object> payload, String content) {
        String error = text(payload, Protocol.K_ERROR);
        if (error != null) return error;
        return content != null ? content : UNKNOWN_ERROR;
    }

    private static String text(Map<String, Object> payload, String key) {
        Object v = payload.get(key);
        if (v == null) return null;
        return v instanceof String ? (String) v : String.valueOf(v);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> metadata(Map<String, Object> payload) {
        Object v = payload.get(Protocol.K_METADATA);
        return v instanceof Map ? (Map<String, Object>) v : Map.of();
    }
}
