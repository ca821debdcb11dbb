package io.weatherstreams.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed events of the RAG answer stream.
 *
 * <p>Each frame of an answer stream carries one of {@code start}, {@code token}, {@code done} or
 * {@code error}. Every variant keeps the request id and the free-form {@code metadata} object of
 * its payload (empty when absent).
 */
public sealed interface RagStreamEvent permits RagStreamEvent.Start, RagStreamEvent.Token, RagStreamEvent.Done, RagStreamEvent.Error {

    /**
     * @return the request this event belongs to, or {@code null} if unknown
     */
    String requestId();

    /**
     * @return the payload metadata, never {@code null}
     */
    Map<String, Object> metadata();

    default Optional<String> requestIdValue() {
        return Optional.ofNullable(requestId());
    }

    // JSON metadata may hold null members, which Map.copyOf rejects
    private static Map<String, Object> copyOf(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * The server started producing an answer.
     *
     * @param requestId the request id (optional)
     * @param metadata payload metadata
     */
    record Start(String requestId, Map<String, Object> metadata) implements RagStreamEvent {
        public Start {
            metadata = copyOf(metadata);
        }
    }

    /**
     * A piece of answer text.
     *
     * @param content the text to append to the answer
     * @param requestId the request id (optional)
     * @param metadata payload metadata
     */
    record Token(String content, String requestId, Map<String, Object> metadata) implements RagStreamEvent {
        public Token {
            Objects.requireNonNull(content, "content");
            metadata = copyOf(metadata);
        }
    }

    /**
     * The answer for {@code requestId} is complete.
     *
     * @param requestId the request id (optional)
     * @param metadata payload metadata
     */
    record Done(String requestId, Map<String, Object> metadata) implements RagStreamEvent {
        public Done {
            metadata = copyOf(metadata);
        }
    }

    /**
     * The server reported an application-level failure for {@code requestId}.
     *
     * @param message the error text
     * @param requestId the request id (optional)
     * @param metadata payload metadata
     */
    record Error(String message, String requestId, Map<String, Object> metadata) implements RagStreamEvent {
        public Error {
            Objects.requireNonNull(message, "message");
            metadata = copyOf(metadata);
        }
    }
}
