package io.weatherstreams.client;

import java.util.Objects;

/**
 * Request body of a RAG answer stream.
 *
 * @param query the user's question
 * @param locationId the location the question is about, or {@code null}
 * @param context free-form extra context, or {@code null}
 */
public record RagQuery(String query, String locationId, String context) {
    public RagQuery {
        Objects.requireNonNull(query, "query");
    }

    public static RagQuery of(String query) {
        return new RagQuery(query, null, null);
    }
}
