package io.weatherstreams.client;

/**
 * Typed callbacks of a RAG answer stream. Exactly one of the first four methods fires per
 * interpreted frame.
 */
public interface RagStreamListener {

    /**
     * The server started answering.
     *
     * @param requestId the request id, or {@code null}
     */
    default void onStart(String requestId) {}

    /**
     * @param content a piece of answer text
     * @param requestId the request id, or {@code null}
     */
    default void onToken(String content, String requestId) {}

    /**
     * The answer is complete. The transport may still deliver frames of a later request.
     *
     * @param requestId the request id, or {@code null}
     */
    default void onDone(String requestId) {}

    /**
     * The server reported an error payload, or the request itself failed (then {@code requestId}
     * is {@code null}).
     *
     * @param message the error text
     * @param requestId the request id, or {@code null}
     */
    default void onError(String message, String requestId) {}

    /** The underlying request ended, for whatever reason. Fired exactly once. */
    default void onComplete() {}
}
