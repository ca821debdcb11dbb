package io.weatherstreams.client;

/**
 * Snapshot of a {@link RagStreamSession}.
 *
 * @param streaming whether an answer is being received
 * @param content the answer text accumulated so far
 * @param error the last error message, or {@code null}
 * @param requestId the request id last seen, or {@code null}
 * @param complete whether the server sent {@code done}
 */
public record RagStreamState(boolean streaming, String content, String error, String requestId, boolean complete) {

    static final RagStreamState IDLE = new RagStreamState(false, "", null, null, false);

    public boolean hasContent() {
        return !content.isEmpty();
    }

    public boolean hasError() {
        return error != null;
    }
}
