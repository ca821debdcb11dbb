package io.weatherstreams.client;

/**
 * Caller-side handle of an open stream.
 */
public interface StreamHandle extends AutoCloseable {

    /**
     * Stops the stream: aborts the in-flight read, cancels pending reconnects and releases the
     * connection. Once this method returns no further listener callback fires. Idempotent.
     */
    void cancel();

    /**
     * @return {@code true} once the stream ended, by cancellation, completion or fatal failure
     */
    boolean isClosed();

    /** Same as {@link #cancel()}. */
    @Override
    default void close() {
        cancel();
    }
}
