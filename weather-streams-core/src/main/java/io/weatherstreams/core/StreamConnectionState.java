package io.weatherstreams.core;

/**
 * Lifecycle state of one logical event-stream subscription.
 */
public enum StreamConnectionState {
    /** Created but never connected. */
    DISCONNECTED,

    /** A transport request is in flight. */
    CONNECTING,

    /** The server accepted the stream and frames are flowing. */
    CONNECTED,

    /** The connection dropped and a reconnect is scheduled. */
    RECONNECTING,

    /** Terminal: closed by the caller or after reconnect attempts ran out. */
    CLOSED;

    /**
     * @return {@code true} while a connection is open, being opened, or about to be reopened
     */
    public boolean isActive() {
        return this == CONNECTING || this == CONNECTED || this == RECONNECTING;
    }
}
