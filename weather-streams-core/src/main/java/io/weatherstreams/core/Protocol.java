package io.weatherstreams.core;

/**
 * Event-stream protocol constants (field names, header names, and well-known values).
 *
 * <p>This module intentionally contains no HTTP client bindings. It only models wire-level concerns
 * shared by the subscription and request-scoped stream clients.
 */
public final class Protocol {
    private Protocol() {}

    // Wire fields
    public static final String F_ID = "id";
    public static final String F_EVENT = "event";
    public static final String F_DATA = "data";
    public static final String F_RETRY = "retry";

    /** Two consecutive line feeds terminate a frame. */
    public static final String FRAME_DELIMITER = "\n\n";

    // HTTP headers
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_LAST_EVENT_ID = "Last-Event-ID";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";

    public static final String NO_CACHE = "no-cache";

    // RAG payload keys
    public static final String K_TYPE = "type";
    public static final String K_CONTENT = "content";
    public static final String K_ERROR = "error";
    public static final String K_REQUEST_ID = "requestId";
    public static final String K_METADATA = "metadata";

    // RAG payload types
    public static final String TYPE_START = "start";
    public static final String TYPE_TOKEN = "token";
    public static final String TYPE_DONE = "done";
    public static final String TYPE_ERROR = "error";
}
