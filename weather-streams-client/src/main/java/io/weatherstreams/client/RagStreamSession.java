package io.weatherstreams.client;

import io.weatherstreams.core.WeatherStreamsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * Accumulates one RAG answer at a time.
 *
 * <p>Tokens are appended to the current answer in arrival order; {@code done} marks it complete and
 * an error stops it. Every callback is also forwarded to an optional delegate. {@link #snapshot()}
 * may be called from any thread.
 */
public final class RagStreamSession implements RagStreamListener {

    private static final Logger log = LoggerFactory.getLogger(RagStreamSession.class);

    private static final RagStreamListener NO_DELEGATE = new RagStreamListener() {};

    private final RagStreamListener delegate;
    private final Object lock = new Object();

    // guarded by lock
    private boolean streaming;
    private final StringBuilder content = new StringBuilder();
    private String error;
    private String requestId;
    private boolean complete;
    private StreamHandle handle;

    public RagStreamSession() {
        this(NO_DELEGATE);
    }

    public RagStreamSession(RagStreamListener delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Stops any answer in progress, resets the state and streams a new answer.
     *
     * @return the handle of the new stream
     * @throws WeatherStreamsException.FeatureDisabled if RAG or streaming is switched off; the
     *         session records the message as its error
     */
    public StreamHandle start(WeatherStreamsClient client, URI url, RagQuery query) {
        Objects.requireNonNull(client, "client");
        stop();
        synchronized (lock) {
            reset(true);
        }
        log.info("Starting RAG stream for query of {} chars at {}", query.query().length(), url);
        try {
            StreamHandle started = client.ragStream(url, query, this);
            synchronized (lock) {
                handle = started;
            }
            return started;
        } catch (WeatherStreamsException e) {
            synchronized (lock) {
                streaming = false;
                error = e.getMessage();
            }
            throw e;
        }
    }

    /** Aborts the answer in progress, keeping what arrived so far. */
    public void stop() {
        StreamHandle current;
        synchronized (lock) {
            current = handle;
            handle = null;
        }
        // outside the lock: cancel() waits for an in-flight callback, which takes the lock
        if (current != null && !current.isClosed()) {
            log.info("Stopping RAG stream");
            current.cancel();
        }
        synchronized (lock) {
            streaming = false;
        }
    }

    /** Forgets the accumulated answer, error and request id. */
    public void clear() {
        synchronized (lock) {
            reset(streaming);
        }
    }

    public RagStreamState snapshot() {
        synchronized (lock) {
            return new RagStreamState(streaming, content.toString(), error, requestId, complete);
        }
    }

    @Override
    public void onStart(String requestId) {
        synchronized (lock) {
            streaming = true;
            remember(requestId);
        }
        log.debug("RAG stream started (requestId={})", requestId);
        delegate.onStart(requestId);
    }

    @Override
    public void onToken(String content, String requestId) {
        synchronized (lock) {
            this.content.append(content);
            remember(requestId);
        }
        delegate.onToken(content, requestId);
    }

    @Override
    public void onDone(String requestId) {
        synchronized (lock) {
            streaming = false;
            complete = true;
            remember(requestId);
        }
        log.info("RAG stream completed (requestId={})", requestId);
        delegate.onDone(requestId);
    }

    @Override
    public void onError(String message, String requestId) {
        synchronized (lock) {
            streaming = false;
            error = message;
            remember(requestId);
        }
        log.error("RAG stream error (requestId={}): {}", requestId, message);
        delegate.onError(message, requestId);
    }

    @Override
    public void onComplete() {
        synchronized (lock) {
            streaming = false;
        }
        delegate.onComplete();
    }

    private void remember(String id) {
        if (id != null) requestId = id;
    }

    private void reset(boolean streaming) {
        this.streaming = streaming;
        content.setLength(0);
        error = null;
        requestId = null;
        complete = false;
    }
}
