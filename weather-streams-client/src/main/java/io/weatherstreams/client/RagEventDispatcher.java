package io.weatherstreams.client;

import io.weatherstreams.core.RagStreamEvent;
import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;

import java.util.Objects;
import java.util.Optional;

/**
 * Adapts a request-scoped stream to {@link RagStreamListener} callbacks.
 *
 * <p>{@code done} and {@code error} payloads end the logical request but leave the transport
 * alone; the stream keeps reading until the server closes it or the caller cancels.
 */
public final class RagEventDispatcher implements RequestStreamListener {

    private final RagEventInterpreter interpreter;
    private final RagStreamListener listener;

    public RagEventDispatcher(RagEventInterpreter interpreter, RagStreamListener listener) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void onMessage(StreamFrame frame) {
        Optional<RagStreamEvent> event = interpreter.interpret(frame);
        event.ifPresent(this::dispatch);
    }

    @Override
    public void onError(WeatherStreamsException error) {
        listener.onError(error.getMessage(), null);
    }

    @Override
    public void onComplete() {
        listener.onComplete();
    }

    void dispatch(RagStreamEvent event) {
        if (event instanceof RagStreamEvent.Start start) {
            listener.onStart(start.requestId());
        } else if (event instanceof RagStreamEvent.Token token) {
            listener.onToken(token.content(), token.requestId());
        } else if (event instanceof RagStreamEvent.Done done) {
            listener.onDone(done.requestId());
        } else if (event instanceof RagStreamEvent.Error error) {
            listener.onError(error.message(), error.requestId());
        }
    }
}
