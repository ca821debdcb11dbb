package io.weatherstreams.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One parsed event-stream message.
 *
 * @param id the last {@code id} field of the block, or {@code null}
 * @param event the last {@code event} field of the block, or {@code null}
 * @param data all {@code data} lines of the block joined with {@code \n}
 * @param retry the reconnection time in milliseconds announced by the server, or {@code null}
 */
public record StreamFrame(String id, String event, String data, Integer retry) {
    public StreamFrame {
        Objects.requireNonNull(data, "data");
    }

    public static StreamFrame ofData(String data) {
        return new StreamFrame(null, null, data, null);
    }

    public Optional<String> idValue() {
        return Optional.ofNullable(id);
    }

    public Optional<String> eventType() {
        return Optional.ofNullable(event);
    }

    public Optional<Integer> retryMillis() {
        return Optional.ofNullable(retry);
    }
}
