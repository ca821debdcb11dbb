package io.weatherstreams.client;

import io.weatherstreams.core.WeatherStreamsException;
import io.weatherstreams.http.spi.HttpClientRequest;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RequestStreamTest {

    private static final HttpClientRequest REQUEST = HttpClientRequest.post(URI.create("http://localhost/api/rag/stream"))
            .body("{}".getBytes())
            .build();

    private final ScriptedHttpClient http = new ScriptedHttpClient();
    private final RecordingRequestListener listener = new RecordingRequestListener();

    @Test
    void deliversFramesThenCompletes() {
        http.respondWithStream("data: a\n\n: ping\n\ndata: b");
        RequestStream stream = new RequestStream(REQUEST, http, listener);

        stream.start(new DirectExecutorService());

        assertThat(listener.calls).containsExactly("message:a", "message:b", "complete");
        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    void startingTwiceSendsOneRequest() {
        http.respondWithStream("data: a\n\n");
        RequestStream stream = new RequestStream(REQUEST, http, listener);

        stream.start(new DirectExecutorService());
        stream.start(new DirectExecutorService());

        assertThat(http.requests()).hasSize(1);
    }

    @Test
    void transportFailureReportsErrorThenComplete() {
        http.fail("connection refused");
        RequestStream stream = new RequestStream(REQUEST, http, listener);

        stream.start(new DirectExecutorService());

        assertThat(listener.calls).containsExactly("error", "complete");
        assertThat(listener.errors.get(0)).isInstanceOf(WeatherStreamsException.ConnectionLost.class);
    }

    @Test
    void errorStatusIsNotRetried() {
        http.respond(ScriptedHttpClient.FakeResponse.status(429, "slow down"));
        RequestStream stream = new RequestStream(REQUEST, http, listener);

        stream.start(new DirectExecutorService());

        assertThat(listener.calls).containsExactly("error", "complete");
        assertThat(listener.errors.get(0))
                .isInstanceOf(WeatherStreamsException.UnexpectedStatus.class)
                .hasMessageContaining("429")
                .hasMessageContaining("slow down");
        assertThat(http.requests()).hasSize(1);
    }

    @Test
    void cancelCompletesWithoutError() throws Exception {
        ScriptedInputStream body = new ScriptedInputStream();
        ScriptedHttpClient.FakeResponse response = ScriptedHttpClient.FakeResponse.eventStream(body);
        http.respond(response);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        RequestStream stream = new RequestStream(REQUEST, http, listener);
        try {
            stream.start(executor);
            body.push("data: x\n\n");
            assertThat(listener.firstMessage.await(5, TimeUnit.SECONDS)).isTrue();

            stream.cancel();
            body.push("data: y\n\n");
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(listener.calls).containsExactly("message:x", "complete");
        assertThat(response.isClosed()).isTrue();
        assertThat(stream.isClosed()).isTrue();
    }
}
