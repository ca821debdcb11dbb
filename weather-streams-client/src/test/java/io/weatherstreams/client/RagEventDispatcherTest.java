package io.weatherstreams.client;

import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;
import io.weatherstreams.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RagEventDispatcherTest {

    private final RecordingRagListener listener = new RecordingRagListener();
    private final RagEventDispatcher dispatcher =
            new RagEventDispatcher(new RagEventInterpreter(new JacksonJsonCodec(), () -> "gen"), listener);

    @Test
    void oneCallbackPerFrame() {
        dispatcher.onMessage(StreamFrame.ofData("{\"type\":\"start\",\"requestId\":\"r1\"}"));
        dispatcher.onMessage(StreamFrame.ofData("{\"type\":\"token\",\"content\":\"Hi\",\"requestId\":\"r1\"}"));
        dispatcher.onMessage(StreamFrame.ofData(""));
        dispatcher.onMessage(StreamFrame.ofData("{\"type\":\"error\",\"error\":\"late\",\"requestId\":\"r1\"}"));
        dispatcher.onMessage(StreamFrame.ofData("{\"type\":\"done\",\"requestId\":\"r1\"}"));

        assertThat(listener.calls).containsExactly("start:r1", "token:Hi:r1", "error:late:r1", "done:r1");
    }

    @Test
    void transportErrorHasNoRequestId() {
        dispatcher.onError(new WeatherStreamsException.ConnectionLost("reset by peer"));
        dispatcher.onComplete();

        assertThat(listener.calls).containsExactly("error:reset by peer:null", "complete");
    }
}
