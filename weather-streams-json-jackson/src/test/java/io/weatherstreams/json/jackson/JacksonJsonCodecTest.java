package io.weatherstreams.json.jackson;

import io.weatherstreams.json.spi.JsonCodec;
import io.weatherstreams.json.spi.JsonCodecs;
import io.weatherstreams.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void readsObjectKeepingOrderAndNesting() throws Exception {
        Map<String, Object> value = codec.readObject(
                "{\"type\":\"token\",\"content\":\"Hi\",\"metadata\":{\"scores\":[1,2]},\"requestId\":null}");

        assertThat(value).containsOnlyKeys("type", "content", "metadata", "requestId");
        assertThat(value.keySet()).containsExactly("type", "content", "metadata", "requestId");
        assertThat(value.get("requestId")).isNull();
        assertThat(value.get("metadata")).isEqualTo(Map.of("scores", List.of(1, 2)));
    }

    @Test
    void rejectsNonObjects() {
        assertThatThrownBy(() -> codec.readObject("[1,2]")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("\"text\"")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("null")).isInstanceOf(JsonException.class);
    }

    @Test
    void rejectsMalformedOrBlankText() {
        assertThatThrownBy(() -> codec.readObject("{\"type\":")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("  ")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject(null)).isInstanceOf(JsonException.class);
    }

    @Test
    void writesRecordsAndMaps() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", "Frost tonight?");
        body.put("locationId", "7");

        assertThat(new String(codec.writeBytes(body), StandardCharsets.UTF_8))
                .isEqualTo("{\"query\":\"Frost tonight?\",\"locationId\":\"7\"}");
        assertThat(new String(codec.writeBytes(new Query("wind")), StandardCharsets.UTF_8))
                .isEqualTo("{\"query\":\"wind\"}");
    }

    @Test
    void isDiscoveredThroughServiceLoader() {
        JsonCodec loaded = JsonCodecs.load();

        assertThat(loaded).isInstanceOf(JacksonJsonCodec.class);
        assertThat(JsonCodecs.find(getClass().getClassLoader())).isPresent();
    }

    record Query(String query) {
    }
}
