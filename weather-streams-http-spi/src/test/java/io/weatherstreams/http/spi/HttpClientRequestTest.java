package io.weatherstreams.http.spi;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientRequestTest {

    private static final URI URI_ = URI.create("http://localhost/api/events");

    @Test
    void headerNamesAreCaseInsensitive() {
        HttpClientRequest request = HttpClientRequest.get(URI_)
                .header("Last-Event-ID", "1")
                .headers(Map.of("last-event-id", "2"))
                .build();

        assertThat(request.headers()).hasSize(1);
        assertThat(request.header("LAST-EVENT-ID")).contains("2");
        assertThat(request.header("Accept")).isEmpty();
    }

    @Test
    void onlyPostCarriesABody() {
        assertThat(HttpClientRequest.post(URI_).body(new byte[] {1}).build().body()).containsExactly(1);
        assertThatThrownBy(() -> HttpClientRequest.get(URI_).body(new byte[] {1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timeoutMustBePositive() {
        assertThatThrownBy(() -> HttpClientRequest.get(URI_).timeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(HttpClientRequest.get(URI_).build().timeout()).isNull();
    }

    @Test
    void headersAreImmutable() {
        HttpClientRequest request = HttpClientRequest.get(URI_).header("Accept", "text/event-stream").build();

        assertThatThrownBy(() -> request.headers().put("X", "y")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(request).hasToString("GET http://localhost/api/events");
    }
}
