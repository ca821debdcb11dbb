package io.weatherstreams.http.spi;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OkHttpClientAdapterTest extends HttpClientAdapterTestSupport {

    @Override
    protected HttpClientAdapter createAdapter() {
        return OkHttpClientAdapter.create(new OkHttpClient.Builder()
                .readTimeout(100, TimeUnit.MILLISECONDS)
                .build());
    }

    @Test
    void quietStreamIsNotCutByReadTimeout() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("data: a\n\n")
                .setBodyDelay(300, TimeUnit.MILLISECONDS));

        try (HttpClientResponse response = adapter.open(
                HttpClientRequest.get(server.url("/quiet").uri()).build())) {
            assertThat(readAll(response.body())).isEqualTo("data: a\n\n");
        }
    }

    @Test
    void closeAbortsBlockedRead() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("data: a\n\n")
                .throttleBody(1, 10, TimeUnit.SECONDS));

        HttpClientResponse response = adapter.open(HttpClientRequest.get(server.url("/slow").uri()).build());
        InputStream body = response.body();
        CompletableFuture<Throwable> reader = CompletableFuture.supplyAsync(() -> {
            try {
                body.readAllBytes();
                return null;
            } catch (IOException e) {
                return e;
            }
        });

        Thread.sleep(200);
        response.close();

        assertThat(reader.get(5, TimeUnit.SECONDS)).isInstanceOf(IOException.class);
    }
}
