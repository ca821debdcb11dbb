package io.weatherstreams.client;

import io.weatherstreams.http.spi.HttpClientAdapter;
import io.weatherstreams.http.spi.JdkHttpClientAdapter;
import io.weatherstreams.json.spi.JsonCodec;
import io.weatherstreams.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

public final class WeatherStreamsClientBuilder {
    private HttpClientAdapter httpClient;
    private JsonCodec jsonCodec;
    private ExecutorService executor;
    private ReconnectScheduler scheduler;
    private WeatherStreamsSettings settings;
    private Supplier<String> requestIds;

    WeatherStreamsClientBuilder() {
    }

    public WeatherStreamsClientBuilder httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    public WeatherStreamsClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public WeatherStreamsClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /** Executor running one read task per open stream. Not shut down by the client. */
    public WeatherStreamsClientBuilder executor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    /** Scheduler for reconnect delays and the stall watchdog. */
    public WeatherStreamsClientBuilder scheduler(ReconnectScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        return this;
    }

    public WeatherStreamsClientBuilder settings(WeatherStreamsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        return this;
    }

    /** Source of request ids for plain-text RAG tokens that carry none. */
    public WeatherStreamsClientBuilder requestIdGenerator(Supplier<String> requestIds) {
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
        return this;
    }

    public WeatherStreamsClient build() {
        HttpClientAdapter resolvedHttp = httpClient != null ? httpClient : JdkHttpClientAdapter.create();
        JsonCodec resolvedJson = jsonCodec != null ? jsonCodec : JsonCodecs.load();
        WeatherStreamsSettings resolvedSettings = settings != null ? settings : WeatherStreamsSettings.load();
        Supplier<String> resolvedIds = requestIds != null ? requestIds : () -> UUID.randomUUID().toString();

        ExecutorService ownedExecutor = null;
        ExecutorService resolvedExecutor = executor;
        if (resolvedExecutor == null) {
            ownedExecutor = ClientThreads.newStreamExecutor("weather-streams-read");
            resolvedExecutor = ownedExecutor;
        }
        ScheduledExecutorService ownedTimer = null;
        ReconnectScheduler resolvedScheduler = scheduler;
        if (resolvedScheduler == null) {
            ownedTimer = ClientThreads.newTimer("weather-streams-timer");
            resolvedScheduler = new ExecutorReconnectScheduler(ownedTimer);
        }

        return new DefaultWeatherStreamsClient(resolvedHttp, resolvedJson, resolvedSettings,
                resolvedExecutor, resolvedScheduler, new RagEventInterpreter(resolvedJson, resolvedIds),
                ownedExecutor, ownedTimer);
    }
}
