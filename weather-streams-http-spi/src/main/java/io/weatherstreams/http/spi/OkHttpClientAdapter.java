package io.weatherstreams.http.spi;

import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapter over OkHttp. Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 *
 * <p>Every call runs on a derived client with read and call timeouts switched off, so a quiet
 * stream is never cut by the client. The request timeout bounds connecting only. Closing the
 * response cancels the call, which unblocks a pending body read.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient base;

    private OkHttpClientAdapter(OkHttpClient base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient client) {
        return new OkHttpClientAdapter(client);
    }

    @Override
    public HttpClientResponse open(HttpClientRequest request) throws HttpClientException {
        Call call = clientFor(request.timeout()).newCall(buildRequest(request));
        try {
            return new OkResponse(call, call.execute());
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (InterruptedIOException e) {
            throw new HttpClientException(request.uri(), "request interrupted", e);
        } catch (IOException e) {
            throw new HttpClientException(request.uri(), "request failed: " + e.getMessage(), e);
        }
    }

    private OkHttpClient clientFor(Duration connectTimeout) {
        OkHttpClient.Builder builder = base.newBuilder()
                .readTimeout(Duration.ZERO)
                .callTimeout(Duration.ZERO);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        return builder.build();
    }

    private static Request buildRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder().url(request.uri().toString());
        request.headers().forEach(builder::header);
        if (HttpClientRequest.POST.equals(request.method())) {
            MediaType type = request.header("Content-Type").map(MediaType::parse).orElse(null);
            byte[] body = request.body() == null ? EMPTY : request.body();
            builder.post(RequestBody.create(body, type));
        } else {
            builder.get();
        }
        return builder.build();
    }

    private static final class OkResponse implements HttpClientResponse {
        private final Call call;
        private final Response delegate;
        private final AtomicBoolean released = new AtomicBoolean();

        OkResponse(Call call, Response delegate) {
            this.call = call;
            this.delegate = delegate;
        }

        @Override
        public int statusCode() {
            return delegate.code();
        }

        @Override
        public Optional<String> header(String name) {
            return Optional.ofNullable(delegate.header(name));
        }

        @Override
        public InputStream body() {
            ResponseBody body = delegate.body();
            return body == null ? InputStream.nullInputStream() : body.byteStream();
        }

        @Override
        public void close() {
            if (released.getAndSet(true)) return;
            call.cancel();
            delegate.close();
        }
    }
}
