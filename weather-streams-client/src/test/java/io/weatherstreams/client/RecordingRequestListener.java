package io.weatherstreams.client;

import io.weatherstreams.core.StreamFrame;
import io.weatherstreams.core.WeatherStreamsException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

final class RecordingRequestListener implements RequestStreamListener {

    final List<String> calls = new CopyOnWriteArrayList<>();
    final List<WeatherStreamsException> errors = new CopyOnWriteArrayList<>();
    final CountDownLatch firstMessage = new CountDownLatch(1);
    final CountDownLatch completed = new CountDownLatch(1);

    @Override
    public void onMessage(StreamFrame frame) {
        calls.add("message:" + frame.data());
        firstMessage.countDown();
    }

    @Override
    public void onError(WeatherStreamsException error) {
        errors.add(error);
        calls.add("error");
    }

    @Override
    public void onComplete() {
        calls.add("complete");
        completed.countDown();
    }
}
