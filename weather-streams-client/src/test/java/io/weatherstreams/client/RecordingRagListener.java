package io.weatherstreams.client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

final class RecordingRagListener implements RagStreamListener {

    final List<String> calls = new CopyOnWriteArrayList<>();
    final CountDownLatch completed = new CountDownLatch(1);

    @Override
    public void onStart(String requestId) {
        calls.add("start:" + requestId);
    }

    @Override
    public void onToken(String content, String requestId) {
        calls.add("token:" + content + ":" + requestId);
    }

    @Override
    public void onDone(String requestId) {
        calls.add("done:" + requestId);
    }

    @Override
    public void onError(String message, String requestId) {
        calls.add("error:" + message + ":" + requestId);
    }

    @Override
    public void onComplete() {
        calls.add("complete");
        completed.countDown();
    }
}
