package io.weatherstreams.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutorReconnectSchedulerTest {

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorReconnectScheduler scheduler = new ExecutorReconnectScheduler(timer);

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void runsTaskAfterDelay() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule(Duration.ofMillis(10), ran::countDown);

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTaskNeverRuns() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();

        ReconnectScheduler.Cancellable handle = scheduler.schedule(Duration.ofMillis(200), () -> ran.set(true));

        assertThat(handle.cancel()).isTrue();
        Thread.sleep(300);
        assertThat(ran).isFalse();
    }

    @Test
    void negativeDelayIsRejected() {
        assertThatThrownBy(() -> scheduler.schedule(Duration.ofMillis(-1), () -> {}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
