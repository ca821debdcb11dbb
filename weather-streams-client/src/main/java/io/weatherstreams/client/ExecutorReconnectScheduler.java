package io.weatherstreams.client;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ReconnectScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>This class does not own the executor; callers are responsible for shutdown.
 */
public final class ExecutorReconnectScheduler implements ReconnectScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorReconnectScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        ScheduledFuture<?> future = executor.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
        // don't interrupt a task that already started
        return () -> future.cancel(false);
    }
}
