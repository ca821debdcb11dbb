package io.weatherstreams.client;

import java.time.Duration;

/**
 * Timer surface for reconnect backoff and the stall watchdog.
 *
 * <p>Scheduling is expressed as a relative delay. Implementations must not run a task after its
 * {@link Cancellable#cancel()} returned {@code true}.
 */
public interface ReconnectScheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     *
     * @param delay the delay, not negative
     * @param task the task
     * @return cancellation handle
     */
    Cancellable schedule(Duration delay, Runnable task);

    /**
     * Cancellation handle of a scheduled task.
     */
    @FunctionalInterface
    interface Cancellable {
        /**
         * @return {@code true} if the task was prevented from running
         */
        boolean cancel();
    }
}
