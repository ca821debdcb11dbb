package io.weatherstreams.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records scheduled tasks; tests fire them explicitly. */
final class ManualReconnectScheduler implements ReconnectScheduler {

    private final List<Task> tasks = new ArrayList<>();
    private final List<Duration> history = new ArrayList<>();

    @Override
    public synchronized Cancellable schedule(Duration delay, Runnable runnable) {
        Task task = new Task(delay, runnable);
        tasks.add(task);
        history.add(delay);
        return task::cancel;
    }

    /** @return every delay ever scheduled, in order */
    synchronized List<Duration> scheduledDelays() {
        return List.copyOf(history);
    }

    synchronized List<Duration> pendingDelays() {
        List<Duration> delays = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.cancelled) delays.add(task.delay);
        }
        return delays;
    }

    synchronized int pendingCount() {
        return pendingDelays().size();
    }

    /** Runs the oldest pending task on the calling thread. */
    void runNext() {
        Task next = null;
        synchronized (this) {
            for (Task task : tasks) {
                if (!task.cancelled) {
                    next = task;
                    break;
                }
            }
            if (next == null) throw new IllegalStateException("nothing scheduled");
            tasks.remove(next);
        }
        next.runnable.run();
    }

    private final class Task {
        final Duration delay;
        final Runnable runnable;
        boolean cancelled;

        Task(Duration delay, Runnable runnable) {
            this.delay = delay;
            this.runnable = runnable;
        }

        boolean cancel() {
            synchronized (ManualReconnectScheduler.this) {
                if (cancelled || !tasks.contains(this)) return false;
                cancelled = true;
                tasks.remove(this);
                return true;
            }
        }
    }
}
