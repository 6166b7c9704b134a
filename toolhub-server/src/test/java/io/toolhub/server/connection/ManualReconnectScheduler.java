package io.toolhub.server.connection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/// {@link ReconnectScheduler} driven by a manual clock.
///
/// Tasks run on the calling thread during {@link #advance(Duration)}, in due order.
/// Tasks scheduled while advancing run in the same call if they fall due before its end.
class ManualReconnectScheduler implements ReconnectScheduler {

    private final List<Timer> timers = new ArrayList<>();
    private long nowMillis;
    private long sequence;
    private boolean shutdown;

    @Override
    public synchronized Handle schedule(Runnable task, Duration delay) {
        if (shutdown) {
            throw new IllegalStateException("scheduler shut down");
        }
        Timer timer = new Timer(task, nowMillis + delay.toMillis(), sequence++);
        timers.add(timer);
        return timer;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        timers.clear();
    }

    void advance(Duration duration) {
        long target;
        synchronized (this) {
            target = nowMillis + duration.toMillis();
        }
        while (true) {
            Timer next;
            synchronized (this) {
                Optional<Timer> due =
                        timers.stream()
                                .filter(t -> t.dueMillis <= target)
                                .min(
                                        Comparator.comparingLong((Timer t) -> t.dueMillis)
                                                .thenComparingLong(t -> t.order));
                if (due.isEmpty()) {
                    nowMillis = target;
                    return;
                }
                next = due.get();
                timers.remove(next);
                nowMillis = Math.max(nowMillis, next.dueMillis);
                next.fired = true;
            }
            next.task.run();
        }
    }

    synchronized int pending() {
        return timers.size();
    }

    /// Delays of the pending timers relative to now, in scheduling order.
    synchronized List<Duration> pendingDelays() {
        return timers.stream()
                .sorted(Comparator.comparingLong(t -> t.order))
                .map(t -> Duration.ofMillis(t.dueMillis - nowMillis))
                .toList();
    }

    private final class Timer implements Handle {
        private final Runnable task;
        private final long dueMillis;
        private final long order;
        private boolean fired;

        private Timer(Runnable task, long dueMillis, long order) {
            this.task = task;
            this.dueMillis = dueMillis;
            this.order = order;
        }

        @Override
        public boolean cancel() {
            synchronized (ManualReconnectScheduler.this) {
                return timers.remove(this);
            }
        }

        @Override
        public boolean isPending() {
            synchronized (ManualReconnectScheduler.this) {
                return !fired && timers.contains(this);
            }
        }
    }
}
