package io.toolhub.server.connection;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/// {@link ReconnectScheduler} backed by a single-threaded {@link ScheduledExecutorService}.
///
/// Timer tasks only hand work to the connection worker pool, so one thread suffices.
public class ExecutorReconnectScheduler implements ReconnectScheduler {

    private static final Logger LOG = Logger.getLogger(ExecutorReconnectScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorReconnectScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(daemonThreads()));
    }

    ExecutorReconnectScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public Handle schedule(Runnable task, Duration delay) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(delay, "delay must not be null");
        ScheduledFuture<?> future =
                executor.schedule(() -> runGuarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    private static void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.errorv(e, "Reconnect task failed: {0}", e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "toolhub-reconnect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record FutureHandle(ScheduledFuture<?> future) implements Handle {

        @Override
        public boolean cancel() {
            return future.cancel(false);
        }

        @Override
        public boolean isPending() {
            return !future.isDone();
        }
    }
}
