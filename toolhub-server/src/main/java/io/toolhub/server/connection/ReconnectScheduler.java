package io.toolhub.server.connection;

import java.time.Duration;

/// Timer service for reconnect attempts.
///
/// Abstracted from the JDK scheduler so that tests can advance time by hand.
///
/// @see ExecutorReconnectScheduler
public interface ReconnectScheduler {

    /// Runs `task` once after `delay`.
    ///
    /// @param task the task, not null
    /// @param delay the delay, not negative
    /// @return a handle cancelling the task, never null
    Handle schedule(Runnable task, Duration delay);

    /// Cancels every pending task and stops accepting new ones.
    void shutdown();

    /// A scheduled, cancellable task.
    interface Handle {

        /// Cancels the task if it has not run yet.
        ///
        /// @return true if the task was pending and is now cancelled
        boolean cancel();

        /// @return true while the task has neither run nor been cancelled
        boolean isPending();
    }
}
