package io.toolhub.server.transport;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/// Runs a blocking call against a tool server with an upper time bound.
///
/// The call executes on the given executor; the caller waits at most `timeout`. On
/// timeout the future is cancelled and abandoned, the handle itself is untouched and
/// stays usable for later calls.
public final class BoundedCall {

    private BoundedCall() {}

    /// Runs `call` and waits at most `timeout` for its result.
    ///
    /// @param executor executor running the call, not null
    /// @param timeout upper bound, positive
    /// @param operation label used in timeout messages
    /// @param call the blocking call
    /// @param <T> result type
    /// @return the call's result
    /// @throws ToolServerException if the call fails, times out or the wait is interrupted
    public static <T> T run(
            Executor executor, Duration timeout, String operation, Supplier<T> call)
            throws ToolServerException {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ToolServerException.timeout(operation, timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolServerException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause());
        } catch (CancellationException e) {
            throw new ToolServerException(operation + " cancelled", e);
        }
    }

    private static ToolServerException unwrap(String operation, Throwable cause) {
        Throwable actual =
                cause instanceof CompletionException && cause.getCause() != null
                        ? cause.getCause()
                        : cause;
        if (actual instanceof ToolServerException) {
            return (ToolServerException) actual;
        }
        return new ToolServerException(operation + " failed: " + actual.getMessage(), actual);
    }
}
