package io.toolhub.server.transport;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jboss.logging.Logger;

/// Correlates JSON-RPC responses with the requests waiting for them.
///
/// Used by transports whose replies arrive on a separate channel (a WebSocket or a
/// process's standard output). Each request registers a future under its id; the
/// reader completes it when the matching response arrives.
///
/// @implNote Thread-safe via ConcurrentHashMap.
final class PendingRequests {

    private static final Logger LOG = Logger.getLogger(PendingRequests.class);

    private final Map<String, CompletableFuture<String>> pending = new ConcurrentHashMap<>();

    CompletableFuture<String> register(String id) {
        CompletableFuture<String> future = new CompletableFuture<>();
        pending.put(id, future);
        return future;
    }

    /// Completes the request waiting for `id`.
    ///
    /// @param id response id, may be null
    /// @param json the raw response
    /// @return true if a waiting request was found
    boolean complete(String id, String json) {
        if (id == null) {
            LOG.warn("Dropping JSON-RPC response without id");
            return false;
        }
        CompletableFuture<String> future = pending.remove(id);
        if (future == null) {
            LOG.debugv("Response for unknown or timed-out request id: {0}", id);
            return false;
        }
        future.complete(json);
        return true;
    }

    /// Blocks until the response for `id` arrives.
    ///
    /// The registration is removed whatever the outcome, so a late response is dropped.
    ///
    /// @param id request id
    /// @param future the future returned by {@link #register}
    /// @param method request method, for error messages
    /// @param timeout bound on the wait
    /// @return the raw response
    /// @throws ToolServerException on timeout, interruption or transport failure
    String await(String id, CompletableFuture<String> future, String method, Duration timeout)
            throws ToolServerException {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw ToolServerException.timeout(method, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolServerException("Interrupted while waiting for " + method, e);
        } catch (ExecutionException e) {
            throw new ToolServerException(
                    method + " failed: " + e.getCause().getMessage(), e.getCause());
        } catch (CancellationException e) {
            throw new ToolServerException(method + " was cancelled", e);
        } finally {
            pending.remove(id);
        }
    }

    void forget(String id) {
        pending.remove(id);
    }

    /// Fails every waiting request, used when the transport closes.
    ///
    /// @param cause the reason, not null
    void failAll(Throwable cause) {
        pending.values().forEach(f -> f.completeExceptionally(cause));
        pending.clear();
    }

    int size() {
        return pending.size();
    }
}
