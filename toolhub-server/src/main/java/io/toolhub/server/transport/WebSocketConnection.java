package io.toolhub.server.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// Tool-server handle over a WebSocket.
///
/// Each JSON-RPC message travels as one text message, possibly split over several
/// frames. Responses are matched to requests by id through {@link PendingRequests}.
///
/// @implNote Thread-safe. Outgoing messages are serialized on a monitor because a
/// {@link WebSocket} accepts one pending send at a time.
public class WebSocketConnection extends JsonRpcConnection {

    private static final Logger LOG = Logger.getLogger(WebSocketConnection.class);

    private final PendingRequests pending = new PendingRequests();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object sendLock = new Object();
    private volatile WebSocket webSocket;

    private WebSocketConnection(String endpoint, JsonRpc jsonRpc, Duration timeout) {
        super(endpoint, jsonRpc, timeout);
    }

    /// Opens the socket and performs the handshake.
    ///
    /// @param endpoint `ws://` or `wss://` URL
    /// @param httpClient shared client used to build the socket
    /// @param jsonRpc JSON-RPC framing
    /// @param timeout per-request bound, also used for the opening handshake
    /// @return connected handle
    /// @throws ToolServerException if the socket cannot be opened or the handshake fails
    public static WebSocketConnection open(
            String endpoint, HttpClient httpClient, JsonRpc jsonRpc, Duration timeout)
            throws ToolServerException {
        WebSocketConnection connection = new WebSocketConnection(endpoint, jsonRpc, timeout);
        CompletableFuture<WebSocket> opening;
        try {
            opening =
                    httpClient
                            .newWebSocketBuilder()
                            .connectTimeout(timeout)
                            .buildAsync(URI.create(endpoint), connection.new Listener());
        } catch (IllegalArgumentException e) {
            throw new ToolServerException("Invalid WebSocket endpoint: " + endpoint, e);
        }
        try {
            connection.webSocket = opening.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abortWhenOpened(opening);
            throw ToolServerException.timeout(
                    "WebSocket connect to " + endpoint, timeout.toMillis());
        } catch (ExecutionException e) {
            throw ToolServerException.connectionFailed(endpoint, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortWhenOpened(opening);
            throw ToolServerException.connectionFailed(endpoint, e);
        }

        try {
            connection.initialize();
        } catch (ToolServerException e) {
            connection.close();
            throw e;
        }
        return connection;
    }

    @Override
    protected String exchange(String id, String method, String requestJson)
            throws ToolServerException {
        CompletableFuture<String> response = pending.register(id);
        try {
            send(requestJson);
        } catch (ToolServerException e) {
            pending.forget(id);
            throw e;
        }
        return pending.await(id, response, method, timeout);
    }

    @Override
    protected void send(String json) throws ToolServerException {
        if (closed.get()) {
            throw new ToolServerException("Connection closed: " + endpoint);
        }
        synchronized (sendLock) {
            try {
                webSocket.sendText(json, true).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw ToolServerException.timeout("WebSocket send", timeout.toMillis());
            } catch (ExecutionException e) {
                throw new ToolServerException(
                        "WebSocket send to " + endpoint + " failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolServerException("Interrupted while sending to " + endpoint, e);
            }
        }
    }

    @Override
    public boolean isConnected() {
        WebSocket socket = webSocket;
        return !closed.get() && socket != null && !socket.isInputClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pending.failAll(new ToolServerException("Connection closed: " + endpoint));
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.sendClose(WebSocket.NORMAL_CLOSURE, "closing")
                    .whenComplete(
                            (ws, error) -> {
                                if (error != null) {
                                    LOG.debugv(
                                            "Close handshake with {0} failed: {1}",
                                            endpoint, error.getMessage());
                                }
                                socket.abort();
                            });
        }
        ended("closed");
    }

    /// Aborts a socket that finishes opening after the caller stopped waiting for it.
    static void abortWhenOpened(CompletableFuture<WebSocket> opening) {
        opening.whenComplete(
                (ws, error) -> {
                    if (ws != null) {
                        ws.abort();
                    }
                });
    }

    private void onRemoteClose(String reason) {
        if (closed.compareAndSet(false, true)) {
            LOG.infov("WebSocket {0} closed by server: {1}", endpoint, reason);
            pending.failAll(new ToolServerException("Connection closed by server: " + reason));
            ended("closed by server: " + reason);
        }
    }

    private final class Listener implements WebSocket.Listener {

        private final StringBuilder buffer = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            buffer.append(data);
            if (last) {
                String message = buffer.toString();
                buffer.setLength(0);
                dispatch(message, pending);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            onRemoteClose(statusCode + " " + reason);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            LOG.warnv(error, "WebSocket error on {0}", endpoint);
            onRemoteClose(String.valueOf(error.getMessage()));
        }
    }
}
