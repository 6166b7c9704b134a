package io.toolhub.server.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/// Tool-server handle over streamable HTTP.
///
/// Every request is an HTTP POST of one JSON-RPC message. The server answers either
/// with an `application/json` body or with a `text/event-stream` body whose events
/// carry the response (and possibly notifications before it).
///
/// A session id handed out by the server in the `Mcp-Session-Id` header during the
/// handshake is echoed on every later request and released with an HTTP DELETE on
/// close.
///
/// @implNote Thread-safe. Requests are independent HTTP exchanges on a shared
/// {@link HttpClient}.
public class StreamableHttpConnection extends JsonRpcConnection {

    private static final Logger LOG = Logger.getLogger(StreamableHttpConnection.class);

    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String EVENT_STREAM = "text/event-stream";

    private final HttpClient httpClient;
    private final URI uri;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile String sessionId;

    StreamableHttpConnection(
            String endpoint, HttpClient httpClient, JsonRpc jsonRpc, Duration timeout) {
        super(endpoint, jsonRpc, timeout);
        this.httpClient = httpClient;
        this.uri = URI.create(endpoint);
    }

    /// Opens a handle and performs the handshake.
    ///
    /// @param endpoint server URL
    /// @param httpClient shared client
    /// @param jsonRpc JSON-RPC framing
    /// @param timeout per-request bound
    /// @return connected handle
    /// @throws ToolServerException if the endpoint is invalid or the handshake fails
    public static StreamableHttpConnection open(
            String endpoint, HttpClient httpClient, JsonRpc jsonRpc, Duration timeout)
            throws ToolServerException {
        StreamableHttpConnection connection;
        try {
            connection = new StreamableHttpConnection(endpoint, httpClient, jsonRpc, timeout);
        } catch (IllegalArgumentException e) {
            throw new ToolServerException("Invalid HTTP endpoint: " + endpoint, e);
        }
        connection.initialize();
        return connection;
    }

    @Override
    protected String exchange(String id, String method, String requestJson)
            throws ToolServerException {
        HttpResponse<String> response = post(method, requestJson);
        String body = response.body() != null ? response.body() : "";

        if (isEventStream(response)) {
            for (String event : jsonRpc.parseEventStream(body)) {
                if (id.equals(jsonRpc.extractId(event))) {
                    return event;
                }
            }
            throw new ToolServerException(
                    "Event stream for " + method + " ended without a response");
        }
        if (body.isBlank()) {
            throw new ToolServerException("Empty response body for " + method);
        }
        return body;
    }

    @Override
    protected void send(String json) throws ToolServerException {
        post("notification", json);
    }

    @Override
    public boolean isConnected() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ended("closed");
        String session = sessionId;
        if (session == null) {
            return;
        }
        HttpRequest request =
                HttpRequest.newBuilder(uri)
                        .timeout(timeout)
                        .header(SESSION_HEADER, session)
                        .DELETE()
                        .build();
        httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete(
                        (response, error) -> {
                            if (error != null) {
                                LOG.debugv(
                                        "Session release for {0} failed: {1}",
                                        endpoint, error.getMessage());
                            }
                        });
    }

    String sessionId() {
        return sessionId;
    }

    private HttpResponse<String> post(String method, String json) throws ToolServerException {
        if (closed.get()) {
            throw new ToolServerException("Connection closed: " + endpoint);
        }
        HttpRequest.Builder builder =
                HttpRequest.newBuilder(uri)
                        .timeout(timeout)
                        .header("Content-Type", "application/json")
                        .header("Accept", "application/json, " + EVENT_STREAM)
                        .POST(HttpRequest.BodyPublishers.ofString(json));
        String session = sessionId;
        if (session != null) {
            builder.header(SESSION_HEADER, session);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw ToolServerException.timeout(method, timeout.toMillis());
        } catch (IOException e) {
            throw new ToolServerException(
                    "HTTP request " + method + " to " + endpoint + " failed: " + e.getMessage(),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolServerException("Interrupted during " + method, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ToolServerException(
                    "HTTP " + status + " from " + endpoint + " for " + method,
                    String.valueOf(status));
        }
        response.headers().firstValue(SESSION_HEADER).ifPresent(s -> sessionId = s);
        return response;
    }

    private static boolean isEventStream(HttpResponse<String> response) {
        Optional<String> contentType = response.headers().firstValue("Content-Type");
        return contentType.map(ct -> ct.startsWith(EVENT_STREAM)).orElse(false);
    }
}
