package io.toolhub.server.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/// Base class for transports speaking the tool-server JSON-RPC dialect.
///
/// Implements the protocol once (handshake, paginated `tools/list`, `tools/call` and
/// server-initiated requests) on top of two transport primitives: {@link #exchange},
/// which sends a request and returns its response, and {@link #send}, which writes a
/// message without waiting.
///
/// Subclasses call {@link #initialize()} once after opening their channel.
abstract class JsonRpcConnection implements ToolServerConnection {

    private static final Logger LOG = Logger.getLogger(JsonRpcConnection.class);

    static final String PROTOCOL_VERSION = "2025-03-26";
    static final Map<String, Object> CLIENT_INFO = Map.of("name", "toolhub", "version", "0.1.0");

    /// Upper bound on `tools/list` pages, guarding against servers that loop cursors.
    private static final int MAX_PAGES = 100;

    protected final String endpoint;
    protected final JsonRpc jsonRpc;
    protected final Duration timeout;

    private final AtomicLong requestIds = new AtomicLong();
    private final List<Consumer<String>> closeListeners = new ArrayList<>();
    private String endReason;

    protected JsonRpcConnection(String endpoint, JsonRpc jsonRpc, Duration timeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// Sends a request and returns the raw response.
    ///
    /// @param id request id
    /// @param method request method
    /// @param requestJson serialized request
    /// @return serialized response
    /// @throws ToolServerException on transport failure or timeout
    protected abstract String exchange(String id, String method, String requestJson)
            throws ToolServerException;

    /// Writes a message without waiting for an answer.
    ///
    /// @param json serialized notification or response
    /// @throws ToolServerException on transport failure
    protected abstract void send(String json) throws ToolServerException;

    /// Performs the protocol handshake.
    ///
    /// @throws ToolServerException if the server rejects or does not answer the handshake
    protected void initialize() throws ToolServerException {
        Map<String, Object> result =
                request(
                        "initialize",
                        Map.of(
                                "protocolVersion", PROTOCOL_VERSION,
                                "capabilities", Map.of(),
                                "clientInfo", CLIENT_INFO));
        LOG.debugv(
                "Handshake with {0} complete, server protocol {1}",
                endpoint, result.get("protocolVersion"));
        send(jsonRpc.createNotification("notifications/initialized", Map.of()));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<ToolDescriptor> listTools() throws ToolServerException {
        List<ToolDescriptor> tools = new ArrayList<>();
        String cursor = null;
        int pages = 0;
        do {
            Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : Map.of();
            Map<String, Object> result = request("tools/list", params);

            Object toolsList = result.get("tools");
            if (toolsList instanceof List) {
                for (Object item : (List<Object>) toolsList) {
                    if (item instanceof Map) {
                        tools.add(parseToolDescriptor((Map<String, Object>) item));
                    }
                }
            }
            Object next = result.get("nextCursor");
            cursor = next instanceof String && !((String) next).isBlank() ? (String) next : null;
        } while (cursor != null && ++pages < MAX_PAGES);
        return List.copyOf(tools);
    }

    @Override
    public Map<String, Object> callTool(String toolName, Map<String, Object> arguments)
            throws ToolServerException {
        Map<String, Object> params = new HashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());

        Map<String, Object> result = request("tools/call", params);
        if (Boolean.TRUE.equals(result.get("isError"))) {
            throw ToolServerException.toolFailed(
                    toolName, describeContent(result), ToolServerException.TOOL_ERROR);
        }
        return result;
    }

    @Override
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public void onClose(Consumer<String> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        String reason;
        synchronized (closeListeners) {
            if (endReason == null) {
                closeListeners.add(listener);
                return;
            }
            reason = endReason;
        }
        listener.accept(reason);
    }

    /// Marks the handle as ended and notifies the close listeners. Only the first call
    /// has an effect.
    ///
    /// @param reason why the handle ended
    protected void ended(String reason) {
        List<Consumer<String>> listeners;
        synchronized (closeListeners) {
            if (endReason != null) {
                return;
            }
            endReason = reason;
            listeners = List.copyOf(closeListeners);
            closeListeners.clear();
        }
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Close listener for {0} failed", endpoint);
            }
        }
    }

    /// Sends a request and parses its result.
    protected Map<String, Object> request(String method, Object params)
            throws ToolServerException {
        String id = String.valueOf(requestIds.incrementAndGet());
        String response = exchange(id, method, jsonRpc.createRequest(id, method, params));
        return jsonRpc.parseResult(response);
    }

    /// Answers a request the server initiated.
    ///
    /// Only `ping` is supported; anything else receives a method-not-found error.
    protected void answerServerRequest(JsonNode message) {
        JsonNode id = message.get("id");
        String method = message.path("method").asText();
        String reply =
                "ping".equals(method)
                        ? jsonRpc.createResponse(id, Map.of())
                        : jsonRpc.createErrorResponse(
                                id, JsonRpc.METHOD_NOT_FOUND, "Method not found: " + method);
        try {
            send(reply);
        } catch (ToolServerException e) {
            LOG.warnv(e, "Failed to answer {0} request from {1}", method, endpoint);
        }
    }

    /// Routes one inbound message: responses complete waiting requests, requests are
    /// answered, notifications are logged.
    protected void dispatch(String json, PendingRequests pending) {
        JsonNode message;
        try {
            message = jsonRpc.read(json);
        } catch (ToolServerException e) {
            LOG.warnv("Ignoring malformed message from {0}: {1}", endpoint, e.getMessage());
            return;
        }
        if (jsonRpc.isResponse(message)) {
            JsonNode id = message.get("id");
            pending.complete(id != null && !id.isNull() ? id.asText() : null, json);
        } else if (jsonRpc.isRequest(message)) {
            answerServerRequest(message);
        } else {
            LOG.debugv(
                    "Notification from {0}: {1}", endpoint, message.path("method").asText());
        }
    }

    @SuppressWarnings("unchecked")
    private static ToolDescriptor parseToolDescriptor(Map<String, Object> toolMap) {
        Object name = toolMap.get("name");
        Object description = toolMap.get("description");
        Object inputSchema = toolMap.get("inputSchema");
        return new ToolDescriptor(
                name != null ? name.toString() : null,
                description != null ? description.toString() : null,
                inputSchema instanceof Map ? (Map<String, Object>) inputSchema : null);
    }

    @SuppressWarnings("unchecked")
    private static String describeContent(Map<String, Object> result) {
        Object content = result.get("content");
        if (content instanceof List) {
            StringBuilder text = new StringBuilder();
            for (Object part : (List<Object>) content) {
                if (part instanceof Map && ((Map<String, Object>) part).get("text") != null) {
                    if (text.length() > 0) {
                        text.append(' ');
                    }
                    text.append(((Map<String, Object>) part).get("text"));
                }
            }
            if (text.length() > 0) {
                return text.toString();
            }
        }
        return "server reported an error";
    }
}
