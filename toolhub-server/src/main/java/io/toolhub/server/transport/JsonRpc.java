package io.toolhub.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// JSON-RPC 2.0 framing shared by every transport.
///
/// ### Message Types
/// - **Request**: has `id`, `method`, `params`; expects a response
/// - **Notification**: has `method`, `params`; no response
/// - **Response**: has `id` and either `result` or `error`
///
/// Streamable HTTP servers may answer with an event stream instead of a JSON body;
/// {@link #parseEventStream(String)} extracts the `data` payloads of such a body.
///
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    public static final int METHOD_NOT_FOUND = -32601;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Creates a request.
    ///
    /// @param id request identifier used for response correlation
    /// @param method the method to invoke (e.g., `tools/call`)
    /// @param params method parameters
    /// @return serialized request
    public String createRequest(String id, String method, Object params) {
        ObjectNode root = envelope();
        root.put("id", id);
        root.put("method", method);
        root.putPOJO("params", params);
        return root.toString();
    }

    public String createNotification(String method, Object params) {
        ObjectNode root = envelope();
        root.put("method", method);
        root.putPOJO("params", params);
        return root.toString();
    }

    /// Creates a success response to a server-initiated request.
    ///
    /// The id node is echoed verbatim so numeric ids stay numeric.
    ///
    /// @param id the id node of the request being answered
    /// @param result the result payload
    /// @return serialized response
    public String createResponse(JsonNode id, Object result) {
        ObjectNode root = envelope();
        root.set("id", id);
        root.putPOJO("result", result);
        return root.toString();
    }

    public String createErrorResponse(JsonNode id, int code, String message) {
        ObjectNode root = envelope();
        root.set("id", id);
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return root.toString();
    }

    /// Parses a message into a tree.
    ///
    /// @param json the raw message
    /// @return the tree
    /// @throws ToolServerException if the text is not JSON
    public JsonNode read(String json) throws ToolServerException {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ToolServerException("Malformed JSON-RPC message: " + e.getMessage(), e);
        }
    }

    /// Extracts the id of a message as text.
    ///
    /// @param json the message
    /// @return the id, or null if absent or unparseable
    public String extractId(String json) {
        try {
            JsonNode idNode = mapper.readTree(json).get("id");
            return idNode != null && !idNode.isNull() ? idNode.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /// Returns whether a parsed message is a response (has result or error, no method).
    public boolean isResponse(JsonNode node) {
        return (node.has("result") || node.has("error")) && !node.has("method");
    }

    /// Returns whether a parsed message is a request that expects an answer.
    public boolean isRequest(JsonNode node) {
        JsonNode id = node.get("id");
        return node.has("method") && id != null && !id.isNull();
    }

    /// Parses a response and extracts its result.
    ///
    /// @param json the response
    /// @return the result object, empty if the response carries none
    /// @throws ToolServerException if parsing fails or the response carries an error
    public Map<String, Object> parseResult(String json) throws ToolServerException {
        JsonNode node = read(json);

        JsonNode errorNode = node.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String message =
                    errorNode.has("message") ? errorNode.get("message").asText() : "Unknown error";
            int code = errorNode.has("code") ? errorNode.get("code").asInt() : -1;
            throw new ToolServerException(
                    "JSON-RPC error " + code + ": " + message, String.valueOf(code));
        }

        JsonNode resultNode = node.get("result");
        if (resultNode == null || resultNode.isNull()) {
            return Map.of();
        }
        if (!resultNode.isObject()) {
            throw new ToolServerException("JSON-RPC result is not an object: " + resultNode);
        }
        return mapper.convertValue(resultNode, MAP_TYPE);
    }

    /// Splits a `text/event-stream` body into the payloads of its events.
    ///
    /// Multi-line `data` fields are joined with newlines; events without data are
    /// skipped.
    ///
    /// @param body the stream body
    /// @return event payloads in arrival order, never null
    public List<String> parseEventStream(String body) {
        List<String> events = new ArrayList<>();
        StringBuilder data = new StringBuilder();
        for (String line : body.split("\r?\n", -1)) {
            if (line.isEmpty()) {
                flush(data, events);
            } else if (line.startsWith("data:")) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(5).stripLeading());
            }
        }
        flush(data, events);
        return events;
    }

    private static void flush(StringBuilder data, List<String> events) {
        if (data.length() > 0) {
            events.add(data.toString());
            data.setLength(0);
        }
    }

    private ObjectNode envelope() {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        return root;
    }
}
