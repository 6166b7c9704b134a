package io.toolhub.server.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonRpcTest {

    private JsonRpc jsonRpc;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        jsonRpc = new JsonRpc(mapper);
    }

    @Nested
    class CreateMessages {

        @Test
        void shouldCreateValidRequest() throws Exception {
            String json = jsonRpc.createRequest("7", "tools/call", Map.of("name", "search"));

            JsonNode node = mapper.readTree(json);
            assertThat(node.get("jsonrpc").asText()).isEqualTo("2.0");
            assertThat(node.get("id").asText()).isEqualTo("7");
            assertThat(node.get("method").asText()).isEqualTo("tools/call");
            assertThat(node.get("params").get("name").asText()).isEqualTo("search");
        }

        @Test
        void shouldCreateNotificationWithoutId() throws Exception {
            String json = jsonRpc.createNotification("notifications/initialized", Map.of());

            JsonNode node = mapper.readTree(json);
            assertThat(node.get("method").asText()).isEqualTo("notifications/initialized");
            assertThat(node.has("id")).isFalse();
        }

        @Test
        void shouldEchoNumericIdInResponse() throws Exception {
            JsonNode id = mapper.readTree("42");

            JsonNode node = mapper.readTree(jsonRpc.createResponse(id, Map.of()));

            assertThat(node.get("id").isNumber()).isTrue();
            assertThat(node.get("id").asInt()).isEqualTo(42);
            assertThat(node.get("result").isObject()).isTrue();
        }

        @Test
        void shouldCreateErrorResponse() throws Exception {
            JsonNode id = mapper.readTree("\"srv-1\"");

            String json =
                    jsonRpc.createErrorResponse(
                            id, JsonRpc.METHOD_NOT_FOUND, "Method not found: sampling");

            JsonNode node = mapper.readTree(json);
            assertThat(node.get("error").get("code").asInt()).isEqualTo(-32601);
            assertThat(node.get("error").get("message").asText()).contains("sampling");
            assertThat(node.has("result")).isFalse();
        }
    }

    @Nested
    class ParseResult {

        @Test
        void shouldExtractResultObject() {
            Map<String, Object> result =
                    jsonRpc.parseResult(
                            "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"tools\":[]}}");

            assertThat(result).containsEntry("tools", List.of());
        }

        @Test
        void shouldReturnEmptyWhenResultMissing() {
            assertThat(jsonRpc.parseResult("{\"jsonrpc\":\"2.0\",\"id\":\"1\"}")).isEmpty();
        }

        @Test
        void shouldThrowWithCodeOnErrorResponse() {
            String json =
                    "{\"jsonrpc\":\"2.0\",\"id\":\"1\","
                            + "\"error\":{\"code\":-32602,\"message\":\"bad params\"}}";

            assertThatThrownBy(() -> jsonRpc.parseResult(json))
                    .isInstanceOf(ToolServerException.class)
                    .hasMessageContaining("bad params")
                    .extracting(e -> ((ToolServerException) e).getErrorCode())
                    .isEqualTo("-32602");
        }

        @Test
        void shouldRejectNonObjectResult() {
            assertThatThrownBy(() -> jsonRpc.parseResult("{\"id\":\"1\",\"result\":[1,2]}"))
                    .isInstanceOf(ToolServerException.class)
                    .hasMessageContaining("not an object");
        }

        @Test
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> jsonRpc.parseResult("{not json"))
                    .isInstanceOf(ToolServerException.class)
                    .hasMessageStartingWith("Malformed JSON-RPC message");
        }
    }

    @Nested
    class Classification {

        @Test
        void shouldExtractIdAsText() {
            assertThat(jsonRpc.extractId("{\"id\":3,\"result\":{}}")).isEqualTo("3");
            assertThat(jsonRpc.extractId("{\"method\":\"ping\"}")).isNull();
            assertThat(jsonRpc.extractId("garbage")).isNull();
        }

        @Test
        void shouldDistinguishResponsesRequestsAndNotifications() {
            JsonNode response = jsonRpc.read("{\"id\":\"1\",\"result\":{}}");
            JsonNode request = jsonRpc.read("{\"id\":\"9\",\"method\":\"ping\"}");
            JsonNode notification = jsonRpc.read("{\"method\":\"notifications/progress\"}");

            assertThat(jsonRpc.isResponse(response)).isTrue();
            assertThat(jsonRpc.isRequest(response)).isFalse();
            assertThat(jsonRpc.isRequest(request)).isTrue();
            assertThat(jsonRpc.isResponse(request)).isFalse();
            assertThat(jsonRpc.isRequest(notification)).isFalse();
            assertThat(jsonRpc.isResponse(notification)).isFalse();
        }
    }

    @Nested
    class EventStream {

        @Test
        void shouldSplitEventsOnBlankLines() {
            String body = "event: message\ndata: {\"a\":1}\n\ndata: {\"b\":2}\n\n";

            assertThat(jsonRpc.parseEventStream(body)).containsExactly("{\"a\":1}", "{\"b\":2}");
        }

        @Test
        void shouldJoinMultiLineDataAndAcceptCrlf() {
            String body = "data: {\"a\":\r\ndata: 1}\r\n\r\n: comment\r\n\r\n";

            assertThat(jsonRpc.parseEventStream(body)).containsExactly("{\"a\":\n1}");
        }

        @Test
        void shouldFlushTrailingEventWithoutBlankLine() {
            assertThat(jsonRpc.parseEventStream("data: last")).containsExactly("last");
        }

        @Test
        void shouldReturnEmptyForBodyWithoutData() {
            assertThat(jsonRpc.parseEventStream("event: ping\n\n")).isEmpty();
        }
    }
}
