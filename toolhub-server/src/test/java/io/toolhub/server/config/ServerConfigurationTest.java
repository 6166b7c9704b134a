package io.toolhub.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.toolhub.core.server.ConnectionType;
import io.toolhub.server.connection.BackoffPolicy;
import io.toolhub.server.transport.JsonRpc;
import io.toolhub.server.transport.TransportFactory;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ServerConfigurationTest {

    private ServerConfiguration config;

    @BeforeEach
    void setUp() {
        config = new ServerConfiguration();
    }

    @Nested
    class UtilityBeans {

        @Test
        void shouldWriteInstantsAsIsoText() throws Exception {
            ObjectMapper mapper = config.objectMapper();

            Instant at = Instant.parse("2026-03-01T12:00:00Z");

            String json = mapper.writeValueAsString(Map.of("at", at));

            assertThat(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)).isFalse();
            assertThat(json).contains("2026-03-01T12:00:00Z");
        }

        @Test
        void shouldApplyConnectTimeoutToHttpClient() {
            HttpClient client = config.httpClient(Duration.ofSeconds(3));

            assertThat(client.connectTimeout()).contains(Duration.ofSeconds(3));
            assertThat(client.followRedirects()).isEqualTo(HttpClient.Redirect.NORMAL);
        }
    }

    @Nested
    class WorkerPools {

        @Test
        void shouldRejectNonPositiveWorkerCount() {
            assertThatThrownBy(() -> config.workerExecutor(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("toolhub.worker-threads");
        }

        @Test
        void shouldStopWorkerOnDispose() {
            ExecutorService worker = config.workerExecutor(2);

            config.closeWorkerExecutor(worker);

            assertThat(worker.isShutdown()).isTrue();
        }
    }

    @Nested
    class ConnectionPolicy {

        @Test
        void shouldBuildBackoffFromDurations() {
            BackoffPolicy policy =
                    config.backoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30));

            assertThat(policy.delayFor(0)).isEqualTo(Duration.ofMillis(500));
            assertThat(policy.delayFor(10)).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        void shouldParseEnabledTypesIgnoringBlanks() {
            List<String> values = Arrays.asList("stdio", " ", null, "websocket");

            assertThat(ServerConfiguration.parseTypes(values))
                    .containsExactlyInAnyOrder(ConnectionType.STDIO, ConnectionType.WEBSOCKET);
        }

        @Test
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> ServerConfiguration.parseTypes(List.of("sse")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sse");
        }

        @Test
        void shouldCreateFactoryForConfiguredTypesOnly() {
            TransportFactory factory =
                    config.transportFactory(
                            HttpClient.newHttpClient(),
                            new JsonRpc(new ObjectMapper()),
                            List.of("streamable-http"));

            assertThat(factory.supports(ConnectionType.STREAMABLE_HTTP)).isTrue();
            assertThat(factory.supports(ConnectionType.STDIO)).isFalse();
        }
    }
}
