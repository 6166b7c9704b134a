package io.toolhub.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.toolhub.core.error.ErrorReporter;
import io.toolhub.core.server.ConnectionType;
import io.toolhub.core.server.DefaultServerRegistry;
import io.toolhub.core.server.ServerRegistry;
import io.toolhub.core.tool.DefaultToolRegistry;
import io.toolhub.core.tool.ToolRegistry;
import io.toolhub.server.connection.BackoffPolicy;
import io.toolhub.server.connection.ExecutorReconnectScheduler;
import io.toolhub.server.connection.ReconnectScheduler;
import io.toolhub.server.error.LoggingErrorReporter;
import io.toolhub.server.transport.DefaultTransportFactory;
import io.toolhub.server.transport.JsonRpc;
import io.toolhub.server.transport.TransportFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// CDI configuration for the connection and registry beans.
///
/// This class produces:
/// - Utility beans (ObjectMapper, HttpClient, Clock)
/// - The process-wide registries from `toolhub-core`
/// - Executors and the reconnect scheduler, with disposers that stop them
/// - The transport factory and backoff policy, configured from `application.properties`
///
/// ### Configuration
/// - `toolhub.reconnect.base-delay`: first reconnect delay (default: 1s)
/// - `toolhub.reconnect.max-delay`: longest reconnect delay (default: 5m)
/// - `toolhub.transport.enabled-types`: transports allowed to connect (default: all)
/// - `toolhub.http.connect-timeout`: TCP connect timeout for HTTP and WebSocket (default: 10s)
/// - `toolhub.worker-threads`: connect and refresh worker pool size (default: 8)
@ApplicationScoped
public class ServerConfiguration {

    private static final Logger LOG = Logger.getLogger(ServerConfiguration.class);

    // ========== Utility Beans ==========

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Produces
    @Singleton
    public HttpClient httpClient(
            @ConfigProperty(name = "toolhub.http.connect-timeout", defaultValue = "10s")
                    Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Registries ==========

    @Produces
    @Singleton
    public ServerRegistry serverRegistry() {
        return new DefaultServerRegistry();
    }

    @Produces
    @Singleton
    public ToolRegistry toolRegistry() {
        return new DefaultToolRegistry();
    }

    @Produces
    @Singleton
    public ErrorReporter errorReporter() {
        return new LoggingErrorReporter();
    }

    // ========== Executors ==========

    @Produces
    @Singleton
    @ToolHubWorker
    public ExecutorService workerExecutor(
            @ConfigProperty(name = "toolhub.worker-threads", defaultValue = "8") int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("toolhub.worker-threads must be positive");
        }
        return Executors.newFixedThreadPool(threads, daemonThreads("toolhub-worker-"));
    }

    void closeWorkerExecutor(@Disposes @ToolHubWorker ExecutorService executor) {
        executor.shutdownNow();
    }

    @Produces
    @Singleton
    @ToolCalls
    public ExecutorService callExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("toolhub-call-"));
    }

    void closeCallExecutor(@Disposes @ToolCalls ExecutorService executor) {
        executor.shutdownNow();
    }

    @Produces
    @Singleton
    public ReconnectScheduler reconnectScheduler() {
        return new ExecutorReconnectScheduler();
    }

    void closeReconnectScheduler(@Disposes ReconnectScheduler scheduler) {
        scheduler.shutdown();
    }

    // ========== Connection Policy ==========

    @Produces
    @Singleton
    public BackoffPolicy backoffPolicy(
            @ConfigProperty(name = "toolhub.reconnect.base-delay", defaultValue = "1s")
                    Duration baseDelay,
            @ConfigProperty(name = "toolhub.reconnect.max-delay", defaultValue = "5m")
                    Duration maxDelay) {
        return new BackoffPolicy(baseDelay, maxDelay);
    }

    @Produces
    @Singleton
    public TransportFactory transportFactory(
            HttpClient httpClient,
            JsonRpc jsonRpc,
            @ConfigProperty(
                            name = "toolhub.transport.enabled-types",
                            defaultValue = "streamable-http,websocket,stdio")
                    List<String> enabledTypes) {
        Set<ConnectionType> types = parseTypes(enabledTypes);
        LOG.infov("Enabled transports: {0}", types);
        return new DefaultTransportFactory(httpClient, jsonRpc, types);
    }

    static Set<ConnectionType> parseTypes(List<String> values) {
        Set<ConnectionType> types = EnumSet.noneOf(ConnectionType.class);
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            types.add(
                    ConnectionType.parse(value)
                            .orElseThrow(
                                    () ->
                                            new IllegalArgumentException(
                                                    "Unknown connection type in"
                                                            + " toolhub.transport.enabled-types: "
                                                            + value)));
        }
        return types;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
