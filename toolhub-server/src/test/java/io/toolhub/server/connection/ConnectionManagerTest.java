package io.toolhub.server.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.toolhub.core.error.ErrorCategory;
import io.toolhub.core.error.ErrorReport;
import io.toolhub.core.health.HealthReport;
import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.core.server.ConnectionType;
import io.toolhub.core.server.DefaultServerRegistry;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.server.ServerRegistry;
import io.toolhub.core.server.ServerState;
import io.toolhub.core.tool.DefaultToolRegistry;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.core.tool.ToolKey;
import io.toolhub.server.discovery.ToolDiscovery;
import io.toolhub.server.health.HealthMonitor;
import io.toolhub.server.testing.FakeConnection;
import io.toolhub.server.testing.RecordingErrorReporter;
import io.toolhub.server.testing.ScriptedTransportFactory;
import io.toolhub.server.transport.ToolServerException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private DefaultServerRegistry servers;
    private DefaultToolRegistry tools;
    private ScriptedTransportFactory transports;
    private RecordingErrorReporter errors;
    private ManualReconnectScheduler scheduler;
    private Clock clock;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        servers = new DefaultServerRegistry();
        tools = new DefaultToolRegistry();
        transports = new ScriptedTransportFactory();
        errors = new RecordingErrorReporter();
        scheduler = new ManualReconnectScheduler();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        manager = newManager(transports, Runnable::run);
    }

    private ConnectionManager newManager(ScriptedTransportFactory factory, Executor worker) {
        return newManager(servers, factory, worker);
    }

    private ConnectionManager newManager(
            ServerRegistry registry, ScriptedTransportFactory factory, Executor worker) {
        return new ConnectionManager(
                registry,
                tools,
                factory,
                new ToolDiscovery(Runnable::run, clock),
                errors,
                scheduler,
                new BackoffPolicy(Duration.ofSeconds(1), Duration.ofMinutes(5)),
                worker,
                clock);
    }

    private ServerDefinition register(String id) {
        return register(id, ConnectionType.STREAMABLE_HTTP, 3);
    }

    private ServerDefinition register(String id, ConnectionType type, int maxRetries) {
        ServerDefinition definition =
                ServerDefinition.builder()
                        .id(id)
                        .name(id.toUpperCase())
                        .endpoint(type == ConnectionType.STDIO ? "node server.js" : "http://" + id)
                        .connectionType(type)
                        .maxRetries(maxRetries)
                        .build();
        servers.register(definition);
        return definition;
    }

    @Nested
    class Connect {

        @Test
        void shouldPublishDiscoveredToolsOnSuccess() {
            register("search");
            transports.succeed("search", FakeConnection.withTools("web_search", "news"));

            boolean connected = manager.connect("search").join();

            assertThat(connected).isTrue();
            ConnectionStatus status = manager.status("search");
            assertThat(status.state()).isEqualTo(ServerState.CONNECTED);
            assertThat(status.connected()).isTrue();
            assertThat(status.retryCount()).isZero();
            assertThat(status.toolCount()).isEqualTo(2);
            assertThat(status.lastConnected()).isEqualTo(NOW);
            assertThat(tools.forServer("search"))
                    .extracting(ToolEntry::name)
                    .containsExactlyInAnyOrder("web_search", "news");
            assertThat(manager.liveConnection("search")).isPresent();
        }

        @Test
        void shouldAttributeToolsWithSameNameToEachServer() {
            register("alpha");
            register("beta");
            transports.succeed("alpha", FakeConnection.withTools("search"));
            transports.succeed("beta", FakeConnection.withTools("search"));

            manager.connect("alpha").join();
            manager.connect("beta").join();

            assertThat(tools.listAvailable())
                    .extracting(ToolEntry::key)
                    .containsExactlyInAnyOrder(
                            ToolKey.of("alpha", "search"), ToolKey.of("beta", "search"));

            manager.disconnect("alpha");

            assertThat(tools.listAvailable())
                    .extracting(ToolEntry::key)
                    .containsExactly(ToolKey.of("beta", "search"));
        }

        @Test
        void shouldReportConfigErrorForUnregisteredServer() {
            boolean connected = manager.connect("ghost").join();

            assertThat(connected).isFalse();
            assertThat(errors.ofCategory(ErrorCategory.CONFIG))
                    .singleElement()
                    .satisfies(r -> assertThat(r.serverId()).isEqualTo("ghost"));
            assertThat(manager.status("ghost").state()).isEqualTo(ServerState.UNREGISTERED);
            assertThat(manager.instances()).isEmpty();
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldRejectUnsupportedTransportWithoutRetry() {
            ScriptedTransportFactory httpOnly =
                    new ScriptedTransportFactory(EnumSet.of(ConnectionType.STREAMABLE_HTTP));
            manager = newManager(httpOnly, Runnable::run);
            register("local", ConnectionType.STDIO, 3);

            boolean connected = manager.connect("local").join();

            assertThat(connected).isFalse();
            assertThat(errors.ofCategory(ErrorCategory.CONFIG)).hasSize(1);
            assertThat(errors.ofCategory(ErrorCategory.NETWORK)).isEmpty();
            assertThat(manager.status("local").state()).isEqualTo(ServerState.MISCONFIGURED);
            assertThat(manager.pendingReconnects()).isZero();
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldTreatFactoryUnsupportedTransportErrorAsConfiguration() {
            register("ws", ConnectionType.WEBSOCKET, 3);
            transports.fail(
                    "ws",
                    new ToolServerException(
                            "WebSocket disabled", ToolServerException.UNSUPPORTED_TRANSPORT));

            boolean connected = manager.connect("ws").join();

            assertThat(connected).isFalse();
            assertThat(manager.status("ws").state()).isEqualTo(ServerState.MISCONFIGURED);
            assertThat(errors.ofCategory(ErrorCategory.CONFIG)).hasSize(1);
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldReplaceHandleWhenConnectingAgain() {
            register("search");
            FakeConnection first = FakeConnection.withTools("a");
            FakeConnection second = FakeConnection.withTools("a", "b");
            transports.succeed("search", first).succeed("search", second);

            manager.connect("search").join();
            manager.connect("search").join();

            assertThat(first.isClosed()).isTrue();
            assertThat(manager.liveConnection("search")).containsSame(second);
            assertThat(tools.forServer("search")).hasSize(2);
        }

        @Test
        void shouldKeepStaleToolsAvailableAfterFailedReconnect() {
            register("search");
            FakeConnection connection = FakeConnection.withTools("web_search");
            transports.succeed("search", connection).fail("search", "connection reset");

            manager.connect("search").join();
            boolean reconnected = manager.connect("search").join();

            assertThat(reconnected).isFalse();
            assertThat(connection.isClosed()).isTrue();
            assertThat(manager.status("search").state()).isEqualTo(ServerState.RECONNECTING);
            assertThat(manager.liveConnection("search")).isEmpty();
            assertThat(manager.liveTools("search")).isEmpty();
            assertThat(tools.listAvailable()).extracting(ToolEntry::name).contains("web_search");
        }

        @Test
        void shouldCloseHandleWhenDiscoveryFails() {
            register("search");
            FakeConnection connection =
                    new FakeConnection("http://search")
                            .failListing(new ToolServerException("tools/list refused"));
            transports.succeed("search", connection);

            boolean connected = manager.connect("search").join();

            assertThat(connected).isFalse();
            assertThat(connection.isClosed()).isTrue();
            assertThat(manager.status("search").lastError())
                    .startsWith("Tool discovery failed")
                    .contains("tools/list refused");
            assertThat(scheduler.pending()).isEqualTo(1);
        }
    }

    @Nested
    class Backoff {

        @Test
        void shouldDoubleDelayBetweenAttempts() {
            register("flaky", ConnectionType.STREAMABLE_HTTP, 5);

            manager.connect("flaky").join();
            assertThat(scheduler.pendingDelays()).containsExactly(Duration.ofSeconds(1));

            scheduler.advance(Duration.ofMillis(999));
            assertThat(transports.createCount("flaky")).isEqualTo(1);

            scheduler.advance(Duration.ofMillis(1));
            assertThat(transports.createCount("flaky")).isEqualTo(2);
            assertThat(scheduler.pendingDelays()).containsExactly(Duration.ofSeconds(2));

            scheduler.advance(Duration.ofSeconds(2));
            assertThat(transports.createCount("flaky")).isEqualTo(3);
            assertThat(scheduler.pendingDelays()).containsExactly(Duration.ofSeconds(4));
        }

        @Test
        void shouldStopAfterMaxRetriesAndReportExhaustionOnce() {
            register("down", ConnectionType.STREAMABLE_HTTP, 3);

            manager.connect("down").join();
            scheduler.advance(Duration.ofSeconds(1));
            scheduler.advance(Duration.ofSeconds(2));

            assertThat(transports.createCount("down")).isEqualTo(3);
            assertThat(manager.pendingReconnects()).isZero();
            assertThat(scheduler.pending()).isZero();
            ConnectionStatus status = manager.status("down");
            assertThat(status.state()).isEqualTo(ServerState.EXHAUSTED);
            assertThat(status.retryCount()).isEqualTo(3);

            assertThat(errors.reports())
                    .filteredOn(r -> !r.recoverable())
                    .singleElement()
                    .extracting(ErrorReport::message)
                    .asString()
                    .startsWith("Retries exhausted after 3 attempts");

            scheduler.advance(Duration.ofHours(1));
            assertThat(transports.createCount("down")).isEqualTo(3);

            HealthReport health = new HealthMonitor(manager).healthCheck();
            assertThat(health.healthy()).isZero();
            assertThat(health.unhealthy()).isEqualTo(1);
        }

        @Test
        void shouldRecoverAndResetRetriesAfterTransientFailures() {
            register("flaky", ConnectionType.STREAMABLE_HTTP, 3);
            transports
                    .fail("flaky", "refused")
                    .fail("flaky", "refused")
                    .succeed("flaky", FakeConnection.withTools("echo"));

            manager.connect("flaky").join();
            scheduler.advance(Duration.ofSeconds(1));
            assertThat(manager.status("flaky").retryCount()).isEqualTo(2);

            scheduler.advance(Duration.ofSeconds(2));

            ConnectionStatus status = manager.status("flaky");
            assertThat(status.state()).isEqualTo(ServerState.CONNECTED);
            assertThat(status.retryCount()).isZero();
            assertThat(status.lastError()).isNull();
            assertThat(manager.liveTools("flaky")).extracting(ToolEntry::name).contains("echo");
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldResetBudgetOnManualConnectAfterExhaustion() {
            register("down", ConnectionType.STREAMABLE_HTTP, 1);
            manager.connect("down").join();
            assertThat(manager.status("down").state()).isEqualTo(ServerState.EXHAUSTED);

            transports.succeed("down", FakeConnection.withTools("ping"));

            assertThat(manager.connect("down").join()).isTrue();
            assertThat(manager.status("down").retryCount()).isZero();
        }

        @Test
        void shouldCancelPendingTimerOnManualConnect() {
            register("flaky");
            transports.fail("flaky", "refused").succeed("flaky", FakeConnection.withTools("a"));

            manager.connect("flaky").join();
            assertThat(scheduler.pending()).isEqualTo(1);

            assertThat(manager.connect("flaky").join()).isTrue();
            assertThat(scheduler.pending()).isZero();
            assertThat(manager.pendingReconnects()).isZero();
        }
    }

    @Nested
    class Disconnect {

        @Test
        void shouldRemoveToolsAndCloseHandle() {
            register("search");
            FakeConnection connection = FakeConnection.withTools("web_search");
            transports.succeed("search", connection);
            manager.connect("search").join();

            boolean existed = manager.disconnect("search");

            assertThat(existed).isTrue();
            assertThat(connection.isClosed()).isTrue();
            assertThat(tools.forServer("search")).isEmpty();
            assertThat(manager.liveTools("search")).isEmpty();
            assertThat(manager.status("search").state()).isEqualTo(ServerState.IDLE);
            assertThat(manager.instances()).isEmpty();
        }

        @Test
        void shouldBeIdempotent() {
            register("search");
            transports.succeed("search", FakeConnection.withTools("a"));
            manager.connect("search").join();

            assertThat(manager.disconnect("search")).isTrue();
            assertThat(manager.disconnect("search")).isFalse();
            assertThat(manager.disconnect("never-seen")).isFalse();
        }

        @Test
        void shouldCancelReconnectTimer() {
            register("flaky");
            manager.connect("flaky").join();
            assertThat(scheduler.pending()).isEqualTo(1);

            manager.disconnect("flaky");
            scheduler.advance(Duration.ofMinutes(10));

            assertThat(scheduler.pending()).isZero();
            assertThat(transports.createCount("flaky")).isEqualTo(1);
        }

        @Test
        void shouldLeaveNoInstancesOrTimersAfterDisconnectAll() {
            register("up");
            register("down-1");
            register("down-2");
            transports.succeed("up", FakeConnection.withTools("a", "b"));

            manager.connect("up").join();
            manager.connect("down-1").join();
            manager.connect("down-2").join();
            assertThat(manager.pendingReconnects()).isEqualTo(2);

            manager.disconnectAll();
            scheduler.advance(Duration.ofMinutes(10));

            assertThat(manager.instances()).isEmpty();
            assertThat(manager.pendingReconnects()).isZero();
            assertThat(scheduler.pending()).isZero();
            assertThat(tools.all()).isEmpty();
            assertThat(transports.createCount("down-1")).isEqualTo(1);
            assertThat(transports.createCount("down-2")).isEqualTo(1);
        }

        @Test
        void shouldDiscardDiscoveryThatCompletesAfterDisconnect() throws Exception {
            register("slow");
            CountDownLatch gate = new CountDownLatch(1);
            FakeConnection connection = FakeConnection.withTools("late").blockListing(gate);
            transports.succeed("slow", connection);
            ExecutorService worker = Executors.newSingleThreadExecutor();
            try {
                ConnectionManager threaded = newManager(transports, worker);

                CompletableFuture<Boolean> pending = threaded.connect("slow");
                assertThat(connection.awaitListingStarted()).isTrue();

                assertThat(threaded.disconnect("slow")).isTrue();
                gate.countDown();

                assertThat(pending.get(5, TimeUnit.SECONDS)).isFalse();
                assertThat(tools.forServer("slow")).isEmpty();
                assertThat(connection.isClosed()).isTrue();
                assertThat(threaded.instances()).isEmpty();
                assertThat(threaded.liveConnection("slow")).isEmpty();
            } finally {
                worker.shutdownNow();
            }
        }

        @Test
        void shouldNotReconnectWhenDisconnectLandsWhileTimerFires() {
            register("flaky");
            transports.fail("flaky", "refused").succeed("flaky", FakeConnection.withTools("a"));
            InterceptingServerRegistry registry = new InterceptingServerRegistry(servers);
            ConnectionManager racing = newManager(registry, transports, Runnable::run);

            racing.connect("flaky").join();
            assertThat(scheduler.pending()).isEqualTo(1);

            registry.beforeNextLookup(() -> racing.disconnect("flaky"));
            scheduler.advance(Duration.ofSeconds(1));

            assertThat(transports.createCount("flaky")).isEqualTo(1);
            assertThat(racing.status("flaky").state()).isEqualTo(ServerState.IDLE);
            assertThat(racing.instances()).isEmpty();
            assertThat(racing.liveTools("flaky")).isEmpty();
            assertThat(tools.forServer("flaky")).isEmpty();
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldDropSlotWhenForgotten() {
            register("search");
            transports.succeed("search", FakeConnection.withTools("a"));
            manager.connect("search").join();
            servers.remove("search");

            assertThat(manager.forget("search")).isTrue();

            assertThat(manager.status("search").state()).isEqualTo(ServerState.UNREGISTERED);
            assertThat(manager.pendingReconnects()).isZero();
        }
    }

    @Nested
    class ConnectionLoss {

        @Test
        void shouldReconnectWithBackoffWhenTransportIsLost() {
            register("search");
            FakeConnection first = FakeConnection.withTools("web_search");
            FakeConnection second = FakeConnection.withTools("web_search", "news");
            transports.succeed("search", first).succeed("search", second);
            manager.connect("search").join();

            first.drop("socket reset");

            ConnectionStatus status = manager.status("search");
            assertThat(status.state()).isEqualTo(ServerState.RECONNECTING);
            assertThat(status.connected()).isFalse();
            assertThat(status.retryCount()).isEqualTo(1);
            assertThat(manager.liveConnection("search")).isEmpty();
            assertThat(scheduler.pendingDelays()).containsExactly(Duration.ofSeconds(1));
            assertThat(errors.ofCategory(ErrorCategory.NETWORK))
                    .extracting(ErrorReport::message)
                    .containsExactly("Connection lost: socket reset");

            HealthReport health = new HealthMonitor(manager).healthCheck();
            assertThat(health.healthy()).isZero();
            assertThat(health.unhealthy()).isEqualTo(1);

            scheduler.advance(Duration.ofSeconds(1));

            assertThat(manager.status("search").state()).isEqualTo(ServerState.CONNECTED);
            assertThat(manager.status("search").retryCount()).isZero();
            assertThat(tools.forServer("search"))
                    .extracting(ToolEntry::name)
                    .containsExactlyInAnyOrder("web_search", "news");
        }

        @Test
        void shouldExhaustImmediatelyWithoutRetryBudget() {
            register("search", ConnectionType.STREAMABLE_HTTP, 0);
            FakeConnection connection = FakeConnection.withTools("a");
            transports.succeed("search", connection);
            manager.connect("search").join();

            connection.drop("process exited");

            assertThat(manager.status("search").state()).isEqualTo(ServerState.EXHAUSTED);
            assertThat(scheduler.pending()).isZero();
        }

        @Test
        void shouldReportUnhealthyBeforeTransportNotifies() {
            register("search");
            FakeConnection connection = new SilentlyDyingConnection();
            transports.succeed("search", connection);
            manager.connect("search").join();

            connection.close();

            assertThat(manager.liveConnection("search")).isEmpty();
            assertThat(new HealthMonitor(manager).healthCheck().healthy()).isZero();
        }

        @Test
        void shouldIgnoreClosesPerformedByManager() {
            register("search");
            FakeConnection first = FakeConnection.withTools("a");
            FakeConnection second = FakeConnection.withTools("a");
            transports.succeed("search", first).succeed("search", second);
            manager.connect("search").join();

            manager.connect("search").join();
            assertThat(first.isClosed()).isTrue();
            assertThat(manager.status("search").state()).isEqualTo(ServerState.CONNECTED);

            manager.disconnect("search");

            assertThat(second.isClosed()).isTrue();
            assertThat(errors.ofCategory(ErrorCategory.NETWORK)).isEmpty();
            assertThat(scheduler.pending()).isZero();
            assertThat(manager.status("search").state()).isEqualTo(ServerState.IDLE);
        }
    }

    @Nested
    class Refresh {

        @Test
        void shouldReplaceToolsOfConnectedServer() {
            register("search");
            FakeConnection connection = FakeConnection.withTools("a");
            transports.succeed("search", connection);
            manager.connect("search").join();

            connection.reportTools("a", "b", "c");
            int count = manager.refresh("search").join();

            assertThat(count).isEqualTo(3);
            assertThat(tools.forServer("search")).hasSize(3);
            assertThat(manager.status("search").toolCount()).isEqualTo(3);
        }

        @Test
        void shouldKeepDisabledFlagAcrossRediscovery() {
            register("search");
            FakeConnection connection = FakeConnection.withTools("a", "b");
            transports.succeed("search", connection);
            manager.connect("search").join();
            tools.setEnabled(ToolKey.of("search", "a"), false);

            manager.refresh("search").join();

            assertThat(tools.find(ToolKey.of("search", "a")))
                    .hasValueSatisfying(entry -> assertThat(entry.enabled()).isFalse());
            assertThat(manager.liveTools("search"))
                    .filteredOn(ToolEntry::enabled)
                    .extracting(ToolEntry::name)
                    .containsExactly("b");
        }

        @Test
        void shouldFailWhenServerIsNotConnected() {
            register("search");

            CompletableFuture<Integer> result = manager.refresh("search");

            assertThat(result)
                    .failsWithin(Duration.ofSeconds(1))
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(IllegalStateException.class)
                    .withMessageContaining("Server not connected: search");
        }

        @Test
        void shouldLeaveToolsUntouchedWhenRediscoveryFails() {
            register("search");
            FakeConnection connection = FakeConnection.withTools("a", "b");
            transports.succeed("search", connection);
            manager.connect("search").join();
            errors.clear();

            connection.failListing(new ToolServerException("server busy"));
            CompletableFuture<Integer> result = manager.refresh("search");

            assertThat(result)
                    .failsWithin(Duration.ofSeconds(1))
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(ToolServerException.class);
            assertThat(tools.forServer("search")).hasSize(2);
            assertThat(manager.status("search").state()).isEqualTo(ServerState.CONNECTED);
            assertThat(errors.ofCategory(ErrorCategory.NETWORK))
                    .singleElement()
                    .satisfies(r -> assertThat(r.recoverable()).isTrue());
            assertThat(scheduler.pending()).isZero();
        }
    }

    @Nested
    class Queries {

        @Test
        void shouldReportIdleForRegisteredServerWithoutInstance() {
            register("search");

            assertThat(manager.status("search"))
                    .satisfies(
                            s -> {
                                assertThat(s.state()).isEqualTo(ServerState.IDLE);
                                assertThat(s.serverName()).isEqualTo("SEARCH");
                                assertThat(s.connected()).isFalse();
                            });
        }

        @Test
        void shouldListStatusPerRegisteredServer() {
            register("up");
            register("idle");
            transports.succeed("up", FakeConnection.withTools("a"));
            manager.connect("up").join();

            assertThat(manager.statuses())
                    .extracting(ConnectionStatus::serverId, ConnectionStatus::state)
                    .containsExactlyInAnyOrder(
                            tuple("up", ServerState.CONNECTED), tuple("idle", ServerState.IDLE));
            assertThat(manager.instances()).hasSize(1);
        }
    }

    /// Connection that ends without ever notifying its close listeners.
    private static final class SilentlyDyingConnection extends FakeConnection {

        SilentlyDyingConnection() {
            super("fake://silent");
            reportTools("a");
        }

        @Override
        public synchronized void onClose(Consumer<String> listener) {}
    }

    /// Delegating registry that runs a hook inside the next lookup.
    private static final class InterceptingServerRegistry implements ServerRegistry {

        private final ServerRegistry delegate;
        private final AtomicReference<Runnable> hook = new AtomicReference<>();

        InterceptingServerRegistry(ServerRegistry delegate) {
            this.delegate = delegate;
        }

        void beforeNextLookup(Runnable action) {
            hook.set(action);
        }

        @Override
        public void register(ServerDefinition definition) {
            delegate.register(definition);
        }

        @Override
        public Optional<ServerDefinition> get(String serverId) {
            Runnable action = hook.getAndSet(null);
            if (action != null) {
                action.run();
            }
            return delegate.get(serverId);
        }

        @Override
        public List<ServerDefinition> all() {
            return delegate.all();
        }

        @Override
        public boolean remove(String serverId) {
            return delegate.remove(serverId);
        }
    }
}
