package io.toolhub.server.connection;

import io.toolhub.core.error.ErrorReport;
import io.toolhub.core.error.ErrorReporter;
import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.server.ServerRegistry;
import io.toolhub.core.server.ServerState;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.core.tool.ToolRegistry;
import io.toolhub.server.config.ToolHubWorker;
import io.toolhub.server.discovery.ToolDiscovery;
import io.toolhub.server.transport.ToolServerConnection;
import io.toolhub.server.transport.ToolServerException;
import io.toolhub.server.transport.TransportFactory;
import io.toolhub.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.jboss.logging.Logger;

/// Owns the lifecycle of one live connection per registered server.
///
/// Connects through the {@link TransportFactory}, publishes discovered tools into the
/// {@link ToolRegistry}, reconnects with exponential backoff after failures and
/// removes a server's tools when it is disconnected.
///
/// ### Retry
/// A failed connect or discovery, or the loss of an established connection reported by
/// its transport, increments the retry count. While the count is below the server's
/// `maxRetries`, one reconnect timer is armed with a delay of
/// `baseDelay * 2^(retryCount - 1)` capped at the maximum delay. Reaching `maxRetries`
/// leaves the server {@link ServerState#EXHAUSTED}, reported once and never retried
/// until a manual {@link #connect}. Configuration failures (unregistered id, disabled
/// transport) are never retried.
///
/// ### Consistency
/// Each server id has a slot whose monitor guards its instance and tool publication.
/// Network I/O runs outside the monitor; an attempt remembers the slot generation it
/// started under and commits only if nothing (a disconnect or a newer attempt) bumped
/// it meanwhile. Stale results are closed and dropped. No lock spans servers.
///
/// @implNote Thread-safe.
/// @see ConnectionInstance
@ApplicationScoped
public class ConnectionManager {

    private static final Logger LOG = Logger.getLogger(ConnectionManager.class);

    private final Map<String, ServerSlot> slots = new ConcurrentHashMap<>();

    private final ServerRegistry servers;
    private final ToolRegistry tools;
    private final TransportFactory transports;
    private final ToolDiscovery discovery;
    private final ErrorReporter errors;
    private final ReconnectScheduler scheduler;
    private final BackoffPolicy backoff;
    private final Executor worker;
    private final Clock clock;

    @Inject
    public ConnectionManager(
            ServerRegistry servers,
            ToolRegistry tools,
            TransportFactory transports,
            ToolDiscovery discovery,
            ErrorReporter errors,
            ReconnectScheduler scheduler,
            BackoffPolicy backoff,
            @ToolHubWorker Executor worker,
            Clock clock) {
        this.servers = Objects.requireNonNull(servers, "servers must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.transports = Objects.requireNonNull(transports, "transports must not be null");
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.errors = Objects.requireNonNull(errors, "errors must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.worker = Objects.requireNonNull(worker, "worker must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ========== Lifecycle ==========

    /// Connects a registered server and discovers its tools.
    ///
    /// Cancels any pending reconnect timer and resets the retry budget. If the server is
    /// already connected, the new handle replaces the old one on success.
    ///
    /// @param serverId the server to connect, not null
    /// @return completes with true once connected and published, false on any failure;
    ///     never completes exceptionally
    public CompletableFuture<Boolean> connect(String serverId) {
        return attempt(serverId, true, 0);
    }

    /// Disconnects a server and removes its tools from the registry.
    ///
    /// Closes the handle, cancels the pending reconnect timer, drops the connection
    /// instance and removes every registry entry of the server. Any attempt still in
    /// flight is discarded when it completes. Idempotent; never throws.
    ///
    /// @param serverId the server to disconnect, not null
    /// @return true if a connection instance existed
    public boolean disconnect(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        ServerSlot slot = slots.get(serverId);
        ToolServerConnection handle = null;
        boolean existed = false;
        int removed;
        if (slot != null) {
            synchronized (slot) {
                slot.generation++;
                slot.configError = null;
                ConnectionInstance instance = slot.instance;
                if (instance != null) {
                    instance.cancelReconnect();
                    handle = instance.detach();
                    slot.instance = null;
                    existed = true;
                }
                removed = tools.removeServerTools(serverId);
            }
        } else {
            removed = tools.removeServerTools(serverId);
        }
        closeQuietly(serverId, handle);

        if (existed || removed > 0) {
            LOG.infov(
                    "Disconnected {0}, removed {1} tools",
                    LogSanitizer.sanitize(serverId),
                    removed);
        }
        return existed;
    }

    /// Disconnects every server. Leaves no instance and no pending timer behind.
    public void disconnectAll() {
        List<String> ids = new ArrayList<>(slots.keySet());
        for (String id : ids) {
            disconnect(id);
        }
        LOG.infov("Disconnected all servers ({0})", ids.size());
    }

    /// Disconnects a server and drops its slot. Used when a definition is deregistered.
    ///
    /// @param serverId the server, not null
    /// @return true if a connection instance existed
    public boolean forget(String serverId) {
        boolean existed = disconnect(serverId);
        slots.remove(serverId);
        return existed;
    }

    /// Re-runs discovery on a live connection and republishes the result.
    ///
    /// A failure is reported as a recoverable network error and leaves the published
    /// tool set untouched; it does not trigger a reconnect.
    ///
    /// @param serverId the server to refresh, not null
    /// @return completes with the new tool count; completes exceptionally with
    ///     {@link IllegalStateException} if the server is not connected, or with
    ///     {@link ToolServerException} if discovery fails
    public CompletableFuture<Integer> refresh(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Optional<ServerDefinition> definition = servers.get(serverId);
        ServerSlot slot = slots.get(serverId);
        if (definition.isEmpty() || slot == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Server not connected: " + serverId));
        }

        ToolServerConnection connection;
        long generation;
        synchronized (slot) {
            ConnectionInstance instance = slot.instance;
            if (instance == null || !instance.isConnected()) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Server not connected: " + serverId));
            }
            connection = instance.handle();
            generation = slot.generation;
        }

        try {
            return CompletableFuture.supplyAsync(
                    () -> rediscover(definition.get(), slot, generation, connection), worker);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Connection worker unavailable", e));
        }
    }

    // ========== Queries ==========

    /// Returns the live handle of a connected server.
    ///
    /// @param serverId the server, not null
    /// @return the handle, or empty if the server has no connected instance
    public Optional<ToolServerConnection> liveConnection(String serverId) {
        ServerSlot slot = slots.get(serverId);
        if (slot == null) {
            return Optional.empty();
        }
        synchronized (slot) {
            ConnectionInstance instance = slot.instance;
            return instance != null && instance.isConnected()
                    ? Optional.of(instance.handle())
                    : Optional.empty();
        }
    }

    /// Returns the tools of a server's live connection with their current enabled flags.
    ///
    /// @param serverId the server, not null
    /// @return the tools, empty unless the server is connected
    public List<ToolEntry> liveTools(String serverId) {
        ServerSlot slot = slots.get(serverId);
        if (slot == null) {
            return List.of();
        }
        List<ToolEntry> known;
        synchronized (slot) {
            ConnectionInstance instance = slot.instance;
            if (instance == null || !instance.isConnected()) {
                return List.of();
            }
            known = instance.tools();
        }
        List<ToolEntry> result = new ArrayList<>(known.size());
        for (ToolEntry entry : known) {
            boolean enabled = tools.find(entry.key()).map(ToolEntry::enabled).orElse(true);
            result.add(entry.withEnabled(enabled));
        }
        return List.copyOf(result);
    }

    /// Returns the status of one server.
    ///
    /// @param serverId the server, not null
    /// @return the status; {@link ServerState#UNREGISTERED} for unknown ids
    public ConnectionStatus status(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Optional<ServerDefinition> definition = servers.get(serverId);
        ServerSlot slot = slots.get(serverId);
        if (slot != null) {
            synchronized (slot) {
                if (slot.instance != null) {
                    return slot.instance.snapshot();
                }
                if (slot.configError != null && definition.isPresent()) {
                    return new ConnectionStatus(
                            serverId,
                            definition.get().name(),
                            ServerState.MISCONFIGURED,
                            false,
                            null,
                            0,
                            0,
                            slot.configError);
                }
            }
        }
        return definition
                .map(ConnectionStatus::idle)
                .orElseGet(
                        () ->
                                new ConnectionStatus(
                                        serverId,
                                        serverId,
                                        ServerState.UNREGISTERED,
                                        false,
                                        null,
                                        0,
                                        0,
                                        null));
    }

    /// Returns the status of every registered server.
    ///
    /// @return one status per registered definition, never null
    public List<ConnectionStatus> statuses() {
        List<ConnectionStatus> result = new ArrayList<>();
        for (ServerDefinition definition : servers.all()) {
            result.add(status(definition.id()));
        }
        return List.copyOf(result);
    }

    /// Returns snapshots of the existing connection instances only.
    ///
    /// Servers that were never connected, or were disconnected, have no instance.
    ///
    /// @return instance snapshots, never null
    public List<ConnectionStatus> instances() {
        List<ConnectionStatus> result = new ArrayList<>();
        for (ServerSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.instance != null) {
                    result.add(slot.instance.snapshot());
                }
            }
        }
        return List.copyOf(result);
    }

    /// Returns the number of armed reconnect timers.
    ///
    /// @return pending timer count
    public int pendingReconnects() {
        int pending = 0;
        for (ServerSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.instance != null && slot.instance.hasPendingReconnect()) {
                    pending++;
                }
            }
        }
        return pending;
    }

    // ========== Attempts ==========

    /// Starts a connect attempt.
    ///
    /// A timer attempt (`manual == false`) proceeds only while the slot still carries
    /// `expectedGeneration` and its instance; a disconnect or manual connect in between
    /// cancels it.
    private CompletableFuture<Boolean> attempt(
            String serverId, boolean manual, long expectedGeneration) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Optional<ServerDefinition> found = servers.get(serverId);
        if (found.isEmpty()) {
            if (!manual) {
                LOG.debugv("Skipping reconnect of deregistered server {0}", serverId);
                return CompletableFuture.completedFuture(false);
            }
            String message = "Server not registered: " + serverId;
            LOG.warnv("Connect rejected: {0}", LogSanitizer.sanitize(message));
            errors.report(ErrorReport.config(serverId, message));
            return CompletableFuture.completedFuture(false);
        }

        ServerDefinition definition = found.get();
        ServerSlot slot =
                manual
                        ? slots.computeIfAbsent(serverId, id -> new ServerSlot())
                        : slots.get(serverId);
        if (slot == null) {
            return CompletableFuture.completedFuture(false);
        }

        boolean supported = transports.supports(definition.connectionType());
        String unsupported =
                supported
                        ? null
                        : "Unsupported connection type "
                                + definition.connectionType().value()
                                + " for server "
                                + serverId;
        long generation;
        ToolServerConnection stale = null;
        synchronized (slot) {
            if (!manual && (slot.generation != expectedGeneration || slot.instance == null)) {
                LOG.debugv("Reconnect of {0} superseded before it started", serverId);
                return CompletableFuture.completedFuture(false);
            }
            generation = ++slot.generation;
            if (supported) {
                slot.configError = null;
                if (slot.instance == null) {
                    slot.instance = new ConnectionInstance(definition);
                }
                slot.instance.beginAttempt(manual);
            } else {
                slot.configError = unsupported;
                if (slot.instance != null) {
                    slot.instance.cancelReconnect();
                    stale = slot.instance.markFailed(unsupported, ServerState.MISCONFIGURED);
                }
            }
        }

        if (!supported) {
            closeQuietly(serverId, stale);
            LOG.warnv("Connect rejected: {0}", LogSanitizer.sanitize(unsupported));
            errors.report(ErrorReport.config(serverId, unsupported));
            return CompletableFuture.completedFuture(false);
        }

        LOG.infov(
                "Connecting to {0} ({1}) via {2}",
                LogSanitizer.sanitize(definition.name()),
                LogSanitizer.sanitize(serverId),
                definition.connectionType().value());

        try {
            return CompletableFuture.supplyAsync(
                    () -> establish(definition, slot, generation), worker);
        } catch (RejectedExecutionException e) {
            LOG.warnv("Connect to {0} skipped, worker unavailable", serverId);
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean establish(ServerDefinition definition, ServerSlot slot, long generation) {
        String serverId = definition.id();

        ToolServerConnection connection;
        try {
            connection = transports.create(definition);
        } catch (ToolServerException e) {
            if (ToolServerException.UNSUPPORTED_TRANSPORT.equals(e.getErrorCode())) {
                return misconfigured(definition, slot, generation, e.getMessage());
            }
            return failed(definition, slot, generation, "Connect failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            return failed(definition, slot, generation, "Connect failed: " + e.getMessage(), e);
        }

        List<ToolEntry> discovered;
        try {
            discovered = discovery.discover(connection, definition);
        } catch (RuntimeException e) {
            closeQuietly(serverId, connection);
            return failed(
                    definition, slot, generation, "Tool discovery failed: " + e.getMessage(), e);
        }

        ToolServerConnection replaced;
        synchronized (slot) {
            if (slot.generation != generation || slot.instance == null) {
                replaced = connection;
                connection = null;
            } else {
                replaced = slot.instance.install(connection, discovered, clock.instant());
                tools.replaceServerTools(serverId, discovered);
            }
        }
        closeQuietly(serverId, replaced);

        if (connection == null) {
            LOG.debugv("Discarding superseded connect result for {0}", serverId);
            return false;
        }
        ToolServerConnection live = connection;
        live.onClose(reason -> onConnectionClosed(definition, slot, generation, live, reason));
        LOG.infov(
                "Connected to {0}, discovered {1} tools",
                LogSanitizer.sanitize(definition.name()),
                discovered.size());
        return true;
    }

    private boolean failed(
            ServerDefinition definition,
            ServerSlot slot,
            long generation,
            String message,
            Throwable cause) {
        errors.report(ErrorReport.network(definition.id(), message, cause));
        return scheduleReconnect(definition, slot, generation, null, message);
    }

    /// Handles the end of an installed handle. Closes the manager performed itself
    /// (disconnect, replacement, failed attempt) no longer match the slot and are ignored.
    private void onConnectionClosed(
            ServerDefinition definition,
            ServerSlot slot,
            long generation,
            ToolServerConnection handle,
            String reason) {
        synchronized (slot) {
            if (!holds(slot, generation, handle)) {
                return;
            }
        }
        String message = "Connection lost: " + reason;
        LOG.warnv(
                "{0} ({1})",
                LogSanitizer.sanitize(message),
                LogSanitizer.sanitize(definition.id()));
        errors.report(ErrorReport.network(definition.id(), message, null));
        scheduleReconnect(definition, slot, generation, handle, message);
    }

    /// Counts a failure and either arms the next reconnect timer or gives up.
    ///
    /// @param expectedHandle when not null, the transition applies only while this handle
    ///     is still installed
    private boolean scheduleReconnect(
            ServerDefinition definition,
            ServerSlot slot,
            long generation,
            ToolServerConnection expectedHandle,
            String message) {
        String serverId = definition.id();
        ToolServerConnection stale;
        int retries;
        Duration delay = null;
        synchronized (slot) {
            if (slot.generation != generation
                    || slot.instance == null
                    || (expectedHandle != null && !holds(slot, generation, expectedHandle))) {
                LOG.debugv("Ignoring failure of superseded attempt for {0}", serverId);
                return false;
            }
            ConnectionInstance instance = slot.instance;
            retries = instance.incrementRetries();
            if (retries >= definition.maxRetries()) {
                stale = instance.markFailed(message, ServerState.EXHAUSTED);
            } else {
                stale = instance.markFailed(message, ServerState.RECONNECTING);
                delay = backoff.delayFor(retries - 1);
                instance.armReconnect(
                        scheduler.schedule(() -> onReconnectTimer(serverId, generation), delay));
            }
        }
        closeQuietly(serverId, stale);

        if (delay == null) {
            LOG.warnv(
                    "Giving up on {0} after {1} failed attempts",
                    LogSanitizer.sanitize(serverId), retries);
            errors.report(
                    ErrorReport.exhausted(
                            serverId,
                            "Retries exhausted after " + retries + " attempts: " + message));
        } else {
            LOG.infov(
                    "Reconnecting to {0} in {1}ms (attempt {2} of {3})",
                    LogSanitizer.sanitize(serverId),
                    delay.toMillis(),
                    retries + 1,
                    definition.maxRetries());
        }
        return false;
    }

    private boolean misconfigured(
            ServerDefinition definition, ServerSlot slot, long generation, String message) {
        String serverId = definition.id();
        errors.report(ErrorReport.config(serverId, message));
        ToolServerConnection stale = null;
        synchronized (slot) {
            if (slot.generation == generation && slot.instance != null) {
                slot.configError = message;
                stale = slot.instance.markFailed(message, ServerState.MISCONFIGURED);
            }
        }
        closeQuietly(serverId, stale);
        LOG.warnv("Connect rejected: {0}", LogSanitizer.sanitize(message));
        return false;
    }

    private void onReconnectTimer(String serverId, long generation) {
        ServerSlot slot = slots.get(serverId);
        if (slot == null) {
            return;
        }
        synchronized (slot) {
            ConnectionInstance instance = slot.instance;
            if (slot.generation != generation
                    || instance == null
                    || instance.state() != ServerState.RECONNECTING) {
                return;
            }
            instance.clearReconnect();
        }
        LOG.debugv("Reconnect timer fired for {0}", serverId);
        attempt(serverId, false, generation);
    }

    private int rediscover(
            ServerDefinition definition,
            ServerSlot slot,
            long generation,
            ToolServerConnection connection) {
        String serverId = definition.id();
        List<ToolEntry> discovered;
        try {
            discovered = discovery.discover(connection, definition);
        } catch (RuntimeException e) {
            String message = "Tool refresh failed: " + e.getMessage();
            LOG.warnv("{0} ({1})", LogSanitizer.sanitize(message), serverId);
            errors.report(ErrorReport.network(serverId, message, e));
            throw e;
        }

        synchronized (slot) {
            ConnectionInstance instance = slot.instance;
            if (slot.generation != generation
                    || instance == null
                    || instance.handle() != connection) {
                throw new IllegalStateException("Server disconnected during refresh: " + serverId);
            }
            instance.replaceTools(discovered);
            tools.replaceServerTools(serverId, discovered);
        }
        LOG.infov("Refreshed {0}: {1} tools", LogSanitizer.sanitize(serverId), discovered.size());
        return discovered.size();
    }

    private static boolean holds(ServerSlot slot, long generation, ToolServerConnection handle) {
        return slot.generation == generation
                && slot.instance != null
                && slot.instance.handle() == handle;
    }

    private static void closeQuietly(String serverId, ToolServerConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (RuntimeException e) {
            LOG.warnv(e, "Closing connection to {0} failed", serverId);
        }
    }

    /// Per-server monitor and the state it guards.
    private static final class ServerSlot {
        private long generation;
        private ConnectionInstance instance;
        private String configError;
    }
}
