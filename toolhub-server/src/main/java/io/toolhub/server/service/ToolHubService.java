package io.toolhub.server.service;

import io.toolhub.core.execution.ToolExecutionResult;
import io.toolhub.core.health.HealthReport;
import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.server.ServerRegistry;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.core.tool.ToolKey;
import io.toolhub.core.tool.ToolRegistry;
import io.toolhub.server.connection.ConnectionManager;
import io.toolhub.server.execution.ExecutionProxy;
import io.toolhub.server.health.HealthMonitor;
import io.toolhub.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.Serial;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.jboss.logging.Logger;

/// Entry point for every inbound operation on servers and tools.
///
/// Ties the server registry, connection manager, tool registry, execution proxy and
/// health monitor together:
/// - Registering, listing and deregistering server definitions
/// - Connecting, disconnecting and refreshing servers
/// - Listing and toggling tools
/// - Executing tools and reporting health
///
/// @see io.toolhub.server.api.ServerResource
/// @see io.toolhub.server.api.ToolResource
@ApplicationScoped
public class ToolHubService {

    private static final Logger LOG = Logger.getLogger(ToolHubService.class);

    private final ServerRegistry servers;
    private final ToolRegistry tools;
    private final ConnectionManager connections;
    private final ExecutionProxy executionProxy;
    private final HealthMonitor healthMonitor;

    @Inject
    public ToolHubService(
            ServerRegistry servers,
            ToolRegistry tools,
            ConnectionManager connections,
            ExecutionProxy executionProxy,
            HealthMonitor healthMonitor) {
        this.servers = Objects.requireNonNull(servers, "servers must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.executionProxy =
                Objects.requireNonNull(executionProxy, "executionProxy must not be null");
        this.healthMonitor =
                Objects.requireNonNull(healthMonitor, "healthMonitor must not be null");
    }

    // ========== Servers ==========

    /// Registers a server definition and, if it is enabled, starts connecting it.
    ///
    /// The connect runs in the background; this method does not wait for it.
    ///
    /// @param definition the definition, not null
    /// @return the pending connect, or a completed `false` for a disabled definition
    /// @throws IllegalStateException if the id is already registered
    public CompletableFuture<Boolean> registerServer(ServerDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        servers.register(definition);
        LOG.infov(
                "Registered server {0} ({1}), enabled={2}",
                LogSanitizer.sanitize(definition.id()),
                definition.connectionType().value(),
                definition.enabled());
        if (!definition.enabled()) {
            return CompletableFuture.completedFuture(false);
        }
        return connections.connect(definition.id());
    }

    /// Disconnects a server and removes its definition and every trace of its tools,
    /// including disabled flags.
    ///
    /// @param serverId the server, not null
    /// @return true if the server was registered
    public boolean deregisterServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        boolean removed = servers.remove(serverId);
        connections.forget(serverId);
        tools.forgetServer(serverId);
        if (removed) {
            LOG.infov("Deregistered server {0}", LogSanitizer.sanitize(serverId));
        }
        return removed;
    }

    public Optional<ServerDefinition> getServer(String serverId) {
        return servers.get(serverId);
    }

    /// @return every registered definition, empty when none are registered
    public List<ServerDefinition> listServers() {
        return servers.all();
    }

    // ========== Connections ==========

    /// Connects a registered server.
    ///
    /// @param serverId the server, not null
    /// @return completes with the outcome, never exceptionally
    /// @throws ServerNotFoundException if the id is not registered
    public CompletableFuture<Boolean> connect(String serverId) {
        requireServer(serverId);
        return connections.connect(serverId);
    }

    /// Disconnects a server. Idempotent.
    ///
    /// @param serverId the server, not null
    /// @return true if a connection instance existed
    public boolean disconnect(String serverId) {
        return connections.disconnect(serverId);
    }

    public void disconnectAll() {
        connections.disconnectAll();
    }

    /// Re-discovers the tools of a connected server.
    ///
    /// @param serverId the server, not null
    /// @return completes with the new tool count
    /// @throws ServerNotFoundException if the id is not registered
    public CompletableFuture<Integer> refresh(String serverId) {
        requireServer(serverId);
        return connections.refresh(serverId);
    }

    public List<ConnectionStatus> statuses() {
        return connections.statuses();
    }

    /// @throws ServerNotFoundException if the id is not registered
    public ConnectionStatus status(String serverId) {
        requireServer(serverId);
        return connections.status(serverId);
    }

    // ========== Tools ==========

    /// Returns enabled tools from every server known to the registry.
    ///
    /// Includes tools of servers that failed after discovery and are waiting to
    /// reconnect; only a disconnect removes them.
    ///
    /// @return available tools, never null
    public List<ToolEntry> listAvailable() {
        return tools.listAvailable();
    }

    /// Returns the enabled tools of a server's live connection.
    ///
    /// @param serverId the server, not null
    /// @return the tools, empty unless the server is connected
    public List<ToolEntry> listServerTools(String serverId) {
        return listServerTools(serverId, false);
    }

    /// Returns the tools of a server's live connection.
    ///
    /// @param serverId the server, not null
    /// @param includeDisabled whether disabled tools are included
    /// @return the tools, empty unless the server is connected
    public List<ToolEntry> listServerTools(String serverId, boolean includeDisabled) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        List<ToolEntry> live = connections.liveTools(serverId);
        if (includeDisabled) {
            return live;
        }
        return live.stream().filter(ToolEntry::enabled).toList();
    }

    public Optional<ToolEntry> findTool(String serverId, String toolName) {
        return tools.find(ToolKey.of(serverId, toolName));
    }

    /// Enables or disables a tool. Unknown tools are left alone.
    ///
    /// @param serverId the owning server, not null
    /// @param toolName the tool, not null
    /// @param enabled the new flag
    /// @return true if the tool exists
    public boolean setEnabled(String serverId, String toolName, boolean enabled) {
        boolean known = tools.setEnabled(ToolKey.of(serverId, toolName), enabled);
        if (known) {
            LOG.infov(
                    "Tool {0} on {1} {2}",
                    LogSanitizer.sanitize(toolName),
                    LogSanitizer.sanitize(serverId),
                    enabled ? "enabled" : "disabled");
        }
        return known;
    }

    // ========== Execution & Health ==========

    public ToolExecutionResult execute(
            String serverId, String toolName, Map<String, Object> arguments) {
        return executionProxy.execute(serverId, toolName, arguments);
    }

    public CompletableFuture<ToolExecutionResult> executeAsync(
            String serverId, String toolName, Map<String, Object> arguments) {
        return executionProxy.executeAsync(serverId, toolName, arguments);
    }

    public HealthReport healthCheck() {
        return healthMonitor.healthCheck();
    }

    private void requireServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        if (!servers.contains(serverId)) {
            throw new ServerNotFoundException("Server not found: " + serverId);
        }
    }

    /// Thrown when an operation names a server that is not registered.
    public static class ServerNotFoundException extends RuntimeException {
        @Serial private static final long serialVersionUID = -1935240921637704982L;

        public ServerNotFoundException(String message) {
            super(message);
        }
    }
}
