package io.toolhub.server.connection;

import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.server.ServerState;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.server.transport.ToolServerConnection;
import java.time.Instant;
import java.util.List;

/// Connection state of one server: the live handle, the tools it reported, the retry
/// counter and the pending reconnect timer.
///
/// Created when a connect begins and dropped only by a disconnect. A failed or
/// exhausted instance stays in place, disconnected, so its retry count and last error
/// remain observable.
///
/// @implNote Not thread-safe. Every access happens while holding the monitor of the
/// owning {@link ConnectionManager} slot.
final class ConnectionInstance {

    private final String serverId;
    private final String serverName;

    private ServerState state = ServerState.CONNECTING;
    private ToolServerConnection handle;
    private List<ToolEntry> tools = List.of();
    private Instant lastConnected;
    private int retryCount;
    private String lastError;
    private ReconnectScheduler.Handle reconnect;

    ConnectionInstance(ServerDefinition definition) {
        this.serverId = definition.id();
        this.serverName = definition.name();
    }

    String serverId() {
        return serverId;
    }

    String serverName() {
        return serverName;
    }

    ServerState state() {
        return state;
    }

    /// Connected means installed and still open according to the transport.
    boolean isConnected() {
        return handle != null && state == ServerState.CONNECTED && handle.isConnected();
    }

    ToolServerConnection handle() {
        return handle;
    }

    List<ToolEntry> tools() {
        return tools;
    }

    int retryCount() {
        return retryCount;
    }

    /// Marks a new attempt in flight. A manual attempt also resets the retry budget.
    void beginAttempt(boolean manual) {
        cancelReconnect();
        if (manual) {
            retryCount = 0;
        }
        if (!isConnected()) {
            state = ServerState.CONNECTING;
        }
    }

    /// Installs a freshly connected handle and its discovered tools.
    ///
    /// @return the handle this one replaces, or null
    ToolServerConnection install(
            ToolServerConnection connection, List<ToolEntry> discovered, Instant now) {
        ToolServerConnection previous = handle;
        handle = connection;
        tools = List.copyOf(discovered);
        lastConnected = now;
        retryCount = 0;
        lastError = null;
        state = ServerState.CONNECTED;
        return previous != connection ? previous : null;
    }

    void replaceTools(List<ToolEntry> discovered) {
        tools = List.copyOf(discovered);
    }

    /// Records a failed attempt. The handle is detached; known tools are kept.
    ///
    /// @return the detached handle, or null
    ToolServerConnection markFailed(String error, ServerState newState) {
        lastError = error;
        state = newState;
        return detach();
    }

    int incrementRetries() {
        return ++retryCount;
    }

    ToolServerConnection detach() {
        ToolServerConnection detached = handle;
        handle = null;
        return detached;
    }

    void armReconnect(ReconnectScheduler.Handle timer) {
        cancelReconnect();
        reconnect = timer;
    }

    /// Called by the timer task itself before it starts a new attempt.
    void clearReconnect() {
        reconnect = null;
    }

    void cancelReconnect() {
        if (reconnect != null) {
            reconnect.cancel();
            reconnect = null;
        }
    }

    boolean hasPendingReconnect() {
        return reconnect != null && reconnect.isPending();
    }

    ConnectionStatus snapshot() {
        return new ConnectionStatus(
                serverId,
                serverName,
                state,
                isConnected(),
                lastConnected,
                retryCount,
                tools.size(),
                lastError);
    }
}
