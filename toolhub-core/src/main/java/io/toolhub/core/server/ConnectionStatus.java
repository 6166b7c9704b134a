package io.toolhub.core.server;

import java.time.Instant;
import java.util.Objects;

/// Point-in-time view of one server's connection.
///
/// @param serverId server identifier, not null
/// @param serverName display name, not null
/// @param state lifecycle state, not null
/// @param connected whether a live transport handle is installed
/// @param lastConnected time of the last successful connect, may be null
/// @param retryCount failed attempts since the last success
/// @param toolCount tools known from the current connection instance
/// @param lastError message of the most recent failure, may be null
public record ConnectionStatus(
        String serverId,
        String serverName,
        ServerState state,
        boolean connected,
        Instant lastConnected,
        int retryCount,
        int toolCount,
        String lastError) {

    public ConnectionStatus {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    /// Status of a registered server that has no connection instance.
    ///
    /// @param definition the registered definition, not null
    /// @return idle status, never null
    public static ConnectionStatus idle(ServerDefinition definition) {
        return new ConnectionStatus(
                definition.id(), definition.name(), ServerState.IDLE, false, null, 0, 0, null);
    }
}
