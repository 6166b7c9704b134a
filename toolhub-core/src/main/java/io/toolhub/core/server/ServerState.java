package io.toolhub.core.server;

/// Lifecycle state of a server as observed through status queries.
public enum ServerState {

    /// No definition with this id is registered.
    UNREGISTERED,

    /// Registered without a connection instance: never connected, or disconnected manually.
    IDLE,

    /// A connect attempt is in flight.
    CONNECTING,

    /// Connected with a discovered tool set.
    CONNECTED,

    /// Last attempt failed; a reconnect timer is armed.
    RECONNECTING,

    /// Retries used up. Terminal until a manual connect.
    EXHAUSTED,

    /// Last connect failed on configuration; never retried automatically.
    MISCONFIGURED;

    /// Returns whether the state is terminal until a caller intervenes.
    ///
    /// @return true for exhausted and misconfigured servers
    public boolean requiresManualConnect() {
        return this == EXHAUSTED || this == MISCONFIGURED;
    }
}
