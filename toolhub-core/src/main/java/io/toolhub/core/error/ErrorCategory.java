package io.toolhub.core.error;

/// Classification of a reported failure.
public enum ErrorCategory {

    /// Connect, discovery or reconnect failures. Drive backoff scheduling.
    NETWORK,

    /// Malformed definitions, unregistered servers and unsupported transports.
    /// Never retried automatically.
    CONFIG,

    /// Tool execution failures and timeouts, returned to the caller.
    AGENT
}
