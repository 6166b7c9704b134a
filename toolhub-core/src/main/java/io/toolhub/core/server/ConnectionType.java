package io.toolhub.core.server;

import java.util.Locale;
import java.util.Optional;

/// Transport variant used to reach a tool server.
///
/// Each constant is matched by exactly one branch of the server-side transport factory.
/// Adding a transport means adding a constant here and a branch there; existing
/// transports are never subclassed.
public enum ConnectionType {

    /// JSON-RPC over HTTP POST; replies arrive as JSON or as an event stream.
    STREAMABLE_HTTP("streamable-http"),

    /// JSON-RPC text frames over a WebSocket.
    WEBSOCKET("websocket"),

    /// JSON-RPC lines over the standard streams of a child process.
    STDIO("stdio");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    /// Returns the wire name used in configuration and REST payloads.
    ///
    /// @return lower-case name, never null
    public String value() {
        return value;
    }

    /// Parses a connection type from its textual form.
    ///
    /// Accepts the wire name, the enum constant name and the short aliases
    /// `http` and `ws`, ignoring case.
    ///
    /// @param text the text to parse, may be null
    /// @return the matching type, or empty if the text names no known transport
    public static Optional<ConnectionType> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "streamable-http", "http" -> Optional.of(STREAMABLE_HTTP);
            case "websocket", "ws" -> Optional.of(WEBSOCKET);
            case "stdio" -> Optional.of(STDIO);
            default -> Optional.empty();
        };
    }
}
