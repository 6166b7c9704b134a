package io.toolhub.server.transport;

import io.toolhub.core.server.ConnectionType;
import io.toolhub.core.server.ServerDefinition;

/// Factory for live tool-server handles.
///
/// Implementations select the concrete transport from the definition's
/// {@link ConnectionType} and perform the protocol handshake before returning.
///
/// @see DefaultTransportFactory
public interface TransportFactory {

    /// Opens a handle to the server described by `definition`.
    ///
    /// @param definition the server to connect to, not null
    /// @return a connected handle, never null
    /// @throws ToolServerException if the transport is unsupported or the connect fails
    ToolServerConnection create(ServerDefinition definition) throws ToolServerException;

    /// Returns whether this factory can build handles for the given transport.
    ///
    /// @param connectionType the transport variant, not null
    /// @return true if {@link #create} accepts definitions of this type
    boolean supports(ConnectionType connectionType);
}
