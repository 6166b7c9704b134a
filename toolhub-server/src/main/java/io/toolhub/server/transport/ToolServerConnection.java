package io.toolhub.server.transport;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/// Live client handle to one tool server.
///
/// Provides methods to interact with a tool server including:
/// - Listing available tools
/// - Calling tools with arguments
/// - Closing the underlying transport
///
/// Implementations differ by transport (HTTP, WebSocket, stdio) and are created by a
/// {@link TransportFactory}. A handle stays usable after an individual call fails or
/// times out; only {@link #close()} ends it.
///
/// @see TransportFactory for handle creation
public interface ToolServerConnection {

    /// Lists all tools available on the server.
    ///
    /// @return list of tool descriptors, never null
    /// @throws ToolServerException if the request fails
    List<ToolDescriptor> listTools() throws ToolServerException;

    /// Calls a tool with the given arguments.
    ///
    /// @param toolName the name of the tool to call
    /// @param arguments the tool arguments, may be empty
    /// @return the tool result as a map
    /// @throws ToolServerException if the call fails or the tool reports an error
    Map<String, Object> callTool(String toolName, Map<String, Object> arguments)
            throws ToolServerException;

    /// Returns the endpoint this handle talks to.
    ///
    /// @return endpoint URL or command line
    String getEndpoint();

    /// Returns whether the transport is still open.
    ///
    /// @return true if usable
    boolean isConnected();

    /// Closes the handle and releases its resources. Idempotent.
    void close();

    /// Registers a callback run once when this handle ends, whether it was closed locally
    /// or lost (process exit, remote close). Runs at once if the handle already ended.
    ///
    /// @param listener receives a short reason, not null
    void onClose(Consumer<String> listener);

    /// Descriptor for a remote tool, exactly as the server reported it.
    ///
    /// @param name the tool name
    /// @param description human-readable description, may be null
    /// @param inputSchema JSON schema for input parameters, may be null
    record ToolDescriptor(String name, String description, Map<String, Object> inputSchema) {}
}
