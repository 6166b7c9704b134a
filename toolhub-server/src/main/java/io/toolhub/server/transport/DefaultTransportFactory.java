package io.toolhub.server.transport;

import io.toolhub.core.server.ConnectionType;
import io.toolhub.core.server.ServerDefinition;
import java.net.http.HttpClient;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.jboss.logging.Logger;

/// Transport factory dispatching on {@link ConnectionType}.
///
/// Each transport is one `switch` branch. A transport can be switched off by leaving
/// it out of the enabled set (for example to forbid spawning processes); definitions
/// of a disabled type are then unsupported.
///
/// ### Configuration
/// - `toolhub.transport.enabled-types`: transports allowed to connect (default: all)
public class DefaultTransportFactory implements TransportFactory {

    private static final Logger LOG = Logger.getLogger(DefaultTransportFactory.class);

    private final HttpClient httpClient;
    private final JsonRpc jsonRpc;
    private final Set<ConnectionType> enabledTypes;

    public DefaultTransportFactory(
            HttpClient httpClient, JsonRpc jsonRpc, Set<ConnectionType> enabledTypes) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        Objects.requireNonNull(enabledTypes, "enabledTypes must not be null");
        this.enabledTypes =
                enabledTypes.isEmpty()
                        ? EnumSet.noneOf(ConnectionType.class)
                        : EnumSet.copyOf(enabledTypes);
    }

    @Override
    public ToolServerConnection create(ServerDefinition definition) throws ToolServerException {
        Objects.requireNonNull(definition, "definition must not be null");
        ConnectionType type = definition.connectionType();
        if (!supports(type)) {
            throw new ToolServerException(
                    "Connection type " + type.value() + " is not enabled",
                    ToolServerException.UNSUPPORTED_TRANSPORT);
        }

        LOG.debugv("Opening {0} connection to {1}", type.value(), definition.endpoint());
        return switch (type) {
            case STREAMABLE_HTTP -> StreamableHttpConnection.open(
                    definition.endpoint(), httpClient, jsonRpc, definition.timeout());
            case WEBSOCKET -> WebSocketConnection.open(
                    definition.endpoint(), httpClient, jsonRpc, definition.timeout());
            case STDIO -> StdioConnection.open(
                    definition.endpoint(), jsonRpc, definition.timeout());
        };
    }

    @Override
    public boolean supports(ConnectionType connectionType) {
        return connectionType != null && enabledTypes.contains(connectionType);
    }

    public Set<ConnectionType> enabledTypes() {
        return Set.copyOf(enabledTypes);
    }
}
