package io.toolhub.server.discovery;

import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.tool.InputSchema;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.core.tool.ToolKey;
import io.toolhub.server.config.ToolCalls;
import io.toolhub.server.transport.BoundedCall;
import io.toolhub.server.transport.ToolServerConnection;
import io.toolhub.server.transport.ToolServerConnection.ToolDescriptor;
import io.toolhub.server.transport.ToolServerException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/// Lists the tools of a connected server and converts them to {@link ToolEntry} form.
///
/// The listing is bounded by the server's timeout. Descriptors without a name are
/// skipped, and a name reported twice keeps its first descriptor. A missing
/// description becomes the empty string and a missing schema becomes an empty object
/// schema.
///
/// Discovery is stateless: it neither caches nor publishes. The caller replaces the
/// server's tool set with the result.
///
/// @see io.toolhub.server.connection.ConnectionManager
@ApplicationScoped
public class ToolDiscovery {

    private static final Logger LOG = Logger.getLogger(ToolDiscovery.class);

    private final Executor calls;
    private final Clock clock;

    @Inject
    public ToolDiscovery(@ToolCalls Executor calls, Clock clock) {
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Discovers the tools of one server.
    ///
    /// @param connection live handle to the server, not null
    /// @param definition the server's definition, not null
    /// @return entries attributed to the server, never null (may be empty)
    /// @throws ToolServerException if the listing fails or times out
    public List<ToolEntry> discover(ToolServerConnection connection, ServerDefinition definition)
            throws ToolServerException {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(definition, "definition must not be null");

        List<ToolDescriptor> descriptors =
                BoundedCall.run(calls, definition.timeout(), "tools/list", connection::listTools);

        Instant now = clock.instant();
        Set<String> seen = new HashSet<>();
        List<ToolEntry> entries = new ArrayList<>(descriptors.size());
        for (ToolDescriptor descriptor : descriptors) {
            String name = descriptor.name();
            if (name == null || name.isBlank()) {
                LOG.warnv("Skipping unnamed tool reported by {0}", definition.id());
                continue;
            }
            if (!seen.add(name)) {
                LOG.debugv("Duplicate tool {0} reported by {1}", name, definition.id());
                continue;
            }
            entries.add(toEntry(definition, descriptor, now));
        }

        LOG.debugv("Discovered {0} tools from {1}", entries.size(), definition.id());
        return List.copyOf(entries);
    }

    private static ToolEntry toEntry(
            ServerDefinition definition, ToolDescriptor descriptor, Instant now) {
        InputSchema schema =
                descriptor.inputSchema() != null
                        ? InputSchema.fromMap(descriptor.inputSchema())
                        : InputSchema.empty();
        return new ToolEntry(
                ToolKey.of(definition.id(), descriptor.name()),
                definition.name(),
                descriptor.description() != null ? descriptor.description() : "",
                schema,
                true,
                now);
    }
}
