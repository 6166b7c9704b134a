package io.toolhub.server.api;

import io.toolhub.core.tool.ToolEntry;
import java.time.Instant;
import java.util.Map;

/// JSON shape of a {@link ToolEntry}.
///
/// @param id composite key in `serverId:toolName` form
/// @param inputSchema JSON schema of the arguments
public record ToolView(
        String id,
        String serverId,
        String serverName,
        String name,
        String description,
        Map<String, Object> inputSchema,
        boolean enabled,
        Instant lastDiscovered) {

    static ToolView of(ToolEntry entry) {
        return new ToolView(
                entry.key().toString(),
                entry.serverId(),
                entry.serverName(),
                entry.name(),
                entry.description(),
                entry.inputSchema().toMap(),
                entry.enabled(),
                entry.lastDiscovered());
    }
}
