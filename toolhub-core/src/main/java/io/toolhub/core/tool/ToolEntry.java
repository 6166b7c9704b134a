package io.toolhub.core.tool;

import java.time.Instant;
import java.util.Objects;

/// A discovered tool as published in the {@link ToolRegistry}.
///
/// Entries are immutable snapshots. The enabled flag reflects the registry's state at
/// the time the entry was read and is independent of connection state.
///
/// @param key composite identity, not null
/// @param serverName display name of the owning server, not null
/// @param description human-readable description, not null (may be empty)
/// @param inputSchema accepted arguments, not null
/// @param enabled whether the tool is offered to consumers
/// @param lastDiscovered time of the discovery that produced this entry, not null
public record ToolEntry(
        ToolKey key,
        String serverName,
        String description,
        InputSchema inputSchema,
        boolean enabled,
        Instant lastDiscovered) {

    public ToolEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(lastDiscovered, "lastDiscovered must not be null");
        description = description != null ? description : "";
        inputSchema = inputSchema != null ? inputSchema : InputSchema.empty();
    }

    public String serverId() {
        return key.serverId();
    }

    public String name() {
        return key.toolName();
    }

    public ToolEntry withEnabled(boolean enabled) {
        if (this.enabled == enabled) {
            return this;
        }
        return new ToolEntry(key, serverName, description, inputSchema, enabled, lastDiscovered);
    }
}
