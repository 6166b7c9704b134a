package io.toolhub.core.tool;

import java.util.Objects;

/// Composite identity of a discovered tool.
///
/// Uniqueness is enforced per server: two servers exposing a tool with the same name
/// produce two distinct keys.
///
/// @param serverId owning server id, not blank
/// @param toolName tool name as reported by the server, not blank
public record ToolKey(String serverId, String toolName) {

    public ToolKey {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        if (serverId.isBlank() || toolName.isBlank()) {
            throw new IllegalArgumentException("serverId and toolName must not be blank");
        }
    }

    public static ToolKey of(String serverId, String toolName) {
        return new ToolKey(serverId, toolName);
    }

    @Override
    public String toString() {
        return serverId + ":" + toolName;
    }
}
