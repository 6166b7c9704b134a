package io.toolhub.core.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Structured outcome of a proxied tool call.
///
/// Failures are values, never exceptions: callers inspect `success` and decide on
/// their own retry policy.
///
/// @param success whether the remote call completed normally
/// @param output tool output on success, empty on failure
/// @param error failure message, null on success
/// @param serverId target server, not null
/// @param serverName target server display name, may equal the id when unknown
/// @param toolName invoked tool, not null
/// @param executedAt when the call started, not null
/// @param durationMs wall time spent, not negative
public record ToolExecutionResult(
        boolean success,
        Map<String, Object> output,
        String error,
        String serverId,
        String serverName,
        String toolName,
        Instant executedAt,
        long durationMs) {

    public static final String NOT_CONNECTED = "server not connected";

    public ToolExecutionResult {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(executedAt, "executedAt must not be null");
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
        serverName = serverName != null ? serverName : serverId;
    }

    public static ToolExecutionResult success(
            String serverId,
            String serverName,
            String toolName,
            Map<String, Object> output,
            Instant executedAt,
            long durationMs) {
        return new ToolExecutionResult(
                true, output, null, serverId, serverName, toolName, executedAt, durationMs);
    }

    public static ToolExecutionResult failure(
            String serverId,
            String serverName,
            String toolName,
            String error,
            Instant executedAt,
            long durationMs) {
        return new ToolExecutionResult(
                false,
                Map.of(),
                Objects.requireNonNull(error, "error must not be null"),
                serverId,
                serverName,
                toolName,
                executedAt,
                durationMs);
    }

    /// Failure returned when the target server has no live connection.
    public static ToolExecutionResult notConnected(
            String serverId, String serverName, String toolName) {
        return failure(serverId, serverName, toolName, NOT_CONNECTED, Instant.now(), 0);
    }
}
