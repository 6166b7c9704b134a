package io.toolhub.core.error;

import java.time.Instant;
import java.util.Objects;

/// A failure routed to the centralized {@link ErrorReporter}.
///
/// @param category failure class, not null
/// @param severity urgency, not null
/// @param recoverable whether the subsystem will retry or the caller may retry
/// @param serverId server the failure concerns, may be null
/// @param message human-readable summary, not null
/// @param cause underlying exception, may be null
/// @param timestamp when the failure was observed, not null
public record ErrorReport(
        ErrorCategory category,
        ErrorSeverity severity,
        boolean recoverable,
        String serverId,
        String message,
        Throwable cause,
        Instant timestamp) {

    public ErrorReport {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /// Recoverable network failure that feeds reconnect scheduling.
    public static ErrorReport network(String serverId, String message, Throwable cause) {
        return new ErrorReport(
                ErrorCategory.NETWORK,
                ErrorSeverity.MEDIUM,
                true,
                serverId,
                message,
                cause,
                Instant.now());
    }

    /// Final network failure after the retry budget is spent.
    public static ErrorReport exhausted(String serverId, String message) {
        return new ErrorReport(
                ErrorCategory.NETWORK,
                ErrorSeverity.HIGH,
                false,
                serverId,
                message,
                null,
                Instant.now());
    }

    /// Configuration failure; not retried until the definition changes.
    public static ErrorReport config(String serverId, String message) {
        return new ErrorReport(
                ErrorCategory.CONFIG,
                ErrorSeverity.HIGH,
                false,
                serverId,
                message,
                null,
                Instant.now());
    }

    /// Recoverable tool execution failure returned to the caller.
    public static ErrorReport agent(String serverId, String message, Throwable cause) {
        return new ErrorReport(
                ErrorCategory.AGENT,
                ErrorSeverity.MEDIUM,
                true,
                serverId,
                message,
                cause,
                Instant.now());
    }
}
