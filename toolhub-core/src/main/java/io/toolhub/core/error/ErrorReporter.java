package io.toolhub.core.error;

/// Sink for every failure the connection layer observes.
///
/// No failure path drops an error silently: connect, discovery, reconnect exhaustion
/// and execution failures all pass through here before anything else happens.
///
/// @implNote Implementations must be thread-safe and must not throw.
@FunctionalInterface
public interface ErrorReporter {

    /// Records a failure.
    ///
    /// @param report the failure, not null
    void report(ErrorReport report);
}
