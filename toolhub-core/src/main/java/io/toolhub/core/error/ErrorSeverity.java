package io.toolhub.core.error;

/// How urgently a reported failure needs attention.
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
