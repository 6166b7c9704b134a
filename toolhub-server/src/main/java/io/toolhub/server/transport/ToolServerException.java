package io.toolhub.server.transport;

import java.io.Serial;

/// Exception thrown when talking to a tool server fails.
///
/// Wraps errors from transport communication including:
/// - Connection and handshake failures
/// - Tool invocation errors reported by the server
/// - JSON-RPC protocol errors
/// - Timeouts
public class ToolServerException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3170554287461958236L;

    public static final String TIMEOUT = "TIMEOUT";
    public static final String UNSUPPORTED_TRANSPORT = "UNSUPPORTED_TRANSPORT";
    public static final String TOOL_ERROR = "TOOL_ERROR";

    private final String toolName;
    private final String errorCode;

    public ToolServerException(String message) {
        this(message, null, null, null);
    }

    public ToolServerException(String message, Throwable cause) {
        this(message, cause, null, null);
    }

    /// Creates an exception carrying a protocol error code.
    ///
    /// @param message the error message
    /// @param errorCode JSON-RPC or transport error code
    public ToolServerException(String message, String errorCode) {
        this(message, null, null, errorCode);
    }

    /// Creates an exception for a failed tool invocation.
    ///
    /// @param toolName the tool that failed
    /// @param message the error message
    /// @param errorCode error code, may be null
    public static ToolServerException toolFailed(
            String toolName, String message, String errorCode) {
        return new ToolServerException(
                String.format("Tool '%s' failed: %s", toolName, message),
                null,
                toolName,
                errorCode);
    }

    private ToolServerException(
            String message, Throwable cause, String toolName, String errorCode) {
        super(message, cause);
        this.toolName = toolName;
        this.errorCode = errorCode;
    }

    /// Returns the name of the tool that failed.
    ///
    /// @return tool name, or null if not tool-specific
    public String getToolName() {
        return toolName;
    }

    /// Returns the error code.
    ///
    /// @return error code, or null if not available
    public String getErrorCode() {
        return errorCode;
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(errorCode);
    }

    /// Creates an exception for a connection failure.
    ///
    /// @param endpoint the server endpoint
    /// @param cause the underlying cause
    /// @return new exception
    public static ToolServerException connectionFailed(String endpoint, Throwable cause) {
        String detail =
                cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new ToolServerException(
                "Failed to connect to tool server at " + endpoint + detail, cause);
    }

    /// Creates an exception for an operation that outlived its bound.
    ///
    /// @param operation the request or tool that timed out
    /// @param timeoutMs the bound in milliseconds
    /// @return new exception
    public static ToolServerException timeout(String operation, long timeoutMs) {
        return new ToolServerException(
                operation + " timed out after " + timeoutMs + "ms", null, null, TIMEOUT);
    }
}
