package io.toolhub.server.security;

import io.toolhub.server.service.ToolHubService.ServerNotFoundException;
import io.toolhub.server.transport.ToolServerException;
import io.toolhub.server.validation.LogSanitizer;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import java.util.concurrent.CompletionException;
import org.jboss.logging.Logger;

/// Global exception mapper that prevents stack trace leakage to clients.
///
/// Catches all unhandled exceptions and returns sanitized JSON responses.
/// Full stack traces are logged server-side for debugging.
///
/// ### Status Mapping
/// - `IllegalArgumentException`: 400, malformed request or definition
/// - `ServerNotFoundException`: 404
/// - `IllegalStateException`: 409, e.g. duplicate id or server not connected
/// - `ToolServerException`: 502, the remote tool server failed
/// - anything else: 500 with a generic message
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 500}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        Throwable error = unwrap(exception);

        if (error instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(error, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, LogSanitizer.sanitize(message));
            }
            return json(status, message);
        }
        if (error instanceof ServerNotFoundException) {
            return clientError(404, error.getMessage());
        }
        if (error instanceof IllegalArgumentException) {
            return clientError(400, messageOr(error, "Bad request"));
        }
        if (error instanceof IllegalStateException) {
            return clientError(409, messageOr(error, "Conflict"));
        }
        if (error instanceof ToolServerException) {
            LOG.warnv("Tool server error: {0}", LogSanitizer.sanitize(error.getMessage()));
            return json(502, "Tool server error: " + error.getMessage());
        }

        LOG.errorv(error, "Unhandled exception: {0}", error.getMessage());
        return json(500, "Internal server error");
    }

    private static Response clientError(int status, String message) {
        LOG.debugv("Client error {0}: {1}", status, LogSanitizer.sanitize(message));
        return json(status, message);
    }

    private static String messageOr(Throwable error, String fallback) {
        return error.getMessage() != null ? error.getMessage() : fallback;
    }

    private static Response json(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static Throwable unwrap(Throwable exception) {
        Throwable current = exception;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 401 -> "Authentication required";
            case 403 -> "Access denied";
            case 404 -> raw != null ? raw : "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
