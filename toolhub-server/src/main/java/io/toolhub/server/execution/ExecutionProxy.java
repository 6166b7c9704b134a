package io.toolhub.server.execution;

import io.toolhub.core.error.ErrorReport;
import io.toolhub.core.error.ErrorReporter;
import io.toolhub.core.execution.ToolExecutionResult;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.core.server.ServerRegistry;
import io.toolhub.server.config.ToolCalls;
import io.toolhub.server.connection.ConnectionManager;
import io.toolhub.server.transport.BoundedCall;
import io.toolhub.server.transport.ToolServerConnection;
import io.toolhub.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.jboss.logging.Logger;

/// Routes tool invocations to the live connection of the owning server.
///
/// Every outcome is a {@link ToolExecutionResult}; nothing is thrown across this
/// boundary. Calls are bounded by the server's timeout, and a timeout is an ordinary
/// failure that leaves the connection in place for later calls. Failures are also
/// reported as recoverable agent errors.
///
/// ### Usage
/// {@snippet :
/// ToolExecutionResult result = proxy.execute("search-srv", "search", Map.of("q", "java"));
/// if (!result.success()) {
///     LOG.warn(result.error());
/// }
/// }
@ApplicationScoped
public class ExecutionProxy {

    private static final Logger LOG = Logger.getLogger(ExecutionProxy.class);

    private final ServerRegistry servers;
    private final ConnectionManager connections;
    private final ErrorReporter errors;
    private final Executor calls;
    private final Clock clock;

    @Inject
    public ExecutionProxy(
            ServerRegistry servers,
            ConnectionManager connections,
            ErrorReporter errors,
            @ToolCalls Executor calls,
            Clock clock) {
        this.servers = Objects.requireNonNull(servers, "servers must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.errors = Objects.requireNonNull(errors, "errors must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Invokes a tool and waits for its result.
    ///
    /// @param serverId the owning server
    /// @param toolName the tool to invoke
    /// @param arguments tool arguments, may be null
    /// @return the structured result, never null
    public ToolExecutionResult execute(
            String serverId, String toolName, Map<String, Object> arguments) {
        Instant started = clock.instant();
        if (serverId == null || serverId.isBlank() || toolName == null || toolName.isBlank()) {
            return fail(
                    serverId != null ? serverId : "",
                    null,
                    toolName != null ? toolName : "",
                    "serverId and toolName are required",
                    null,
                    started);
        }

        Optional<ServerDefinition> definition = servers.get(serverId);
        String serverName = definition.map(ServerDefinition::name).orElse(serverId);
        Optional<ToolServerConnection> connection = connections.liveConnection(serverId);
        if (connection.isEmpty()) {
            return fail(
                    serverId,
                    serverName,
                    toolName,
                    ToolExecutionResult.NOT_CONNECTED,
                    null,
                    started);
        }

        Duration timeout =
                definition.map(ServerDefinition::timeout).orElse(ServerDefinition.DEFAULT_TIMEOUT);
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        LOG.debugv(
                "Executing {0} on {1}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId));
        ToolServerConnection handle = connection.get();
        try {
            Map<String, Object> output =
                    BoundedCall.run(
                            calls, timeout, toolName, () -> handle.callTool(toolName, args));
            return ToolExecutionResult.success(
                    serverId, serverName, toolName, output, started, elapsed(started));
        } catch (RuntimeException e) {
            String message =
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return fail(serverId, serverName, toolName, message, e, started);
        }
    }

    /// Invokes a tool without blocking the caller.
    ///
    /// @param serverId the owning server
    /// @param toolName the tool to invoke
    /// @param arguments tool arguments, may be null
    /// @return a future that always completes normally with the structured result
    public CompletableFuture<ToolExecutionResult> executeAsync(
            String serverId, String toolName, Map<String, Object> arguments) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> execute(serverId, toolName, arguments), calls);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(
                    fail(
                            serverId != null ? serverId : "",
                            null,
                            toolName != null ? toolName : "",
                            "execution rejected: " + e.getMessage(),
                            e,
                            clock.instant()));
        }
    }

    private ToolExecutionResult fail(
            String serverId,
            String serverName,
            String toolName,
            String message,
            Throwable cause,
            Instant started) {
        LOG.warnv(
                "Tool {0} on {1} failed: {2}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId),
                LogSanitizer.sanitize(message));
        errors.report(
                ErrorReport.agent(
                        serverId.isEmpty() ? null : serverId,
                        "Tool " + toolName + " failed: " + message,
                        cause));
        return ToolExecutionResult.failure(
                serverId, serverName, toolName, message, started, elapsed(started));
    }

    private long elapsed(Instant started) {
        return Math.max(0, Duration.between(started, clock.instant()).toMillis());
    }
}
