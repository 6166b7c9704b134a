package io.toolhub.server.api;

import io.smallrye.mutiny.Uni;
import io.toolhub.core.tool.ToolEntry;
import io.toolhub.server.service.ToolHubService;
import io.toolhub.server.validation.LogSanitizer;
import io.toolhub.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for discovered tools.
///
/// Provides endpoints for:
/// - Listing available tools across all servers
/// - Enabling and disabling a tool
/// - Executing a tool on its server
///
/// Tools are addressed by server id and tool name, so identically named tools of
/// different servers never collide.
///
/// @see ToolHubService for business logic
@Path("/api/v1/tools")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ToolResource {

    private static final Logger LOG = Logger.getLogger(ToolResource.class);

    private final ToolHubService service;

    @Inject
    public ToolResource(ToolHubService service) {
        this.service = service;
    }

    /// Lists enabled tools of every server known to the registry.
    ///
    /// A server that lost its connection and is waiting to reconnect keeps its tools
    /// listed here until it is disconnected.
    @GET
    public Response listAvailable() {
        List<ToolView> tools = service.listAvailable().stream().map(ToolView::of).toList();
        return Response.ok(tools).build();
    }

    /// Enables or disables a tool.
    ///
    /// ### Request
    /// ```
    /// PUT /api/v1/tools/search/web_search/enabled
    /// Content-Type: application/json
    ///
    /// {"enabled": false}
    /// ```
    ///
    /// ### Response
    /// - 200 OK with the updated tool
    /// - 404 Not Found if the tool is unknown
    @PUT
    @Path("/{serverId}/{toolName}/enabled")
    public Response setEnabled(
            @PathParam("serverId") @ValidId String serverId,
            @PathParam("toolName") String toolName,
            @Valid @NotNull EnabledRequest request) {
        LOG.infov(
                "Toggle request: tool={0}, server={1}, enabled={2}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId),
                request.enabled());

        if (!service.setEnabled(serverId, toolName, request.enabled())) {
            throw new NotFoundException("Tool not found: " + serverId + ":" + toolName);
        }
        ToolEntry entry =
                service.findTool(serverId, toolName)
                        .orElseThrow(
                                () ->
                                        new NotFoundException(
                                                "Tool not found: " + serverId + ":" + toolName));
        return Response.ok(ToolView.of(entry)).build();
    }

    /// Executes a tool.
    ///
    /// Always answers 200 with a structured result; failures (including an
    /// unconnected server or a timeout) have `success: false` and an `error`.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/tools/search/web_search/execute
    /// Content-Type: application/json
    ///
    /// {"query": "java records"}
    /// ```
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"success": true, "output": {...}, "serverId": "search", "toolName": "web_search",
    ///  "executedAt": "2025-01-01T00:00:00Z", "durationMs": 42}
    /// ```
    @POST
    @Path("/{serverId}/{toolName}/execute")
    public Uni<Response> execute(
            @PathParam("serverId") @ValidId String serverId,
            @PathParam("toolName") String toolName,
            Map<String, Object> arguments) {
        LOG.infov(
                "Execute request: tool={0}, server={1}",
                LogSanitizer.sanitize(toolName),
                LogSanitizer.sanitize(serverId));
        return Uni.createFrom()
                .completionStage(
                        service.executeAsync(
                                serverId, toolName, arguments != null ? arguments : Map.of()))
                .map(result -> Response.ok(result).build());
    }

    /// Request body for toggling a tool.
    ///
    /// @param enabled the new flag, not null
    public record EnabledRequest(@NotNull(message = "enabled is required") Boolean enabled) {}
}
