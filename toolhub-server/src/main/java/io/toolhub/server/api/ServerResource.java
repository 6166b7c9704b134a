package io.toolhub.server.api;

import io.smallrye.mutiny.Uni;
import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.core.server.ConnectionType;
import io.toolhub.core.server.ServerDefinition;
import io.toolhub.server.service.ToolHubService;
import io.toolhub.server.service.ToolHubService.ServerNotFoundException;
import io.toolhub.server.validation.LogSanitizer;
import io.toolhub.server.validation.ValidId;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for server definitions and their connections.
///
/// Provides endpoints for:
/// - Registering, listing and deregistering servers
/// - Connecting, disconnecting and refreshing a server
/// - Listing the tools of a connected server
///
/// @see ToolHubService for business logic
@Path("/api/v1/servers")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ServerResource {

    private static final Logger LOG = Logger.getLogger(ServerResource.class);

    private final ToolHubService service;

    @Inject
    public ServerResource(ToolHubService service) {
        this.service = service;
    }

    /// Lists registered servers with their connection status.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"id": "search", "name": "Search", "state": "CONNECTED", "toolCount": 3, ...}]
    /// ```
    @GET
    public Response list() {
        List<ServerView> servers =
                service.listServers().stream()
                        .map(d -> ServerView.of(d, service.status(d.id())))
                        .toList();
        return Response.ok(servers).build();
    }

    /// Registers a server. An enabled server starts connecting in the background.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/servers
    /// Content-Type: application/json
    ///
    /// {"id": "search", "name": "Search", "endpoint": "http://localhost:9000/mcp",
    ///  "connectionType": "streamable-http", "timeoutMs": 30000, "maxRetries": 3}
    /// ```
    ///
    /// ### Response (201 Created)
    /// The registered server with its status at the time of the response.
    ///
    /// ### Errors
    /// - 400 on a malformed definition or unknown connection type
    /// - 409 if the id is already registered
    @POST
    public Response register(@Valid @NotNull ServerRequest request) {
        ServerDefinition definition = request.toDefinition();
        LOG.infov("Register server request: id={0}", LogSanitizer.sanitize(definition.id()));

        service.registerServer(definition);

        return Response.status(Response.Status.CREATED)
                .entity(ServerView.of(definition, service.status(definition.id())))
                .build();
    }

    @GET
    @Path("/{serverId}")
    public Response get(@PathParam("serverId") @ValidId String serverId) {
        ServerDefinition definition =
                service.getServer(serverId)
                        .orElseThrow(() -> new NotFoundException("Server not found: " + serverId));
        return Response.ok(ServerView.of(definition, service.status(serverId))).build();
    }

    /// Disconnects and removes a server.
    ///
    /// ### Response
    /// - 204 No Content: removed
    /// - 404 Not Found: not registered
    @DELETE
    @Path("/{serverId}")
    public Response deregister(@PathParam("serverId") @ValidId String serverId) {
        if (!service.deregisterServer(serverId)) {
            throw new NotFoundException("Server not found: " + serverId);
        }
        return Response.noContent().build();
    }

    /// Connects a server and waits for the outcome.
    ///
    /// A failed attempt still answers 200; the body carries `connected: false` and the
    /// status describing the failure and any scheduled retry.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"serverId": "search", "connected": true, "status": {"state": "CONNECTED", ...}}
    /// ```
    @POST
    @Path("/{serverId}/connect")
    public Uni<Response> connect(@PathParam("serverId") @ValidId String serverId) {
        LOG.infov("Connect request: server={0}", LogSanitizer.sanitize(serverId));
        try {
            return Uni.createFrom()
                    .completionStage(service.connect(serverId))
                    .map(
                            connected ->
                                    Response.ok(
                                                    Map.of(
                                                            "serverId", serverId,
                                                            "connected", connected,
                                                            "status", service.status(serverId)))
                                            .build());
        } catch (ServerNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        }
    }

    /// Disconnects a server and removes its tools. Idempotent.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"serverId": "search", "disconnected": true}
    /// ```
    @POST
    @Path("/{serverId}/disconnect")
    public Response disconnect(@PathParam("serverId") @ValidId String serverId) {
        LOG.infov("Disconnect request: server={0}", LogSanitizer.sanitize(serverId));
        boolean disconnected = service.disconnect(serverId);
        return Response.ok(Map.of("serverId", serverId, "disconnected", disconnected)).build();
    }

    /// Re-discovers the tools of a connected server.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"serverId": "search", "toolCount": 4}
    /// ```
    ///
    /// ### Errors
    /// - 404 if the server is not registered
    /// - 409 if it is not connected
    /// - 502 if discovery fails
    @POST
    @Path("/{serverId}/refresh")
    public Uni<Response> refresh(@PathParam("serverId") @ValidId String serverId) {
        try {
            return Uni.createFrom()
                    .completionStage(service.refresh(serverId))
                    .map(
                            count ->
                                    Response.ok(Map.of("serverId", serverId, "toolCount", count))
                                            .build());
        } catch (ServerNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        }
    }

    /// Lists the tools of a connected server; empty when it is not connected.
    ///
    /// @param includeDisabled also list disabled tools
    @GET
    @Path("/{serverId}/tools")
    public Response tools(
            @PathParam("serverId") @ValidId String serverId,
            @QueryParam("includeDisabled") boolean includeDisabled) {
        if (service.getServer(serverId).isEmpty()) {
            throw new NotFoundException("Server not found: " + serverId);
        }
        List<ToolView> tools =
                service.listServerTools(serverId, includeDisabled).stream()
                        .map(ToolView::of)
                        .toList();
        return Response.ok(tools).build();
    }

    /// Request body for registering a server.
    ///
    /// @param id unique server id
    /// @param name display name, defaults to the id
    /// @param endpoint URL, or command line for stdio servers
    /// @param connectionType `streamable-http`, `websocket` or `stdio`; defaults to
    ///     `streamable-http`
    /// @param enabled whether to connect on registration, defaults to true
    /// @param timeoutMs per-request timeout in milliseconds, may be null
    /// @param maxRetries reconnect attempts before giving up, may be null
    public record ServerRequest(
            @NotBlank(message = "id is required") @ValidId String id,
            String name,
            @NotBlank(message = "endpoint is required") String endpoint,
            String connectionType,
            Boolean enabled,
            @Positive Long timeoutMs,
            @Min(0) Integer maxRetries) {

        ServerDefinition toDefinition() {
            ServerDefinition.Builder builder =
                    ServerDefinition.builder().id(id).endpoint(endpoint);
            if (name != null && !name.isBlank()) {
                builder.name(name);
            }
            if (connectionType != null && !connectionType.isBlank()) {
                builder.connectionType(
                        ConnectionType.parse(connectionType)
                                .orElseThrow(
                                        () ->
                                                new IllegalArgumentException(
                                                        "Unknown connection type: "
                                                                + connectionType)));
            }
            if (enabled != null) {
                builder.enabled(enabled);
            }
            if (timeoutMs != null) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            if (maxRetries != null) {
                builder.maxRetries(maxRetries);
            }
            return builder.build();
        }
    }

    /// Server definition with its current connection status.
    public record ServerView(
            String id,
            String name,
            String endpoint,
            String connectionType,
            boolean enabled,
            long timeoutMs,
            int maxRetries,
            ConnectionStatus status) {

        static ServerView of(ServerDefinition definition, ConnectionStatus status) {
            return new ServerView(
                    definition.id(),
                    definition.name(),
                    definition.endpoint(),
                    definition.connectionType().value(),
                    definition.enabled(),
                    definition.timeout().toMillis(),
                    definition.maxRetries(),
                    status);
        }
    }
}
