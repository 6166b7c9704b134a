package io.toolhub.server.api;

import io.toolhub.core.health.HealthReport;
import io.toolhub.server.service.ToolHubService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/// Connection health and status endpoints.
///
/// ### Request
/// ```
/// GET /api/v1/health
/// ```
///
/// ### Response (200 OK)
/// ```json
/// {"healthy": 2, "unhealthy": 1, "total": 3}
/// ```
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private final ToolHubService service;

    @Inject
    public HealthResource(ToolHubService service) {
        this.service = service;
    }

    @GET
    @Path("/health")
    public Response health() {
        HealthReport report = service.healthCheck();
        return Response.ok(report).build();
    }

    /// Lists the connection status of every registered server.
    @GET
    @Path("/connections")
    public Response connections() {
        return Response.ok(service.statuses()).build();
    }
}
