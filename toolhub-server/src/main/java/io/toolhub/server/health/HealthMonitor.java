package io.toolhub.server.health;

import io.toolhub.core.health.HealthReport;
import io.toolhub.core.server.ConnectionStatus;
import io.toolhub.server.connection.ConnectionManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;

/// Counts connection instances by connected state.
///
/// Read-only: a health check neither connects nor disconnects anything. Servers that
/// are registered but have no connection instance (never connected, or disconnected
/// manually) are not counted.
@ApplicationScoped
public class HealthMonitor {

    private final ConnectionManager connections;

    @Inject
    public HealthMonitor(ConnectionManager connections) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
    }

    /// @return healthy and unhealthy instance counts, never null
    public HealthReport healthCheck() {
        List<ConnectionStatus> instances = connections.instances();
        int healthy = 0;
        for (ConnectionStatus status : instances) {
            if (status.connected()) {
                healthy++;
            }
        }
        return HealthReport.of(healthy, instances.size() - healthy);
    }
}
