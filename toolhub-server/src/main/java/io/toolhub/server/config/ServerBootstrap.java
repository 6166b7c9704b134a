package io.toolhub.server.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.toolhub.server.connection.ConnectionManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Startup and shutdown hooks of the tool hub.
///
/// On shutdown every server is disconnected so that transport handles are closed,
/// child processes are stopped and no reconnect timer outlives the application.
/// Executors and the scheduler are stopped afterwards by their CDI disposers.
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final ConnectionManager connectionManager;

    @Inject
    public ServerBootstrap(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    void onStart(@Observes StartupEvent ev) {
        LOG.info("Tool hub started; servers are registered through /api/v1/servers");
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOG.info("Shutting down tool hub, disconnecting all servers");
        connectionManager.disconnectAll();
    }
}
