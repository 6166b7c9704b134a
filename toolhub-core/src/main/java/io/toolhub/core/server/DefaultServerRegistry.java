package io.toolhub.core.server;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Thread-safe {@link ServerRegistry} backed by a {@link ConcurrentHashMap}.
///
/// @implNote Thread-safe. Duplicate detection uses `putIfAbsent`, so two concurrent
/// registrations of the same id cannot both succeed.
public final class DefaultServerRegistry implements ServerRegistry {

    private static final Logger logger = Logger.getLogger(DefaultServerRegistry.class.getName());

    private final Map<String, ServerDefinition> servers = new ConcurrentHashMap<>();

    @Override
    public void register(ServerDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        ServerDefinition existing = servers.putIfAbsent(definition.id(), definition);
        if (existing != null) {
            throw new IllegalStateException("Server already registered: " + definition.id());
        }
        logger.info(
                "Registered server: " + definition.name() + " (" + definition.endpoint() + ")");
    }

    @Override
    public Optional<ServerDefinition> get(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return Optional.ofNullable(servers.get(serverId));
    }

    @Override
    public List<ServerDefinition> all() {
        return List.copyOf(servers.values());
    }

    @Override
    public boolean remove(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return servers.remove(serverId) != null;
    }

    @Override
    public boolean contains(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return servers.containsKey(serverId);
    }

    @Override
    public int size() {
        return servers.size();
    }
}
