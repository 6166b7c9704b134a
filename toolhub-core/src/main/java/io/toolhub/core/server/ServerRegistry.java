package io.toolhub.core.server;

import java.util.List;
import java.util.Optional;

/// Store of registered server definitions.
///
/// Holds no disk state: the external owner of persisted definitions re-registers them
/// on process start.
///
/// @implNote Implementations must be thread-safe.
///
/// @see DefaultServerRegistry
public interface ServerRegistry {

    /// Registers a definition.
    ///
    /// @param definition the definition to store, not null
    /// @throws IllegalStateException if a definition with the same id exists
    /// @throws NullPointerException if definition is null
    void register(ServerDefinition definition);

    /// Looks up a definition by id.
    ///
    /// @param serverId the id, not null
    /// @return the definition, or empty if unknown
    Optional<ServerDefinition> get(String serverId);

    /// Returns every registered definition.
    ///
    /// @return unmodifiable list, never null (may be empty)
    List<ServerDefinition> all();

    /// Removes a definition.
    ///
    /// @param serverId the id, not null
    /// @return true if a definition was removed
    boolean remove(String serverId);

    default boolean contains(String serverId) {
        return get(serverId).isPresent();
    }

    default int size() {
        return all().size();
    }
}
