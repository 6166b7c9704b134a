package io.toolhub.core.tool;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/// Process-wide store of discovered tools keyed by {@link ToolKey}.
///
/// The registry is the only source of truth the rest of the application reads.
/// Connection management publishes into it through {@link #replaceServerTools} and
/// {@link #removeServerTools}; consumers read through the query methods and toggle
/// availability through {@link #setEnabled}.
///
/// ### Enabled state
/// Every key starts enabled. A key disabled through {@link #setEnabled} stays disabled
/// across re-discovery of the same key until it is enabled again.
///
/// ### Thread Safety
/// @implNote Implementations must be thread-safe. Replacing or removing a server's tool
/// set must be atomic: readers observe either the old or the new set, never a mix.
///
/// @see DefaultToolRegistry
public interface ToolRegistry {

    /// Replaces the full tool set attributed to a server.
    ///
    /// Entries of the server that are absent from `tools` are removed. Each entry's
    /// `enabled` flag is ignored in favour of the registry's own state.
    ///
    /// @param serverId the owning server, not null
    /// @param tools the new tool set, not null (may be empty)
    /// @throws IllegalArgumentException if an entry belongs to another server
    void replaceServerTools(String serverId, Collection<ToolEntry> tools);

    /// Removes every entry attributed to a server.
    ///
    /// @param serverId the owning server, not null
    /// @return number of entries removed
    int removeServerTools(String serverId);

    /// Removes every entry of a server together with its disabled flags, so a server
    /// later registered under the same id starts with all tools enabled.
    ///
    /// @param serverId the owning server, not null
    /// @return number of entries removed
    int forgetServer(String serverId);

    /// Toggles a tool's availability.
    ///
    /// @param key the composite key, not null
    /// @param enabled the new flag
    /// @return true if the key exists, false if the call was a no-op
    boolean setEnabled(ToolKey key, boolean enabled);

    /// Looks up one entry.
    ///
    /// @param key the composite key, not null
    /// @return the entry, or empty if unknown
    Optional<ToolEntry> find(ToolKey key);

    /// Returns every entry attributed to a server, enabled or not.
    ///
    /// @param serverId the owning server, not null
    /// @return unmodifiable list, never null
    List<ToolEntry> forServer(String serverId);

    /// Returns enabled entries from all servers known to the registry.
    ///
    /// @return unmodifiable list, never null
    List<ToolEntry> listAvailable();

    /// Returns every entry regardless of enabled state.
    ///
    /// @return unmodifiable list, never null
    List<ToolEntry> all();

    default int size() {
        return all().size();
    }
}
