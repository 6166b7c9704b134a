package io.toolhub.core.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link ToolRegistry}.
///
/// Each server's tools live in an immutable map that is swapped as a whole, so a
/// reader never sees half of a replacement. Disabled keys are tracked separately,
/// which lets the disabled state survive re-discovery.
///
/// @implNote Thread-safe. Mutations of one server's tool set go through
/// `ConcurrentHashMap.compute`, which serializes them per server id without a
/// registry-wide lock.
public final class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, Map<String, ToolEntry>> toolsByServer = new ConcurrentHashMap<>();
    private final Set<ToolKey> disabled = ConcurrentHashMap.newKeySet();

    @Override
    public void replaceServerTools(String serverId, Collection<ToolEntry> tools) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Objects.requireNonNull(tools, "tools must not be null");

        Map<String, ToolEntry> replacement = new LinkedHashMap<>();
        for (ToolEntry tool : tools) {
            if (!tool.serverId().equals(serverId)) {
                throw new IllegalArgumentException(
                        "Tool " + tool.key() + " does not belong to server " + serverId);
            }
            replacement.put(tool.name(), tool.withEnabled(true));
        }

        Map<String, ToolEntry> frozen = Collections.unmodifiableMap(replacement);
        toolsByServer.compute(serverId, (id, previous) -> frozen.isEmpty() ? null : frozen);
    }

    @Override
    public int removeServerTools(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Map<String, ToolEntry> removed = toolsByServer.remove(serverId);
        return removed != null ? removed.size() : 0;
    }

    @Override
    public int forgetServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        int[] removed = {0};
        toolsByServer.compute(
                serverId,
                (id, tools) -> {
                    removed[0] = tools != null ? tools.size() : 0;
                    disabled.removeIf(key -> key.serverId().equals(id));
                    return null;
                });
        return removed[0];
    }

    @Override
    public boolean setEnabled(ToolKey key, boolean enabled) {
        Objects.requireNonNull(key, "key must not be null");
        boolean[] found = {false};
        toolsByServer.computeIfPresent(
                key.serverId(),
                (id, tools) -> {
                    if (tools.containsKey(key.toolName())) {
                        found[0] = true;
                        if (enabled) {
                            disabled.remove(key);
                        } else {
                            disabled.add(key);
                        }
                    }
                    return tools;
                });
        return found[0];
    }

    @Override
    public Optional<ToolEntry> find(ToolKey key) {
        Objects.requireNonNull(key, "key must not be null");
        Map<String, ToolEntry> tools = toolsByServer.get(key.serverId());
        if (tools == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(key.toolName())).map(this::applyEnabled);
    }

    @Override
    public List<ToolEntry> forServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        Map<String, ToolEntry> tools = toolsByServer.get(serverId);
        if (tools == null) {
            return List.of();
        }
        return tools.values().stream().map(this::applyEnabled).toList();
    }

    @Override
    public List<ToolEntry> listAvailable() {
        return all().stream().filter(ToolEntry::enabled).toList();
    }

    @Override
    public List<ToolEntry> all() {
        List<ToolEntry> result = new ArrayList<>();
        for (Map<String, ToolEntry> tools : toolsByServer.values()) {
            for (ToolEntry tool : tools.values()) {
                result.add(applyEnabled(tool));
            }
        }
        return List.copyOf(result);
    }

    @Override
    public int size() {
        return toolsByServer.values().stream().mapToInt(Map::size).sum();
    }

    private ToolEntry applyEnabled(ToolEntry tool) {
        return tool.withEnabled(!disabled.contains(tool.key()));
    }
}
