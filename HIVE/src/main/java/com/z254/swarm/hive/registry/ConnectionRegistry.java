package com.z254.swarm.hive.registry;

import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentDescription;
import com.z254.swarm.hive.domain.model.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Directed, keyword-tagged links between agents.
 *
 * <p>Every agent owns an immutable output table (keyword -> destinations) and an immutable input
 * table (source -> keywords). Mutations replace a table through {@link ConcurrentHashMap#compute},
 * so writers only contend on the agent they touch and readers always see a complete snapshot
 * without blocking. A lookup that raced with a removal keeps the table it read. Output tables
 * are authoritative: input entries are recomputed from them after every change.
 *
 * <p>The registry also tracks explore registrations: an agent exploring a keyword is returned
 * by {@link #seek(String, String)} for that keyword.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<String, Map<String, Set<String>>> outputs = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Set<String>>> inputs = new ConcurrentHashMap<>();

    // keyword -> exploring agents, insertion ordered
    private final Map<String, Set<String>> explorers = new ConcurrentHashMap<>();

    /**
     * Add a connection. Adding an identical triple twice is a no-op.
     *
     * @return true if the connection was new
     */
    public boolean addConnection(String source, String destination, String keyword) {
        Connection connection = new Connection(source, destination, keyword);
        AtomicBoolean added = new AtomicBoolean(false);

        outputs.compute(source, (id, table) -> {
            Set<String> current = table != null ? table.get(keyword) : null;
            if (current != null && current.contains(destination)) {
                return table;
            }
            added.set(true);
            return withMember(table, keyword, destination);
        });
        reconcileInput(source, destination, keyword);

        if (added.get()) {
            log.debug("Added connection {}", connection);
        }
        return added.get();
    }

    /**
     * Remove a connection. Deliveries that already resolved it are unaffected.
     *
     * @return false if the connection did not exist
     */
    public boolean removeConnection(String source, String destination, String keyword) {
        AtomicBoolean removed = new AtomicBoolean(false);

        outputs.computeIfPresent(source, (id, table) -> {
            Set<String> current = table.get(keyword);
            if (current == null || !current.contains(destination)) {
                return table;
            }
            removed.set(true);
            return withoutMember(table, keyword, destination);
        });
        if (!removed.get()) {
            return false;
        }
        reconcileInput(source, destination, keyword);
        log.debug("Removed connection {}", new Connection(source, destination, keyword));
        return true;
    }

    /**
     * Destinations reachable from {@code source} under {@code keyword}.
     *
     * @return an immutable snapshot, in insertion order
     */
    public Set<String> resolve(String source, String keyword) {
        Map<String, Set<String>> table = outputs.get(source);
        if (table == null) {
            return Set.of();
        }
        Set<String> destinations = table.get(keyword);
        return destinations != null ? destinations : Set.of();
    }

    /**
     * Immutable snapshot of an agent's output table.
     */
    public Map<String, Set<String>> outputsOf(String agentId) {
        Map<String, Set<String>> table = outputs.get(agentId);
        return table != null ? table : Map.of();
    }

    /**
     * Immutable snapshot of an agent's input table.
     */
    public Map<String, Set<String>> inputsOf(String agentId) {
        Map<String, Set<String>> table = inputs.get(agentId);
        return table != null ? table : Map.of();
    }

    /**
     * All connections leaving {@code agentId}.
     */
    public List<Connection> connectionsFrom(String agentId) {
        List<Connection> connections = new ArrayList<>();
        outputsOf(agentId).forEach((keyword, destinations) ->
                destinations.forEach(destination ->
                        connections.add(new Connection(agentId, destination, keyword))));
        return connections;
    }

    /**
     * Describe an agent's available output keywords and required input keywords.
     *
     * @param agentId    the agent
     * @param definition the agent's definition, or null if unknown
     */
    public AgentDescription discover(String agentId, AgentDefinition definition) {
        Set<String> inputKeywords = new LinkedHashSet<>();
        if (definition != null && definition.getActivationKeywords() != null) {
            inputKeywords.addAll(definition.getActivationKeywords());
        }
        inputsOf(agentId).values().forEach(inputKeywords::addAll);

        Set<String> exploring = new LinkedHashSet<>();
        explorers.forEach((keyword, agents) -> {
            if (agents.contains(agentId)) {
                exploring.add(keyword);
            }
        });

        return new AgentDescription(agentId,
                Collections.unmodifiableSet(new LinkedHashSet<>(outputsOf(agentId).keySet())),
                Collections.unmodifiableSet(inputKeywords),
                Collections.unmodifiableSet(exploring));
    }

    /**
     * Mark an agent as discoverable for a keyword. A null or blank keyword registers the agent
     * for every keyword.
     */
    public void explore(String agentId, String keyword) {
        String key = normalizeExploreKeyword(keyword);
        explorers.compute(key, (k, agents) -> {
            Set<String> updated = agents != null ? new LinkedHashSet<>(agents) : new LinkedHashSet<>();
            updated.add(agentId);
            return Collections.unmodifiableSet(updated);
        });
        log.debug("Agent {} exploring keyword {}", agentId, key);
    }

    /**
     * Withdraw an explore registration. A null keyword withdraws all of the agent's registrations.
     */
    public void stopExplore(String agentId, String keyword) {
        if (keyword == null) {
            for (String key : new ArrayList<>(explorers.keySet())) {
                withdraw(agentId, key);
            }
            return;
        }
        withdraw(agentId, normalizeExploreKeyword(keyword));
    }

    /**
     * Find every agent exploring {@code keyword}, wildcard explorers included.
     * The caller picks among them; the registry does not arbitrate.
     *
     * @param seekerId agent asking, excluded from the result
     */
    public List<String> seek(String seekerId, String keyword) {
        Set<String> candidates = new LinkedHashSet<>(explorers.getOrDefault(keyword, Set.of()));
        candidates.addAll(explorers.getOrDefault(AgentDefinition.ANY_KEYWORD, Set.of()));
        candidates.remove(seekerId);
        return List.copyOf(candidates);
    }

    /**
     * Snapshot of explore registrations, keyword -> agents.
     */
    public Map<String, Set<String>> explorations() {
        return Map.copyOf(explorers);
    }

    /**
     * Drop every input connection into {@code destination} tagged {@code keyword},
     * together with the matching output entries at the sources.
     *
     * @return the connections removed
     */
    public List<Connection> removeInputKeyword(String destination, String keyword) {
        List<Connection> removed = new ArrayList<>();
        inputsOf(destination).forEach((source, keywords) -> {
            if (keywords.contains(keyword) && removeConnection(source, destination, keyword)) {
                removed.add(new Connection(source, destination, keyword));
            }
        });
        return removed;
    }

    /**
     * Forget everything the agent owns: its output table, its input table and its explore
     * registrations. Links from other agents into it stay until a delivery fails on them.
     */
    public void dropAgent(String agentId) {
        Map<String, Set<String>> table = outputs.remove(agentId);
        if (table != null) {
            table.forEach((keyword, destinations) -> destinations.forEach(destination ->
                    reconcileInput(agentId, destination, keyword)));
        }
        inputs.remove(agentId);
        stopExplore(agentId, null);
    }

    /**
     * Replace the agent's output and input tables, used when restoring persisted state.
     */
    public void restore(String agentId, Map<String, ? extends Iterable<String>> outputTable,
                        Map<String, ? extends Iterable<String>> inputTable) {
        if (outputTable != null) {
            outputTable.forEach((keyword, destinations) ->
                    destinations.forEach(destination -> addConnection(agentId, destination, keyword)));
        }
        if (inputTable != null) {
            inputTable.forEach((source, keywords) ->
                    keywords.forEach(keyword -> addConnection(source, agentId, keyword)));
        }
    }

    public int connectionCount() {
        return outputs.values().stream()
                .flatMap(table -> table.values().stream())
                .mapToInt(Set::size)
                .sum();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    /**
     * Make the destination's input entry for (source, keyword) match the source's current output
     * table. The read happens inside the destination's compute, so the last writer for a
     * destination always leaves the input table agreeing with the outputs.
     */
    private void reconcileInput(String source, String destination, String keyword) {
        inputs.compute(destination, (id, table) -> {
            Map<String, Set<String>> sourceOutputs = outputs.get(source);
            Set<String> destinations = sourceOutputs != null ? sourceOutputs.get(keyword) : null;
            if (destinations != null && destinations.contains(destination)) {
                return withMember(table, source, keyword);
            }
            return table != null ? withoutMember(table, source, keyword) : null;
        });
    }

    private void withdraw(String agentId, String key) {
        explorers.computeIfPresent(key, (k, agents) -> {
            if (!agents.contains(agentId)) {
                return agents;
            }
            Set<String> updated = new LinkedHashSet<>(agents);
            updated.remove(agentId);
            return updated.isEmpty() ? null : Collections.unmodifiableSet(updated);
        });
    }

    private static String normalizeExploreKeyword(String keyword) {
        return keyword == null || keyword.isBlank() ? AgentDefinition.ANY_KEYWORD : keyword;
    }

    private static Map<String, Set<String>> withMember(Map<String, Set<String>> table, String key, String member) {
        Map<String, Set<String>> copy = table != null ? new LinkedHashMap<>(table) : new LinkedHashMap<>();
        Set<String> members = new LinkedHashSet<>(copy.getOrDefault(key, Set.of()));
        if (!members.add(member) && table != null) {
            return table;
        }
        copy.put(key, Collections.unmodifiableSet(members));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, Set<String>> withoutMember(Map<String, Set<String>> table, String key, String member) {
        Set<String> current = table.get(key);
        if (current == null || !current.contains(member)) {
            return table;
        }
        Map<String, Set<String>> copy = new LinkedHashMap<>(table);
        Set<String> members = new LinkedHashSet<>(current);
        members.remove(member);
        if (members.isEmpty()) {
            copy.remove(key);
        } else {
            copy.put(key, Collections.unmodifiableSet(members));
        }
        return copy.isEmpty() ? null : Collections.unmodifiableMap(copy);
    }
}
