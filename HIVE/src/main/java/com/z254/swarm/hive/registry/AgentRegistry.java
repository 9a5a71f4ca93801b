package com.z254.swarm.hive.registry;

import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.agent.AgentKindRegistry;
import com.z254.swarm.hive.domain.HiveException;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live agent, keyed by id.
 *
 * <p>Registration builds the agent through the {@link AgentKindRegistry}; removal moves the
 * agent to REMOVED and drops everything the connection registry holds for it.
 */
@Component
@Slf4j
public class AgentRegistry {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final AgentKindRegistry kindRegistry;
    private final ConnectionRegistry connectionRegistry;

    public AgentRegistry(AgentKindRegistry kindRegistry, ConnectionRegistry connectionRegistry) {
        this.kindRegistry = kindRegistry;
        this.connectionRegistry = connectionRegistry;
    }

    /**
     * Build and register an agent.
     *
     * @throws InvalidAgentIdException   if the id is blank
     * @throws DuplicateAgentException   if an agent with the id already exists
     * @throws AgentKindRegistry.UnknownAgentKindException if the kind is not registered
     */
    public Agent register(AgentDefinition definition) {
        return add(build(definition));
    }

    /**
     * Build an agent without making it visible. Validates the id and kind, and rejects ids that
     * are already taken.
     *
     * @throws InvalidAgentIdException   if the id is blank
     * @throws DuplicateAgentException   if an agent with the id already exists
     * @throws AgentKindRegistry.UnknownAgentKindException if the kind is not registered
     */
    public Agent build(AgentDefinition definition) {
        String id = definition.getId();
        if (id == null || id.isBlank()) {
            throw new InvalidAgentIdException();
        }
        if (agents.containsKey(id)) {
            throw new DuplicateAgentException(id);
        }
        return kindRegistry.create(definition);
    }

    /**
     * Register an agent produced by {@link #build(AgentDefinition)}.
     *
     * @throws DuplicateAgentException if another agent took the id in the meantime
     */
    public Agent add(Agent agent) {
        if (agents.putIfAbsent(agent.getId(), agent) != null) {
            throw new DuplicateAgentException(agent.getId());
        }
        log.info("Registered agent: {} (kind={}, capabilities={})", agent.getId(), agent.getKind(),
                agent.getCapabilities());
        return agent;
    }

    /**
     * Remove an agent. An in-flight activation finishes, but its outputs are discarded.
     *
     * @return the removed agent, empty if none was registered
     */
    public Optional<Agent> remove(String agentId) {
        Agent agent = agents.remove(agentId);
        if (agent == null) {
            return Optional.empty();
        }
        agent.getStateMachine().remove();
        connectionRegistry.dropAgent(agentId);
        log.info("Removed agent: {}", agentId);
        return Optional.of(agent);
    }

    public Optional<Agent> find(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    /**
     * @throws AgentNotFoundException if no agent has the id
     */
    public Agent get(String agentId) {
        return find(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    /**
     * All agents ordered by id.
     */
    public List<Agent> list() {
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::getId))
                .toList();
    }

    public int size() {
        return agents.size();
    }

    public Map<AgentState, Long> countByState() {
        Map<AgentState, Long> counts = new EnumMap<>(AgentState.class);
        for (AgentState state : AgentState.values()) {
            counts.put(state, 0L);
        }
        agents.values().forEach(agent -> counts.merge(agent.getState(), 1L, Long::sum));
        return counts;
    }

    public static class DuplicateAgentException extends HiveException {
        public DuplicateAgentException(String agentId) {
            super("Agent already exists: " + agentId);
        }
    }

    public static class AgentNotFoundException extends HiveException {
        public AgentNotFoundException(String agentId) {
            super("Agent not found: " + agentId);
        }
    }

    public static class InvalidAgentIdException extends HiveException {
        public InvalidAgentIdException() {
            super("Agent id must not be blank");
        }
    }
}
