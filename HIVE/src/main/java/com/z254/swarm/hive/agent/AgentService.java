package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentDescription;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Service interface for agent lifecycle and routing operations.
 */
public interface AgentService {

    // ==================== Agent Management ====================

    /**
     * Create an agent and restore its persisted state if the store holds any.
     * Validation happens before the returned Mono is built: a blank id, a duplicate id or an
     * unknown kind throws from this call.
     *
     * @param definition the agent definition
     * @return the created agent, after restore
     */
    Mono<Agent> createAgent(AgentDefinition definition);

    /**
     * Remove an agent. An in-flight activation finishes but its outputs are discarded.
     *
     * @param agentId    the agent id
     * @param purgeState also delete the agent's persisted state
     * @return true if the agent existed
     */
    Mono<Boolean> removeAgent(String agentId, boolean purgeState);

    Optional<Agent> getAgent(String agentId);

    List<Agent> listAgents();

    // ==================== Routing ====================

    /**
     * Connect two existing agents.
     *
     * @return true if the connection was new
     */
    boolean connect(String source, String destination, String keyword);

    /**
     * @return false if the connection did not exist
     */
    boolean disconnect(String source, String destination, String keyword);

    AgentDescription discover(String agentId);

    void explore(String agentId, String keyword);

    void stopExplore(String agentId, String keyword);

    /**
     * Agents exploring {@code keyword}, excluding the seeker.
     */
    List<String> seek(String agentId, String keyword);

    // ==================== Activation ====================

    /**
     * Trigger an agent explicitly.
     *
     * @return true if the agent went from IDLE to TRIGGERED
     */
    boolean trigger(String agentId);
}
