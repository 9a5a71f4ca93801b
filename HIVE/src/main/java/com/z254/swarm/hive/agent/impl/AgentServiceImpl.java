package com.z254.swarm.hive.agent.impl;

import com.z254.swarm.hive.agent.ActivationEngine;
import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.agent.AgentKindRegistry.InvalidAgentDefinitionException;
import com.z254.swarm.hive.agent.AgentService;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentDescription;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import com.z254.swarm.hive.domain.model.Capability;
import com.z254.swarm.hive.observability.ActivationFrequencyMonitor;
import com.z254.swarm.hive.observability.HiveEventLogger;
import com.z254.swarm.hive.persistence.AgentPersistenceAdapter;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import com.z254.swarm.hive.sink.ConsumerSinkRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Implementation of the agent service.
 * Ties the registries, the persistence adapter and the activation engine together.
 */
@Service
@Slf4j
public class AgentServiceImpl implements AgentService {

    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final ActivationEngine activationEngine;
    private final AgentPersistenceAdapter persistenceAdapter;
    private final ConsumerSinkRegistry sinkRegistry;
    private final ActivationFrequencyMonitor frequencyMonitor;
    private final HiveEventLogger eventLogger;

    public AgentServiceImpl(
            AgentRegistry agentRegistry,
            ConnectionRegistry connectionRegistry,
            ActivationEngine activationEngine,
            AgentPersistenceAdapter persistenceAdapter,
            ConsumerSinkRegistry sinkRegistry,
            ActivationFrequencyMonitor frequencyMonitor,
            HiveEventLogger eventLogger) {
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.activationEngine = activationEngine;
        this.persistenceAdapter = persistenceAdapter;
        this.sinkRegistry = sinkRegistry;
        this.frequencyMonitor = frequencyMonitor;
        this.eventLogger = eventLogger;
    }

    // ==================== Agent Management ====================

    @Override
    public Mono<Agent> createAgent(AgentDefinition definition) {
        Agent agent = agentRegistry.build(definition);
        if (agent.can(Capability.CONSUME) && !agent.can(Capability.REASON)) {
            String sink = ConsumerSinkRegistry.sinkName(agent);
            if (!sinkRegistry.hasSink(sink)) {
                throw new InvalidAgentDefinitionException(
                        "Unknown consumer sink '" + sink + "' for agent " + agent.getId());
            }
        }

        return persistenceAdapter.storedForCreate(agent.getId())
                .map(Optional::of)
                .onErrorResume(e -> {
                    log.warn("Could not restore state of {}, starting empty: {}", agent.getId(), e.getMessage());
                    return Mono.just(Optional.<AgentSnapshot>empty());
                })
                .defaultIfEmpty(Optional.empty())
                .map(stored -> {
                    // State and cache go in before registration; nothing can deliver to the agent yet.
                    stored.ifPresent(snapshot -> persistenceAdapter.restoreState(agent, snapshot));
                    agentRegistry.add(agent);
                    stored.ifPresent(snapshot -> persistenceAdapter.restoreConnections(agent.getId(), snapshot));
                    eventLogger.logAgentCreated(agent.getId(), agent.getKind(), stored.isPresent());
                    if (agent.getCache().hasUnused()) {
                        activationEngine.trigger(agent.getId());
                    }
                    return agent;
                });
    }

    @Override
    public Mono<Boolean> removeAgent(String agentId, boolean purgeState) {
        Optional<Agent> removed = agentRegistry.remove(agentId);
        if (removed.isEmpty()) {
            return Mono.just(false);
        }
        frequencyMonitor.unregister(agentId);
        eventLogger.logAgentRemoved(agentId);
        if (!purgeState) {
            return Mono.just(true);
        }
        return persistenceAdapter.forget(agentId).thenReturn(true);
    }

    @Override
    public Optional<Agent> getAgent(String agentId) {
        return agentRegistry.find(agentId);
    }

    @Override
    public List<Agent> listAgents() {
        return agentRegistry.list();
    }

    // ==================== Routing ====================

    @Override
    public boolean connect(String source, String destination, String keyword) {
        requireKeyword(keyword);
        agentRegistry.get(source);
        agentRegistry.get(destination);
        return connectionRegistry.addConnection(source, destination, keyword);
    }

    @Override
    public boolean disconnect(String source, String destination, String keyword) {
        requireKeyword(keyword);
        return connectionRegistry.removeConnection(source, destination, keyword);
    }

    @Override
    public AgentDescription discover(String agentId) {
        Agent agent = agentRegistry.get(agentId);
        return connectionRegistry.discover(agentId, agent.getDefinition());
    }

    @Override
    public void explore(String agentId, String keyword) {
        agentRegistry.get(agentId);
        connectionRegistry.explore(agentId, keyword);
    }

    @Override
    public void stopExplore(String agentId, String keyword) {
        connectionRegistry.stopExplore(agentId, keyword);
    }

    @Override
    public List<String> seek(String agentId, String keyword) {
        requireKeyword(keyword);
        return connectionRegistry.seek(agentId, keyword);
    }

    // ==================== Activation ====================

    @Override
    public boolean trigger(String agentId) {
        agentRegistry.get(agentId);
        return activationEngine.trigger(agentId);
    }

    private static void requireKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Keyword must not be blank");
        }
    }
}
