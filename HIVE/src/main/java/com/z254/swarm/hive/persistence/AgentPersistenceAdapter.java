package com.z254.swarm.hive.persistence;

import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Snapshots and restores an agent's routing links, self state and cache contents.
 *
 * <p>Whether the engine syncs after each successful activation, and whether creation restores
 * prior state, is fixed when the adapter is constructed.
 */
@Component
@Slf4j
public class AgentPersistenceAdapter {

    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final AgentStateStore store;
    private final boolean enabled;
    private final boolean syncOnActivation;
    private final boolean restoreOnCreate;

    @Autowired
    public AgentPersistenceAdapter(AgentRegistry agentRegistry,
                                   ConnectionRegistry connectionRegistry,
                                   AgentStateStore store,
                                   SwarmProperties properties) {
        this(agentRegistry, connectionRegistry, store, properties.getPersistence());
    }

    public AgentPersistenceAdapter(AgentRegistry agentRegistry,
                                   ConnectionRegistry connectionRegistry,
                                   AgentStateStore store,
                                   SwarmProperties.PersistenceProperties config) {
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.store = store;
        this.enabled = config.isEnabled();
        this.syncOnActivation = config.isEnabled() && config.isSyncOnActivation();
        this.restoreOnCreate = config.isEnabled() && config.isRestoreOnCreate();
        log.info("Agent persistence: store={}, enabled={}, syncOnActivation={}, restoreOnCreate={}",
                store.getType(), enabled, syncOnActivation, restoreOnCreate);
    }

    /**
     * Capture the agent's current state.
     *
     * @throws AgentRegistry.AgentNotFoundException if the agent does not exist
     */
    public AgentSnapshot snapshot(String agentId) {
        Agent agent = agentRegistry.get(agentId);

        Map<String, List<String>> outputs = new LinkedHashMap<>();
        connectionRegistry.outputsOf(agentId).forEach((keyword, destinations) ->
                outputs.put(keyword, new ArrayList<>(destinations)));
        Map<String, Set<String>> inputs = new LinkedHashMap<>();
        connectionRegistry.inputsOf(agentId).forEach((source, keywords) ->
                inputs.put(source, new LinkedHashSet<>(keywords)));

        return AgentSnapshot.builder()
                .agentId(agentId)
                .definition(agent.getDefinition())
                .selfState(agent.getSelfState())
                .outputConnections(outputs)
                .inputConnections(inputs)
                .cacheEntries(new ArrayList<>(agent.getCache().entries()))
                .nextSequence(agent.getCache().nextSequence())
                .takenAt(Instant.now())
                .build();
    }

    /**
     * Load a snapshot into a live agent: self state, cache contents and connections.
     *
     * @return true if the restored cache holds unused entries
     */
    public boolean restore(String agentId, AgentSnapshot snapshot) {
        Agent agent = agentRegistry.get(agentId);
        restoreState(agent, snapshot);
        restoreConnections(agentId, snapshot);
        log.info("Restored agent {}: {} cache entries, {} output keywords", agentId,
                agent.getCache().size(), connectionRegistry.outputsOf(agentId).size());
        return agent.getCache().hasUnused();
    }

    /**
     * Load self state and cache contents into an agent, registered or not. The cache is replaced.
     */
    public void restoreState(Agent agent, AgentSnapshot snapshot) {
        agent.setSelfState(snapshot.getSelfState());
        agent.getCache().restore(
                snapshot.getCacheEntries() != null ? snapshot.getCacheEntries() : List.of(),
                snapshot.getNextSequence());
    }

    public void restoreConnections(String agentId, AgentSnapshot snapshot) {
        connectionRegistry.restore(agentId, snapshot.getOutputConnections(), snapshot.getInputConnections());
    }

    /**
     * The stored snapshot to restore a newly created agent from. Empty if restore-on-create is
     * off or nothing is stored.
     */
    public Mono<AgentSnapshot> storedForCreate(String agentId) {
        return restoreOnCreate ? store.load(agentId) : Mono.empty();
    }

    /**
     * Snapshot the agent and write it to the store.
     */
    public Mono<Void> sync(String agentId) {
        if (!enabled) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> snapshot(agentId))
                .flatMap(store::save);
    }

    /**
     * {@link #sync(String)} if sync-on-activation is on.
     */
    public Mono<Void> syncAfterActivation(String agentId) {
        return syncOnActivation ? sync(agentId) : Mono.empty();
    }

    /**
     * Delete the agent's stored state.
     */
    public Mono<Boolean> forget(String agentId) {
        return store.delete(agentId);
    }

    public Mono<AgentSnapshot> loadStored(String agentId) {
        return store.load(agentId);
    }

    public boolean isSyncOnActivation() {
        return syncOnActivation;
    }

    public boolean isRestoreOnCreate() {
        return restoreOnCreate;
    }

    public String getStoreType() {
        return store.getType();
    }
}
