package com.z254.swarm.hive.persistence;

import com.z254.swarm.hive.domain.model.AgentSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Storage backend for agent snapshots, selected with {@code swarm.persistence.store}.
 */
public interface AgentStateStore {

    /**
     * Save (or overwrite) the snapshot of {@code snapshot.getAgentId()}.
     */
    Mono<Void> save(AgentSnapshot snapshot);

    /**
     * @return the stored snapshot, or empty if the store has none for this agent
     */
    Mono<AgentSnapshot> load(String agentId);

    /**
     * @return true if a snapshot was deleted
     */
    Mono<Boolean> delete(String agentId);

    Flux<String> listAgentIds();

    /**
     * Store type name ("memory", "file", "redis").
     */
    String getType();
}
