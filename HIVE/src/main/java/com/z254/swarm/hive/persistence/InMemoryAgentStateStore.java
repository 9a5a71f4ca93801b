package com.z254.swarm.hive.persistence;

import com.z254.swarm.hive.domain.model.AgentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory snapshot store. State survives agent removal and re-creation, not a restart.
 */
@Component
@ConditionalOnProperty(prefix = "swarm.persistence", name = "store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryAgentStateStore implements AgentStateStore {

    private final Map<String, AgentSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(AgentSnapshot snapshot) {
        return Mono.fromRunnable(() -> {
            snapshots.put(snapshot.getAgentId(), snapshot);
            log.debug("Saved snapshot of {} in memory", snapshot.getAgentId());
        });
    }

    @Override
    public Mono<AgentSnapshot> load(String agentId) {
        return Mono.justOrEmpty(snapshots.get(agentId));
    }

    @Override
    public Mono<Boolean> delete(String agentId) {
        return Mono.fromCallable(() -> snapshots.remove(agentId) != null);
    }

    @Override
    public Flux<String> listAgentIds() {
        return Flux.fromIterable(snapshots.keySet()).sort();
    }

    @Override
    public String getType() {
        return "memory";
    }
}
