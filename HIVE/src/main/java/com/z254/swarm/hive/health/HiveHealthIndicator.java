package com.z254.swarm.hive.health;

import com.z254.swarm.hive.bus.MessageBus;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.persistence.AgentPersistenceAdapter;
import com.z254.swarm.hive.registry.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Health indicator for HIVE.
 * Reports agent counts per state, bus statistics and the persistence setup.
 */
@Component
@Slf4j
public class HiveHealthIndicator implements ReactiveHealthIndicator {

    private final AgentRegistry agentRegistry;
    private final MessageBus messageBus;
    private final AgentPersistenceAdapter persistenceAdapter;
    private final SwarmProperties properties;
    private final Scheduler activationScheduler;

    public HiveHealthIndicator(AgentRegistry agentRegistry,
                               MessageBus messageBus,
                               AgentPersistenceAdapter persistenceAdapter,
                               SwarmProperties properties,
                               @Qualifier("activationScheduler") Scheduler activationScheduler) {
        this.agentRegistry = agentRegistry;
        this.messageBus = messageBus;
        this.persistenceAdapter = persistenceAdapter;
        this.properties = properties;
        this.activationScheduler = activationScheduler;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    Health.Builder builder = activationScheduler.isDisposed() ? Health.down() : Health.up();

                    builder.withDetail("agents", agentRegistry.size());
                    builder.withDetail("agentStates", agentRegistry.countByState());
                    builder.withDetail("bus", messageBus.getStats());
                    builder.withDetail("workers", properties.getScheduler().getWorkers());
                    builder.withDetail("persistence.store", persistenceAdapter.getStoreType());
                    builder.withDetail("persistence.syncOnActivation", persistenceAdapter.isSyncOnActivation());
                    builder.withDetail("reasoning.openai.enabled", properties.getReasoning().getOpenai().isEnabled());

                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
