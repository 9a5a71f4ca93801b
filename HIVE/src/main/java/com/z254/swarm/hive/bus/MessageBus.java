package com.z254.swarm.hive.bus;

import com.z254.swarm.hive.agent.ActivationQueue;
import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.cache.MessageCache;
import com.z254.swarm.hive.domain.model.Connection;
import com.z254.swarm.hive.observability.HiveEventLogger;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Central router between agents.
 *
 * <p>{@link #publish} resolves the destinations of (source, keyword) at call time, appends the
 * payload into each destination's cache and wakes the destination's state machine. It returns
 * as soon as the appends are done; activations run later on the engine's workers.
 * Fan-out is not atomic: each destination is handled independently and a missing destination
 * does not stop delivery to the others.
 */
@Component
@Slf4j
public class MessageBus {

    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final ActivationQueue activationQueue;
    private final HiveEventLogger eventLogger;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong pruned = new AtomicLong();
    private final AtomicLong overflows = new AtomicLong();

    private final Counter publishCounter;
    private final Counter deliveryCounter;
    private final Counter missCounter;
    private final Counter pruneCounter;
    private final Counter overflowCounter;

    public MessageBus(AgentRegistry agentRegistry,
                      ConnectionRegistry connectionRegistry,
                      ActivationQueue activationQueue,
                      HiveEventLogger eventLogger,
                      MeterRegistry meterRegistry) {
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.activationQueue = activationQueue;
        this.eventLogger = eventLogger;

        this.publishCounter = Counter.builder("swarm.bus.published").register(meterRegistry);
        this.deliveryCounter = Counter.builder("swarm.bus.delivered").register(meterRegistry);
        this.missCounter = Counter.builder("swarm.bus.delivery.misses").register(meterRegistry);
        this.pruneCounter = Counter.builder("swarm.bus.connections.pruned").register(meterRegistry);
        this.overflowCounter = Counter.builder("swarm.cache.overflows").register(meterRegistry);
    }

    /**
     * Route a payload along every connection of (source, keyword).
     *
     * @return number of caches the payload was appended to
     */
    public int publish(String sourceId, String keyword, String payload) {
        return publish(sourceId, keyword, payload, null);
    }

    /**
     * Route a payload, optionally restricted to one destination.
     *
     * @param destinationHint if set, deliver only to this agent, and only if it is one of the
     *                        resolved destinations
     * @return number of caches the payload was appended to
     */
    public int publish(String sourceId, String keyword, String payload, String destinationHint) {
        published.incrementAndGet();
        publishCounter.increment();

        Set<String> destinations = connectionRegistry.resolve(sourceId, keyword);
        if (destinations.isEmpty()) {
            recordMiss(sourceId, null, keyword, "no connection");
            return 0;
        }
        if (destinationHint != null && !destinationHint.isBlank()) {
            if (!destinations.contains(destinationHint)) {
                recordMiss(sourceId, destinationHint, keyword, "hinted destination not connected");
                return 0;
            }
            destinations = Set.of(destinationHint);
        }

        int count = 0;
        for (String destination : destinations) {
            if (deliverTo(sourceId, destination, keyword, payload, true)) {
                count++;
            }
        }
        log.debug("Published {} -[{}]-> {} of {} destinations", sourceId, keyword, count, destinations.size());
        return count;
    }

    /**
     * Append a payload straight into one agent's cache, bypassing connections.
     * This is the producer entry point and how registry answers reach an agent.
     *
     * @return 1 if delivered, 0 if the target does not exist
     */
    public int deliver(String senderId, String targetAgentId, String keyword, String payload) {
        published.incrementAndGet();
        publishCounter.increment();
        return deliverTo(senderId, targetAgentId, keyword, payload, false) ? 1 : 0;
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("published", published.get());
        stats.put("delivered", delivered.get());
        stats.put("deliveryMisses", misses.get());
        stats.put("prunedConnections", pruned.get());
        stats.put("cacheOverflows", overflows.get());
        stats.put("connections", connectionRegistry.connectionCount());
        stats.put("agents", agentRegistry.size());
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private boolean deliverTo(String senderId, String destinationId, String keyword, String payload,
                              boolean viaConnection) {
        Optional<Agent> destination = agentRegistry.find(destinationId);
        if (destination.isEmpty() || destination.get().isRemoved()) {
            recordMiss(senderId, destinationId, keyword, "destination does not exist");
            if (viaConnection && connectionRegistry.removeConnection(senderId, destinationId, keyword)) {
                pruned.incrementAndGet();
                pruneCounter.increment();
                eventLogger.logRegistryInconsistency(new Connection(senderId, destinationId, keyword),
                        "dangling connection pruned");
            }
            return false;
        }

        Agent agent = destination.get();
        MessageCache.AppendResult result = agent.getCache().append(senderId, keyword, payload);
        delivered.incrementAndGet();
        deliveryCounter.increment();

        if (result.overflowed()) {
            overflows.incrementAndGet();
            overflowCounter.increment();
            log.warn("Cache of {} over capacity, dropped {} unused entries", agent.getId(), result.droppedUnused());
            eventLogger.logCacheOverflow(agent.getId(), result.droppedUnused());
        }

        if (agent.triggersOn(keyword) && agent.getStateMachine().trigger()) {
            activationQueue.offer(agent.getId());
        }
        return true;
    }

    private void recordMiss(String sourceId, String destinationId, String keyword, String reason) {
        misses.incrementAndGet();
        missCounter.increment();
        log.warn("Delivery miss {} -[{}]-> {}: {}", sourceId, keyword,
                destinationId != null ? destinationId : "?", reason);
        eventLogger.logDeliveryMiss(sourceId, destinationId, keyword, reason);
    }
}
