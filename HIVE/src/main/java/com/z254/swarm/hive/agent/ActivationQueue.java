package com.z254.swarm.hive.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Ready queue of TRIGGERED agent ids, drained by the {@link ActivationEngine} workers.
 *
 * <p>Only the caller that won a state machine's IDLE -> TRIGGERED transition offers an id, so
 * the queue holds at most one entry per agent and stays bounded by the number of agents.
 */
@Component
@Slf4j
public class ActivationQueue {

    private final Sinks.Many<String> ready = Sinks.many().unicast().onBackpressureBuffer();

    public synchronized void offer(String agentId) {
        Sinks.EmitResult result = ready.tryEmitNext(agentId);
        if (result.isFailure()) {
            log.warn("Could not enqueue agent {}: {}", agentId, result);
        }
    }

    /**
     * The queue as a flux. Single subscriber.
     */
    public Flux<String> asFlux() {
        return ready.asFlux();
    }

    public synchronized void close() {
        ready.tryEmitComplete();
    }
}
