package com.z254.swarm.hive;

import com.z254.swarm.hive.domain.model.OutputDirective;
import com.z254.swarm.hive.reasoning.ReasoningCollaborator;
import com.z254.swarm.hive.reasoning.ReasoningRequest;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Reasoning collaborator whose answers are supplied by the test.
 * Records every request and the peak number of concurrent calls per agent.
 */
public class ScriptedReasoningCollaborator implements ReasoningCollaborator {

    private volatile Function<ReasoningRequest, Mono<List<OutputDirective>>> script;

    private final List<ReasoningRequest> requests = new CopyOnWriteArrayList<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger peakPerAgent = new AtomicInteger();
    private final AtomicInteger peakOverall = new AtomicInteger();
    private final AtomicInteger running = new AtomicInteger();

    public ScriptedReasoningCollaborator(Function<ReasoningRequest, Mono<List<OutputDirective>>> script) {
        this.script = script;
    }

    /**
     * Collaborator that answers every call with no directives.
     */
    public static ScriptedReasoningCollaborator silent() {
        return new ScriptedReasoningCollaborator(request -> Mono.just(List.of()));
    }

    public void setScript(Function<ReasoningRequest, Mono<List<OutputDirective>>> script) {
        this.script = script;
    }

    @Override
    public Mono<List<OutputDirective>> invoke(ReasoningRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            AtomicInteger counter = inFlight.computeIfAbsent(request.getAgentId(), id -> new AtomicInteger());
            peakPerAgent.accumulateAndGet(counter.incrementAndGet(), Math::max);
            peakOverall.accumulateAndGet(running.incrementAndGet(), Math::max);
            return script.apply(request)
                    .doFinally(signal -> {
                        counter.decrementAndGet();
                        running.decrementAndGet();
                    });
        });
    }

    @Override
    public String getProviderId() {
        return "scripted";
    }

    public List<ReasoningRequest> getRequests() {
        return requests;
    }

    public List<ReasoningRequest> requestsFor(String agentId) {
        return requests.stream().filter(request -> agentId.equals(request.getAgentId())).toList();
    }

    /**
     * Highest number of calls that were in flight at once for a single agent.
     */
    public int getPeakPerAgent() {
        return peakPerAgent.get();
    }

    public int getPeakOverall() {
        return peakOverall.get();
    }
}
