package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.bus.MessageBus;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.ActivationRecord;
import com.z254.swarm.hive.domain.model.CachedMessage;
import com.z254.swarm.hive.domain.model.Capability;
import com.z254.swarm.hive.domain.model.ControlSignal;
import com.z254.swarm.hive.domain.model.FailureEvent;
import com.z254.swarm.hive.domain.model.FailureKind;
import com.z254.swarm.hive.domain.model.OutputDirective;
import com.z254.swarm.hive.observability.ActivationFrequencyMonitor;
import com.z254.swarm.hive.observability.HiveEventLogger;
import com.z254.swarm.hive.persistence.AgentPersistenceAdapter;
import com.z254.swarm.hive.reasoning.DirectiveParser;
import com.z254.swarm.hive.reasoning.ReasoningCollaborator;
import com.z254.swarm.hive.reasoning.ReasoningException;
import com.z254.swarm.hive.reasoning.ReasoningRequest;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import com.z254.swarm.hive.sink.ConsumerSink;
import com.z254.swarm.hive.sink.ConsumerSinkRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Worker pool that runs agent activations.
 *
 * <p>Workers drain the {@link ActivationQueue}; at most {@code swarm.scheduler.workers}
 * activations run at once, and the agent state machine guarantees that one agent never has two.
 * An activation reduces the agent's cache, snapshots its unused entries and hands them to the
 * reasoning collaborator (REASON agents) or to the agent's consumer sink (CONSUME agents).
 *
 * <p>On success the entries are marked used, self state and control signals are applied and the
 * remaining directives are published. On failure the entries stay unused and the agent is
 * rescheduled after the retry backoff; once {@code max-attempts} is reached the entries are
 * marked used anyway and an exhausted failure event is emitted.
 */
@Component
@Slf4j
public class ActivationEngine {

    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final MessageBus messageBus;
    private final ActivationQueue activationQueue;
    private final ReasoningCollaborator reasoningCollaborator;
    private final DirectiveParser directiveParser;
    private final ControlSignalHandler signalHandler;
    private final ConsumerSinkRegistry sinkRegistry;
    private final AgentPersistenceAdapter persistenceAdapter;
    private final ActivationFrequencyMonitor frequencyMonitor;
    private final HiveEventLogger eventLogger;
    private final Scheduler scheduler;
    private final MeterRegistry meterRegistry;

    private final int workers;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration retryBackoff;

    private final Timer activationTimer;
    private final Counter exhaustedCounter;

    private volatile Disposable subscription;

    public ActivationEngine(
            AgentRegistry agentRegistry,
            ConnectionRegistry connectionRegistry,
            MessageBus messageBus,
            ActivationQueue activationQueue,
            ReasoningCollaborator reasoningCollaborator,
            DirectiveParser directiveParser,
            ControlSignalHandler signalHandler,
            ConsumerSinkRegistry sinkRegistry,
            AgentPersistenceAdapter persistenceAdapter,
            ActivationFrequencyMonitor frequencyMonitor,
            HiveEventLogger eventLogger,
            SwarmProperties properties,
            @Qualifier("activationScheduler") Scheduler scheduler,
            MeterRegistry meterRegistry) {
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.messageBus = messageBus;
        this.activationQueue = activationQueue;
        this.reasoningCollaborator = reasoningCollaborator;
        this.directiveParser = directiveParser;
        this.signalHandler = signalHandler;
        this.sinkRegistry = sinkRegistry;
        this.persistenceAdapter = persistenceAdapter;
        this.frequencyMonitor = frequencyMonitor;
        this.eventLogger = eventLogger;
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;

        this.workers = Math.max(1, properties.getScheduler().getWorkers());
        this.timeout = properties.getActivation().getTimeout();
        this.maxAttempts = Math.max(1, properties.getActivation().getMaxAttempts());
        this.retryBackoff = properties.getActivation().getRetryBackoff();

        this.activationTimer = Timer.builder("swarm.activation.latency").register(meterRegistry);
        this.exhaustedCounter = Counter.builder("swarm.activation.exhausted").register(meterRegistry);
    }

    /**
     * Start draining the ready queue.
     */
    @PostConstruct
    public synchronized void start() {
        if (subscription != null) {
            return;
        }
        subscription = activationQueue.asFlux()
                .flatMap(this::activate, workers)
                .subscribe(
                        unused -> { },
                        e -> log.error("Activation loop terminated", e));
        log.info("Activation engine started with {} workers (timeout={}, maxAttempts={}, retryBackoff={})",
                workers, timeout, maxAttempts, retryBackoff);
    }

    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
            log.info("Activation engine stopped");
        }
    }

    /**
     * Trigger an agent explicitly, whatever its activation keywords.
     *
     * @return true if the agent went from IDLE to TRIGGERED
     */
    public boolean trigger(String agentId) {
        return agentRegistry.find(agentId)
                .filter(Agent::isActivatable)
                .map(agent -> {
                    boolean scheduled = agent.getStateMachine().trigger();
                    if (scheduled) {
                        activationQueue.offer(agentId);
                    }
                    return scheduled;
                })
                .orElse(false);
    }

    /**
     * Failure events from the bus and the engine.
     */
    public Flux<FailureEvent> failures() {
        return eventLogger.failures();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    Mono<Void> activate(String agentId) {
        return Mono.defer(() -> {
                    Agent agent = agentRegistry.find(agentId).orElse(null);
                    if (agent == null || !agent.getStateMachine().beginProcessing()) {
                        return Mono.empty();
                    }
                    return process(agent);
                })
                .subscribeOn(scheduler)
                .onErrorResume(e -> {
                    log.error("Unexpected error in activation of {}", agentId, e);
                    agentRegistry.find(agentId).ifPresent(agent ->
                            reschedule(agent.getStateMachine().finishProcessing(), agentId));
                    return Mono.empty();
                });
    }

    private Mono<Void> process(Agent agent) {
        AgentStateMachine stateMachine = agent.getStateMachine();

        List<CachedMessage> superseded = agent.getCache().reduce();
        if (!superseded.isEmpty()) {
            log.debug("Reduced {} superseded entries in cache of {}", superseded.size(), agent.getId());
        }
        List<CachedMessage> unused = agent.getCache().drainUnused();
        if (unused.isEmpty()) {
            reschedule(stateMachine.finishProcessing(), agent.getId());
            return Mono.empty();
        }

        ActivationRecord record = ActivationRecord.start(agent.getId(), stateMachine.nextAttempt(), unused);
        eventLogger.setActivationContext(agent.getId(), record.activationId());
        try {
            eventLogger.logActivationStarted(agent.getId(), record.activationId(), record.attempt(),
                    record.messages().size());
        } finally {
            eventLogger.clearContext();
        }

        return execute(agent, record)
                .timeout(timeout, Mono.error(() -> new ReasoningException(FailureKind.ACTIVATION_TIMEOUT,
                        "Activation timed out after " + timeout)))
                .map(this::interpret)
                .publishOn(scheduler)
                .flatMap(output -> onSuccess(agent, record, output))
                .onErrorResume(e -> {
                    onFailure(agent, record, e);
                    return Mono.empty();
                });
    }

    private Mono<List<OutputDirective>> execute(Agent agent, ActivationRecord record) {
        if (agent.can(Capability.REASON)) {
            return Mono.defer(() -> reasoningCollaborator.invoke(buildRequest(agent, record)))
                    .defaultIfEmpty(List.of());
        }
        return Mono.fromCallable(() -> {
            ConsumerSink sink = sinkRegistry.resolve(agent);
            for (CachedMessage message : record.messages()) {
                sink.accept(agent.getId(), message);
            }
            return List.<OutputDirective>of();
        }).onErrorMap(e -> !(e instanceof ReasoningException),
                e -> ReasoningException.transport("Consumer sink failed: " + e.getMessage(), e));
    }

    private ReasoningRequest buildRequest(Agent agent, ActivationRecord record) {
        List<ReasoningRequest.InputMessage> messages = new ArrayList<>(record.messages().size());
        for (CachedMessage message : record.messages()) {
            messages.add(new ReasoningRequest.InputMessage(message.senderId(), message.keyword(), message.payload()));
        }
        Map<String, String> params = agent.getDefinition().getParams();
        return ReasoningRequest.builder()
                .agentId(agent.getId())
                .activationId(record.activationId())
                .instructions(agent.getDefinition().getInstructions())
                .selfState(agent.getSelfState())
                .outputKeywords(new LinkedHashSet<>(connectionRegistry.outputsOf(agent.getId()).keySet()))
                .messages(messages)
                .params(params != null ? Map.copyOf(params) : Map.of())
                .build();
    }

    private ActivationOutput interpret(List<OutputDirective> directives) {
        String selfState = null;
        List<ControlSignal> signals = new ArrayList<>();
        List<OutputDirective> publications = new ArrayList<>();
        for (OutputDirective directive : directives) {
            if (directive.isSelfState()) {
                selfState = directive.payload();
            } else if (directive.isSignal()) {
                signals.addAll(directiveParser.parseSignals(directive.payload()));
            } else {
                publications.add(directive);
            }
        }
        return new ActivationOutput(selfState, signals, publications, directives.size());
    }

    private Mono<Void> onSuccess(Agent agent, ActivationRecord record, ActivationOutput output) {
        String agentId = agent.getId();
        if (agent.isRemoved()) {
            log.debug("Agent {} was removed during activation {}, discarding {} directives",
                    agentId, record.activationId(), output.directiveCount());
            return Mono.empty();
        }

        eventLogger.setActivationContext(agentId, record.activationId());
        try {
            int consumed = agent.getCache().markUsed(record.sequences());
            agent.getStateMachine().resetAttempts();

            if (output.selfState() != null) {
                agent.setSelfState(output.selfState());
            }
            for (ControlSignal signal : output.signals()) {
                signalHandler.apply(agent, signal);
            }
            for (OutputDirective directive : output.publications()) {
                messageBus.publish(agentId, directive.keyword(), directive.payload(), directive.destinationHint());
            }

            Duration elapsed = Duration.between(record.startedAt(), Instant.now());
            activationTimer.record(elapsed);
            frequencyMonitor.record(agentId);
            eventLogger.logActivationCompleted(agentId, record.activationId(), elapsed.toMillis(), consumed,
                    output.directiveCount());
        } finally {
            eventLogger.clearContext();
        }

        // The agent stays PROCESSING until its snapshot is stored, so saves of one agent never overlap.
        return persistenceAdapter.syncAfterActivation(agentId)
                .onErrorResume(e -> {
                    log.warn("Failed to persist state of {} after activation: {}", agentId, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> reschedule(agent.getStateMachine().finishProcessing(), agentId));
    }

    private void onFailure(Agent agent, ActivationRecord record, Throwable error) {
        String agentId = agent.getId();
        if (agent.isRemoved()) {
            log.debug("Agent {} was removed during failed activation {}", agentId, record.activationId());
            return;
        }
        FailureKind kind = classify(error);
        meterRegistry.counter("swarm.activation.failures", "kind", kind.name()).increment();

        eventLogger.setActivationContext(agentId, record.activationId());
        try {
            AgentStateMachine stateMachine = agent.getStateMachine();
            if (record.attempt() >= maxAttempts) {
                agent.getCache().markUsed(record.sequences());
                stateMachine.resetAttempts();
                exhaustedCounter.increment();
                log.error("Agent {} gave up on {} messages after {} attempts: {}", agentId,
                        record.messages().size(), record.attempt(), error.getMessage());
                eventLogger.logActivationFailed(agentId, kind, record.attempt(), true, error.getMessage());
                reschedule(stateMachine.finishProcessing(), agentId);
                return;
            }

            log.warn("Activation {} of {} failed (attempt {}/{}, {}): {}", record.activationId(), agentId,
                    record.attempt(), maxAttempts, kind, error.getMessage());
            eventLogger.logActivationFailed(agentId, kind, record.attempt(), false, error.getMessage());
            if (stateMachine.failProcessing()) {
                Mono.delay(retryBackoff, scheduler)
                        .subscribe(tick -> activationQueue.offer(agentId));
            }
        } finally {
            eventLogger.clearContext();
        }
    }

    private void reschedule(boolean triggeredAgain, String agentId) {
        if (triggeredAgain) {
            activationQueue.offer(agentId);
        }
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof ReasoningException reasoningException) {
            return reasoningException.getKind();
        }
        if (error instanceof TimeoutException) {
            return FailureKind.ACTIVATION_TIMEOUT;
        }
        return FailureKind.TRANSPORT_ERROR;
    }

    private record ActivationOutput(String selfState, List<ControlSignal> signals,
                                    List<OutputDirective> publications, int directiveCount) {
    }
}
