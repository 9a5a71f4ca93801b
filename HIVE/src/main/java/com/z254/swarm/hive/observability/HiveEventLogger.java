package com.z254.swarm.hive.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.domain.model.Connection;
import com.z254.swarm.hive.domain.model.FailureEvent;
import com.z254.swarm.hive.domain.model.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured event log for HIVE.
 * Writes one JSON object per event and republishes failures on {@link #failures()}.
 */
@Component
@Slf4j
public class HiveEventLogger {

    public static final String MDC_AGENT_ID = "agentId";
    public static final String MDC_ACTIVATION_ID = "activationId";

    private final ObjectMapper objectMapper;
    private final Sinks.Many<FailureEvent> failureSink = Sinks.many().multicast().directBestEffort();

    public HiveEventLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Hot stream of failure events. Subscribers only see events emitted after they subscribe.
     */
    public Flux<FailureEvent> failures() {
        return failureSink.asFlux();
    }

    public void setActivationContext(String agentId, String activationId) {
        if (agentId != null) MDC.put(MDC_AGENT_ID, agentId);
        if (activationId != null) MDC.put(MDC_ACTIVATION_ID, activationId);
    }

    public void clearContext() {
        MDC.remove(MDC_AGENT_ID);
        MDC.remove(MDC_ACTIVATION_ID);
    }

    public void logAgentCreated(String agentId, String kind, boolean restored) {
        logEvent("agent_created", Map.of(
                "agentId", agentId,
                "kind", kind,
                "restored", restored
        ));
    }

    public void logAgentRemoved(String agentId) {
        logEvent("agent_removed", Map.of("agentId", agentId));
    }

    public void logActivationStarted(String agentId, String activationId, int attempt, int messages) {
        logEvent("activation_started", Map.of(
                "agentId", agentId,
                "activationId", activationId,
                "attempt", attempt,
                "messages", messages
        ));
    }

    public void logActivationCompleted(String agentId, String activationId, long durationMs,
                                       int consumed, int directives) {
        logEvent("activation_completed", Map.of(
                "agentId", agentId,
                "activationId", activationId,
                "durationMs", durationMs,
                "consumed", consumed,
                "directives", directives
        ));
    }

    /**
     * Log an activation failure and emit it as a {@link FailureEvent}.
     */
    public void logActivationFailed(String agentId, FailureKind kind, int attempt, boolean exhausted,
                                    String detail) {
        Map<String, Object> data = new HashMap<>();
        data.put("agentId", agentId);
        data.put("kind", kind.name());
        data.put("retryCount", attempt);
        data.put("exhausted", exhausted);
        data.put("detail", detail != null ? detail : "Unknown error");
        logEvent("activation_failed", data);

        emit(FailureEvent.builder()
                .agentId(agentId)
                .kind(kind)
                .retryCount(attempt)
                .exhausted(exhausted)
                .detail(detail)
                .build());
    }

    public void logDeliveryMiss(String sourceId, String destinationId, String keyword, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("sourceId", sourceId);
        data.put("keyword", keyword);
        data.put("reason", reason);
        if (destinationId != null) data.put("destinationId", destinationId);
        logEvent("delivery_miss", data);

        emit(FailureEvent.of(destinationId != null ? destinationId : sourceId, FailureKind.DELIVERY_MISS,
                reason + " (" + sourceId + " -[" + keyword + "]-> " + destinationId + ")"));
    }

    public void logCacheOverflow(String agentId, long droppedUnused) {
        logEvent("cache_overflow", Map.of(
                "agentId", agentId,
                "droppedUnused", droppedUnused
        ));
        emit(FailureEvent.of(agentId, FailureKind.CACHE_OVERFLOW, droppedUnused + " unused entries evicted"));
    }

    public void logRegistryInconsistency(Connection connection, String reason) {
        logEvent("registry_inconsistency", Map.of(
                "connection", connection.toString(),
                "reason", reason
        ));
        emit(FailureEvent.of(connection.source(), FailureKind.REGISTRY_INCONSISTENCY,
                reason + ": " + connection));
    }

    public void logReasoningCall(String providerId, String model, long durationMs, boolean success) {
        logEvent("reasoning_call", Map.of(
                "providerId", providerId,
                "model", model != null ? model : "unknown",
                "durationMs", durationMs,
                "success", success
        ));
    }

    public void logSignal(String agentId, String signalType, String keyword, String target) {
        Map<String, Object> data = new HashMap<>();
        data.put("agentId", agentId);
        data.put("signal", signalType);
        if (keyword != null) data.put("keyword", keyword);
        if (target != null) data.put("target", target);
        logEvent("control_signal", data);
    }

    public void logCheckpoint(String operation, String name, int agents) {
        logEvent("checkpoint", Map.of(
                "operation", operation,
                "name", name,
                "agents", agents
        ));
    }

    private synchronized void emit(FailureEvent event) {
        Sinks.EmitResult result = failureSink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Failure event not delivered to subscribers: {}", result);
        }
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "hive");

        String activationId = MDC.get(MDC_ACTIVATION_ID);
        if (activationId != null) event.putIfAbsent("activationId", activationId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
