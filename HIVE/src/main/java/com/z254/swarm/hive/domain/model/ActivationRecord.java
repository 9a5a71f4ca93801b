package com.z254.swarm.hive.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Unused cache entries selected for one processing cycle of an agent.
 *
 * @param activationId id used to correlate log lines of this cycle
 * @param agentId      the processing agent
 * @param attempt      1-based attempt number for this input
 * @param messages     the snapshot, in arrival order
 * @param startedAt    when processing started
 */
public record ActivationRecord(String activationId, String agentId, int attempt,
                               List<CachedMessage> messages, Instant startedAt) {

    public static ActivationRecord start(String agentId, int attempt, List<CachedMessage> messages) {
        return new ActivationRecord(UUID.randomUUID().toString(), agentId, attempt,
                List.copyOf(messages), Instant.now());
    }

    public List<Long> sequences() {
        return messages.stream().map(CachedMessage::sequence).toList();
    }
}
