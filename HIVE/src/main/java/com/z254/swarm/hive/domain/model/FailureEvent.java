package com.z254.swarm.hive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Structured failure record emitted by the bus and the activation engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureEvent {

    private String agentId;

    private FailureKind kind;

    /**
     * Attempts made for the current input (activation failures only).
     */
    private int retryCount;

    /**
     * True when the engine gave up and marked the input used.
     */
    private boolean exhausted;

    private String detail;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static FailureEvent of(String agentId, FailureKind kind, String detail) {
        return FailureEvent.builder()
                .agentId(agentId)
                .kind(kind)
                .detail(detail)
                .build();
    }
}
