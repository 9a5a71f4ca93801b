package com.z254.swarm.hive.reasoning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Input of one reasoning call: the agent's static instructions, its current self state,
 * the keywords it can route output under and the unused messages of the activation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasoningRequest {

    private String agentId;
    private String activationId;
    private String instructions;

    @Builder.Default
    private String selfState = "";

    @Builder.Default
    private Set<String> outputKeywords = new LinkedHashSet<>();

    @Builder.Default
    private List<InputMessage> messages = new ArrayList<>();

    /**
     * The agent's opaque params, passed through unexamined.
     */
    @Builder.Default
    private Map<String, String> params = Map.of();

    public record InputMessage(String senderId, String keyword, String payload) {
    }
}
