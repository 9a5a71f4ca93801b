package com.z254.swarm.hive.api.dto;

import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.domain.model.AgentState;
import com.z254.swarm.hive.domain.model.Capability;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Read model of a live agent.
 */
@Data
@Builder
public class AgentView {

    private String id;
    private String kind;
    private AgentState state;
    private Set<Capability> capabilities;
    private Set<String> activationKeywords;
    private String selfState;
    private int cacheSize;
    private int unusedMessages;
    private Map<String, Set<String>> outputConnections;
    private Instant createdAt;

    public static AgentView from(Agent agent, Map<String, Set<String>> outputConnections) {
        return AgentView.builder()
                .id(agent.getId())
                .kind(agent.getKind())
                .state(agent.getState())
                .capabilities(agent.getCapabilities())
                .activationKeywords(agent.getDefinition().getActivationKeywords())
                .selfState(agent.getSelfState())
                .cacheSize(agent.getCache().size())
                .unusedMessages(agent.getCache().unusedCount())
                .outputConnections(outputConnections)
                .createdAt(agent.getCreatedAt())
                .build();
    }
}
