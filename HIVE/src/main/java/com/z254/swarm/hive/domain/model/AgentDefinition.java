package com.z254.swarm.hive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration record an agent is created from.
 * Bound from {@code swarm.agents[*]}, accepted by the REST API and stored in snapshots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentDefinition {

    /**
     * Wildcard activation keyword: any inbound keyword triggers the agent.
     */
    public static final String ANY_KEYWORD = "*";

    /**
     * Unique agent id.
     */
    private String id;

    /**
     * Registered kind name used to look up the factory.
     */
    @Builder.Default
    private String kind = "reasoning";

    /**
     * Static instruction text handed to the reasoning collaborator.
     */
    private String instructions;

    /**
     * Inbound keywords that can trigger processing. Empty means every keyword does.
     */
    @Builder.Default
    private Set<String> activationKeywords = new LinkedHashSet<>();

    /**
     * Capability flags. Empty means the kind's defaults.
     */
    @Builder.Default
    private Set<Capability> capabilities = EnumSet.noneOf(Capability.class);

    /**
     * Opaque behaviour parameters, passed through to collaborators unexamined.
     */
    @Builder.Default
    private Map<String, String> params = new HashMap<>();

    /**
     * Check whether an inbound keyword triggers this agent.
     */
    public boolean activatesOn(String keyword) {
        if (activationKeywords == null || activationKeywords.isEmpty()
                || activationKeywords.contains(ANY_KEYWORD)) {
            return true;
        }
        return activationKeywords.contains(keyword);
    }

    public String param(String name, String defaultValue) {
        if (params == null) {
            return defaultValue;
        }
        return params.getOrDefault(name, defaultValue);
    }
}
