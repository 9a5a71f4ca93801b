package com.z254.swarm.hive.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-system checkpoint: one snapshot per reasoning agent plus the explore registrations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkpoint {

    private Info metadata;

    @Builder.Default
    private List<AgentSnapshot> agents = new ArrayList<>();

    /**
     * keyword -> exploring agent ids.
     */
    @Builder.Default
    private Map<String, Set<String>> explorations = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Info {
        private String name;
        private Instant createdAt;
        private int totalAgents;
        private int savedAgents;
    }
}
