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
 * Persisted form of one agent: its routing links and cache contents.
 * The storage format is up to the {@code AgentStateStore}; the core only fills and reads these fields.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentSnapshot {

    private String agentId;

    private AgentDefinition definition;

    private String selfState;

    /**
     * keyword -> destination ids, in insertion order.
     */
    @Builder.Default
    private Map<String, List<String>> outputConnections = new LinkedHashMap<>();

    /**
     * source id -> keywords expected from that source.
     */
    @Builder.Default
    private Map<String, Set<String>> inputConnections = new LinkedHashMap<>();

    @Builder.Default
    private List<CachedMessage> cacheEntries = new ArrayList<>();

    /**
     * Sequence number the cache hands out next.
     */
    private long nextSequence;

    private Instant takenAt;
}
