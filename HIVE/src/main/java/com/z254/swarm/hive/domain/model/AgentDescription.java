package com.z254.swarm.hive.domain.model;

import java.util.Set;

/**
 * Self-description of an agent as seen through the connection registry.
 *
 * @param agentId        the agent
 * @param outputKeywords keywords the agent currently routes output under
 * @param inputKeywords  keywords the agent expects on input (activation keywords and input connections)
 * @param exploring      keywords the agent has made itself discoverable for
 */
public record AgentDescription(String agentId, Set<String> outputKeywords, Set<String> inputKeywords,
                               Set<String> exploring) {
}
