package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.cache.CachePolicy;
import com.z254.swarm.hive.domain.model.AgentDefinition;

/**
 * Constructor function registered under a kind name in the {@link AgentKindRegistry}.
 */
@FunctionalInterface
public interface AgentKind {

    Agent create(AgentDefinition definition, CachePolicy cachePolicy);
}
