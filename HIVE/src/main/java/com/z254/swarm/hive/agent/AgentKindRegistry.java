package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.cache.CachePolicy;
import com.z254.swarm.hive.cache.MessageCache;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.HiveException;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.Capability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Factory for creating agents from a registered kind name.
 *
 * <p>Built-in kinds:
 * <ul>
 *   <li>{@code reasoning} - REASON and PRODUCE, runs the reasoning collaborator</li>
 *   <li>{@code consumer} - CONSUME, hands payloads to a consumer sink</li>
 *   <li>{@code producer} - PRODUCE only, never activates</li>
 * </ul>
 * Capabilities given in the definition override the kind's defaults.
 * Cache settings may be overridden per agent with the {@code cache.capacity},
 * {@code cache.dedup} and {@code cache.dedup-keywords} params.
 */
@Component
@Slf4j
public class AgentKindRegistry {

    public static final String REASONING = "reasoning";
    public static final String CONSUMER = "consumer";
    public static final String PRODUCER = "producer";

    static final String PARAM_CACHE_CAPACITY = "cache.capacity";
    static final String PARAM_CACHE_DEDUP = "cache.dedup";
    static final String PARAM_CACHE_DEDUP_KEYWORDS = "cache.dedup-keywords";

    private final Map<String, AgentKind> kinds = new ConcurrentHashMap<>();
    private final CachePolicy defaultCachePolicy;

    public AgentKindRegistry(SwarmProperties properties) {
        this.defaultCachePolicy = CachePolicy.from(properties.getCache());
        register(REASONING, withDefaults(EnumSet.of(Capability.REASON, Capability.PRODUCE)));
        register(CONSUMER, withDefaults(EnumSet.of(Capability.CONSUME)));
        register(PRODUCER, withDefaults(EnumSet.of(Capability.PRODUCE)));
    }

    /**
     * Register (or replace) a kind.
     */
    public void register(String kindName, AgentKind kind) {
        kinds.put(normalize(kindName), kind);
        log.info("Registered agent kind: {}", normalize(kindName));
    }

    /**
     * Build an agent for a definition.
     *
     * @throws UnknownAgentKindException if the kind is not registered
     */
    public Agent create(AgentDefinition definition) {
        AgentKind kind = kinds.get(normalize(definition.getKind()));
        if (kind == null) {
            throw new UnknownAgentKindException(definition.getKind());
        }
        return kind.create(definition, cachePolicyFor(definition));
    }

    public boolean hasKind(String kindName) {
        return kinds.containsKey(normalize(kindName));
    }

    public Set<String> getRegisteredKinds() {
        return Set.copyOf(kinds.keySet());
    }

    /**
     * Cache policy for a definition: configured defaults, overridden by the agent's params.
     */
    public CachePolicy cachePolicyFor(AgentDefinition definition) {
        CachePolicy.CachePolicyBuilder policy = CachePolicy.builder()
                .capacity(defaultCachePolicy.getCapacity())
                .dedupEnabled(defaultCachePolicy.isDedupEnabled())
                .dedupKeywords(defaultCachePolicy.getDedupKeywords());

        String capacity = definition.param(PARAM_CACHE_CAPACITY, null);
        if (capacity != null) {
            try {
                policy.capacity(Math.max(1, Integer.parseInt(capacity.trim())));
            } catch (NumberFormatException e) {
                throw new InvalidAgentDefinitionException(
                        "Invalid " + PARAM_CACHE_CAPACITY + " for agent " + definition.getId() + ": " + capacity);
            }
        }
        String dedup = definition.param(PARAM_CACHE_DEDUP, null);
        if (dedup != null) {
            policy.dedupEnabled(Boolean.parseBoolean(dedup.trim()));
        }
        String dedupKeywords = definition.param(PARAM_CACHE_DEDUP_KEYWORDS, null);
        if (dedupKeywords != null) {
            Set<String> keywords = new HashSet<>();
            Arrays.stream(dedupKeywords.split(","))
                    .map(String::trim)
                    .filter(keyword -> !keyword.isEmpty())
                    .forEach(keywords::add);
            policy.dedupKeywords(Set.copyOf(keywords));
        }
        return policy.build();
    }

    private static AgentKind withDefaults(Set<Capability> defaults) {
        return (definition, cachePolicy) -> {
            Set<Capability> capabilities = definition.getCapabilities() == null
                    || definition.getCapabilities().isEmpty() ? defaults : definition.getCapabilities();
            return new Agent(definition, capabilities, new MessageCache(definition.getId(), cachePolicy));
        };
    }

    private static String normalize(String kindName) {
        return kindName == null ? REASONING : kindName.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Thrown when a definition names a kind nobody registered.
     */
    public static class UnknownAgentKindException extends HiveException {
        public UnknownAgentKindException(String kind) {
            super("Unknown agent kind: " + kind);
        }
    }

    /**
     * Thrown when a definition carries unusable values.
     */
    public static class InvalidAgentDefinitionException extends HiveException {
        public InvalidAgentDefinitionException(String message) {
            super(message);
        }
    }
}
