package com.z254.swarm.hive.config;

import com.z254.swarm.hive.domain.model.AgentDefinition;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the HIVE service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "swarm")
public class SwarmProperties {

    private SchedulerProperties scheduler = new SchedulerProperties();
    private ActivationProperties activation = new ActivationProperties();
    private CacheProperties cache = new CacheProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private CheckpointProperties checkpoint = new CheckpointProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private SinkProperties sink = new SinkProperties();

    /**
     * Agents created at startup.
     */
    private List<AgentDefinition> agents = new ArrayList<>();

    /**
     * Connections wired at startup, after all agents exist.
     */
    private List<ConnectionProperties> connections = new ArrayList<>();

    /**
     * Explore registrations made at startup.
     */
    private List<ExploreProperties> explore = new ArrayList<>();

    @Data
    public static class SchedulerProperties {
        private int workers = 4;
        private int queueCapacity = 10_000;
    }

    @Data
    public static class ActivationProperties {
        private Duration timeout = Duration.ofSeconds(60);
        private int maxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(500);
        private Duration frequencyWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheProperties {
        private int capacity = 256;
        private boolean dedupEnabled = false;
        private Set<String> dedupKeywords = new HashSet<>();
    }

    @Data
    public static class PersistenceProperties {
        private boolean enabled = true;
        private boolean syncOnActivation = true;
        private boolean restoreOnCreate = true;
        private String store = "memory"; // memory, file, redis
        private String directory = "data/agents";
        private String redisKeyPrefix = "swarm:agent:";
    }

    @Data
    public static class CheckpointProperties {
        private String directory = "checkpoints";
    }

    @Data
    public static class ReasoningProperties {
        private OpenAIProperties openai = new OpenAIProperties();

        @Data
        public static class OpenAIProperties {
            private boolean enabled = true;
            private String apiKey;
            private String baseUrl = "https://api.openai.com/v1";
            private String model = "gpt-3.5-turbo";
            private int maxTokens = 1024;
            private double temperature = 0.7;
        }
    }

    @Data
    public static class SinkProperties {
        private String directory = "logs/sinks";
    }

    @Data
    public static class ConnectionProperties {
        private String source;
        private String destination;
        private String keyword;
    }

    @Data
    public static class ExploreProperties {
        private String agent;
        private String keyword;
    }
}
