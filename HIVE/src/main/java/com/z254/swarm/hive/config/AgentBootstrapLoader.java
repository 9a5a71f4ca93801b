package com.z254.swarm.hive.config;

import com.z254.swarm.hive.agent.AgentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Creates the agents, connections and explore registrations listed under {@code swarm.*}
 * once the application has started.
 */
@Component
@Slf4j
public class AgentBootstrapLoader implements ApplicationRunner {

    private static final Duration STARTUP_TIMEOUT = Duration.ofSeconds(30);

    private final SwarmProperties properties;
    private final AgentService agentService;

    public AgentBootstrapLoader(SwarmProperties properties, AgentService agentService) {
        this.properties = properties;
        this.agentService = agentService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getAgents().isEmpty()) {
            log.info("No bootstrap agents configured");
            return;
        }

        Long created = Flux.fromIterable(properties.getAgents())
                .concatMap(agentService::createAgent)
                .count()
                .block(STARTUP_TIMEOUT);

        int connections = 0;
        for (SwarmProperties.ConnectionProperties connection : properties.getConnections()) {
            if (agentService.connect(connection.getSource(), connection.getDestination(), connection.getKeyword())) {
                connections++;
            }
        }
        for (SwarmProperties.ExploreProperties explore : properties.getExplore()) {
            agentService.explore(explore.getAgent(), explore.getKeyword());
        }
        log.info("Bootstrap complete: {} agents, {} connections, {} explore registrations",
                created, connections, properties.getExplore().size());
    }
}
