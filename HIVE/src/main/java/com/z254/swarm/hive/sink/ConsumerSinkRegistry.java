package com.z254.swarm.hive.sink;

import com.z254.swarm.hive.agent.Agent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of consumer sinks by name.
 */
@Component
@Slf4j
public class ConsumerSinkRegistry {

    public static final String SINK_PARAM = "sink";

    private final Map<String, ConsumerSink> sinks = new HashMap<>();

    public ConsumerSinkRegistry(List<ConsumerSink> sinkList) {
        for (ConsumerSink sink : sinkList) {
            sinks.put(sink.getName(), sink);
            log.info("Registered consumer sink: {}", sink.getName());
        }
    }

    public Optional<ConsumerSink> getSink(String name) {
        return Optional.ofNullable(sinks.get(name));
    }

    /**
     * Sink named by the agent's {@code sink} param, {@code log} when absent.
     *
     * @throws IllegalArgumentException if no sink has that name
     */
    public ConsumerSink resolve(Agent agent) {
        String name = sinkName(agent);
        return getSink(name).orElseThrow(() ->
                new IllegalArgumentException("No consumer sink named '" + name + "' for agent " + agent.getId()));
    }

    public boolean hasSink(String name) {
        return sinks.containsKey(name);
    }

    public Set<String> getSinkNames() {
        return Set.copyOf(sinks.keySet());
    }

    public static String sinkName(Agent agent) {
        return agent.getDefinition().param(SINK_PARAM, LoggingConsumerSink.NAME);
    }
}
