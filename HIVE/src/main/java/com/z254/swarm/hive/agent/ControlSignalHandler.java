package com.z254.swarm.hive.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.bus.MessageBus;
import com.z254.swarm.hive.domain.model.Connection;
import com.z254.swarm.hive.domain.model.ControlSignal;
import com.z254.swarm.hive.observability.HiveEventLogger;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the control signals an agent emits on the routing graph.
 *
 * <ul>
 *   <li>EXPLORE / STOP_EXPLORE - (un)register the agent as discoverable, optionally per keyword</li>
 *   <li>SEEK - look up explorers; the answer lands in the agent's own cache under
 *       {@value #SEEK_RESULT_KEYWORD} from sender {@value #REGISTRY_SENDER}</li>
 *   <li>CONNECT / DISCONNECT - add or drop an output connection to {@code id}</li>
 *   <li>ACCEPT_INPUT - add an input connection from {@code id}</li>
 *   <li>REJECT_INPUT - drop every input connection tagged {@code keyword}</li>
 * </ul>
 */
@Component
@Slf4j
public class ControlSignalHandler {

    public static final String REGISTRY_SENDER = "registry";
    public static final String SEEK_RESULT_KEYWORD = "seek_result";

    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final MessageBus messageBus;
    private final ActivationQueue activationQueue;
    private final HiveEventLogger eventLogger;
    private final ObjectMapper objectMapper;

    public ControlSignalHandler(AgentRegistry agentRegistry,
                                ConnectionRegistry connectionRegistry,
                                MessageBus messageBus,
                                ActivationQueue activationQueue,
                                HiveEventLogger eventLogger,
                                ObjectMapper objectMapper) {
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.messageBus = messageBus;
        this.activationQueue = activationQueue;
        this.eventLogger = eventLogger;
        this.objectMapper = objectMapper;
    }

    public void apply(Agent agent, ControlSignal signal) {
        String agentId = agent.getId();
        eventLogger.logSignal(agentId, signal.type().name(), signal.keyword(), signal.agentId());

        switch (signal.type()) {
            case EXPLORE -> connectionRegistry.explore(agentId, signal.keyword());
            case STOP_EXPLORE -> connectionRegistry.stopExplore(agentId, signal.keyword());
            case SEEK -> answerSeek(agent, signal.keyword());
            case CONNECT -> {
                if (requireAgent(agentId, signal)) {
                    connectionRegistry.addConnection(agentId, signal.agentId(), signal.keyword());
                }
            }
            case DISCONNECT -> connectionRegistry.removeConnection(agentId, signal.agentId(), signal.keyword());
            case ACCEPT_INPUT -> {
                if (requireAgent(agentId, signal)) {
                    connectionRegistry.addConnection(signal.agentId(), agentId, signal.keyword());
                }
            }
            case REJECT_INPUT -> {
                List<Connection> removed = connectionRegistry.removeInputKeyword(agentId, signal.keyword());
                log.debug("Agent {} rejected input '{}': removed {}", agentId, signal.keyword(), removed);
            }
        }
    }

    private void answerSeek(Agent agent, String keyword) {
        List<String> candidates = connectionRegistry.seek(agent.getId(), keyword);
        Map<String, Object> answer = new LinkedHashMap<>();
        answer.put("keyword", keyword);
        answer.put("candidates", candidates);

        String payload;
        try {
            payload = objectMapper.writeValueAsString(answer);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize seek result", e);
        }
        messageBus.deliver(REGISTRY_SENDER, agent.getId(), SEEK_RESULT_KEYWORD, payload);
        // answers always wake the seeker, whatever its activation keywords
        if (agent.isActivatable() && agent.getStateMachine().trigger()) {
            activationQueue.offer(agent.getId());
        }
    }

    private boolean requireAgent(String agentId, ControlSignal signal) {
        if (agentRegistry.contains(signal.agentId())) {
            return true;
        }
        log.warn("Agent {} sent {} for unknown agent {}, ignored", agentId, signal.type(), signal.agentId());
        return false;
    }
}
