package com.z254.swarm.hive.registry;

import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.agent.AgentKindRegistry;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AgentRegistry}.
 */
class AgentRegistryTest {

    private ConnectionRegistry connectionRegistry;
    private AgentRegistry agentRegistry;

    @BeforeEach
    void setUp() {
        connectionRegistry = new ConnectionRegistry();
        agentRegistry = new AgentRegistry(new AgentKindRegistry(new SwarmProperties()), connectionRegistry);
    }

    private static AgentDefinition definition(String id) {
        return AgentDefinition.builder().id(id).instructions("test").build();
    }

    @Test
    void shouldRegisterAndFindAgent() {
        Agent agent = agentRegistry.register(definition("a"));

        assertThat(agentRegistry.find("a")).containsSame(agent);
        assertThat(agentRegistry.get("a")).isSameAs(agent);
        assertThat(agentRegistry.contains("a")).isTrue();
        assertThat(agentRegistry.size()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateId() {
        agentRegistry.register(definition("a"));

        assertThatThrownBy(() -> agentRegistry.register(definition("a")))
                .isInstanceOf(AgentRegistry.DuplicateAgentException.class);
    }

    @Test
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> agentRegistry.register(definition(" ")))
                .isInstanceOf(AgentRegistry.InvalidAgentIdException.class);
    }

    @Test
    void shouldThrowForUnknownAgent() {
        assertThat(agentRegistry.find("missing")).isEmpty();
        assertThat(agentRegistry.find(null)).isEmpty();
        assertThatThrownBy(() -> agentRegistry.get("missing"))
                .isInstanceOf(AgentRegistry.AgentNotFoundException.class);
    }

    @Test
    void shouldMarkRemovedAgentAndDropItsLinks() {
        // Given
        Agent agent = agentRegistry.register(definition("a"));
        agentRegistry.register(definition("b"));
        connectionRegistry.addConnection("a", "b", "ping");

        // When
        assertThat(agentRegistry.remove("a")).containsSame(agent);

        // Then
        assertThat(agent.isRemoved()).isTrue();
        assertThat(agentRegistry.contains("a")).isFalse();
        assertThat(connectionRegistry.resolve("a", "ping")).isEmpty();
        assertThat(agentRegistry.remove("a")).isEmpty();
    }

    @Test
    void shouldListAgentsOrderedById() {
        agentRegistry.register(definition("c"));
        agentRegistry.register(definition("a"));
        agentRegistry.register(definition("b"));

        assertThat(agentRegistry.list()).extracting(Agent::getId).containsExactly("a", "b", "c");
    }

    @Test
    void shouldCountByState() {
        agentRegistry.register(definition("a"));
        agentRegistry.register(definition("b")).getStateMachine().trigger();

        Map<AgentState, Long> counts = agentRegistry.countByState();

        assertThat(counts).containsEntry(AgentState.IDLE, 1L)
                .containsEntry(AgentState.TRIGGERED, 1L)
                .containsEntry(AgentState.PROCESSING, 0L);
    }
}
