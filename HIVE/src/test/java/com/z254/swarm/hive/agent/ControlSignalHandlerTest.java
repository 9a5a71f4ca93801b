package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.HiveTestHarness;
import com.z254.swarm.hive.ScriptedReasoningCollaborator;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentState;
import com.z254.swarm.hive.domain.model.CachedMessage;
import com.z254.swarm.hive.domain.model.ControlSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ControlSignalHandler}. The engine stays stopped; only registry effects
 * and deliveries are checked.
 */
class ControlSignalHandlerTest {

    private HiveTestHarness harness;
    private ControlSignalHandler handler;
    private Agent b;

    @BeforeEach
    void setUp() {
        harness = HiveTestHarness.builder(ScriptedReasoningCollaborator.silent()).stopped().build();
        handler = harness.signalHandler;
        harness.agentRegistry.register(AgentDefinition.builder().id("a").build());
        b = harness.agentRegistry.register(AgentDefinition.builder()
                .id("b")
                .activationKeywords(Set.of("ping"))
                .build());
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private void apply(ControlSignal.Type type, String keyword, String agentId) {
        handler.apply(b, new ControlSignal(type, keyword, agentId));
    }

    @Test
    void shouldConnectOutputToKnownAgent() {
        apply(ControlSignal.Type.CONNECT, "pong", "a");

        assertThat(harness.connectionRegistry.resolve("b", "pong")).containsExactly("a");
    }

    @Test
    void shouldIgnoreConnectToUnknownAgent() {
        apply(ControlSignal.Type.CONNECT, "pong", "ghost");

        assertThat(harness.connectionRegistry.resolve("b", "pong")).isEmpty();
    }

    @Test
    void shouldDisconnect() {
        harness.connectionRegistry.addConnection("b", "a", "pong");

        apply(ControlSignal.Type.DISCONNECT, "pong", "a");

        assertThat(harness.connectionRegistry.resolve("b", "pong")).isEmpty();
    }

    @Test
    void shouldAcceptAndRejectInput() {
        apply(ControlSignal.Type.ACCEPT_INPUT, "query", "a");
        assertThat(harness.connectionRegistry.resolve("a", "query")).containsExactly("b");

        apply(ControlSignal.Type.REJECT_INPUT, "query", null);
        assertThat(harness.connectionRegistry.resolve("a", "query")).isEmpty();
    }

    @Test
    void shouldRegisterAndWithdrawExploration() {
        apply(ControlSignal.Type.EXPLORE, "weather", null);
        assertThat(harness.connectionRegistry.seek("a", "weather")).containsExactly("b");

        apply(ControlSignal.Type.STOP_EXPLORE, null, null);
        assertThat(harness.connectionRegistry.seek("a", "weather")).isEmpty();
    }

    @Test
    void shouldDeliverSeekResultAndTriggerSeeker() {
        // Given
        harness.connectionRegistry.explore("a", "weather");

        // When
        apply(ControlSignal.Type.SEEK, "weather", null);

        // Then
        assertThat(b.getCache().drainUnused()).singleElement().satisfies(message -> {
            assertThat(message.senderId()).isEqualTo(ControlSignalHandler.REGISTRY_SENDER);
            assertThat(message.keyword()).isEqualTo(ControlSignalHandler.SEEK_RESULT_KEYWORD);
            assertThat(message.payload()).isEqualTo("{\"keyword\":\"weather\",\"candidates\":[\"a\"]}");
        });
        assertThat(b.getState()).isEqualTo(AgentState.TRIGGERED);
        // seeking never wires anything by itself
        assertThat(harness.connectionRegistry.outputsOf("b")).isEmpty();
    }

    @Test
    void shouldAnswerSeekWithNoCandidates() {
        apply(ControlSignal.Type.SEEK, "weather", null);

        assertThat(b.getCache().drainUnused()).extracting(CachedMessage::payload)
                .containsExactly("{\"keyword\":\"weather\",\"candidates\":[]}");
    }
}
