package com.z254.swarm.hive.persistence;

import com.z254.swarm.hive.HiveTestHarness;
import com.z254.swarm.hive.ScriptedReasoningCollaborator;
import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import com.z254.swarm.hive.domain.model.CachedMessage;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AgentPersistenceAdapter}.
 */
class AgentPersistenceAdapterTest {

    private HiveTestHarness harness;
    private AgentPersistenceAdapter adapter;

    @BeforeEach
    void setUp() {
        harness = HiveTestHarness.builder(ScriptedReasoningCollaborator.silent()).stopped().build();
        adapter = harness.persistenceAdapter;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private Agent agent(String id) {
        return harness.agentRegistry.register(AgentDefinition.builder().id(id).instructions("echo").build());
    }

    @Test
    void shouldCaptureConnectionsCacheAndSelfState() {
        // Given
        Agent b = agent("b");
        agent("a");
        agent("c");
        harness.connectionRegistry.addConnection("b", "c", "pong");
        harness.connectionRegistry.addConnection("a", "b", "ping");
        b.setSelfState("thinking");
        b.getCache().append("a", "ping", "hello");

        // When
        AgentSnapshot snapshot = adapter.snapshot("b");

        // Then
        assertThat(snapshot.getAgentId()).isEqualTo("b");
        assertThat(snapshot.getSelfState()).isEqualTo("thinking");
        assertThat(snapshot.getOutputConnections()).containsEntry("pong", List.of("c"));
        assertThat(snapshot.getInputConnections().get("a")).containsExactly("ping");
        assertThat(snapshot.getCacheEntries()).extracting(CachedMessage::payload).containsExactly("hello");
        assertThat(snapshot.getNextSequence()).isEqualTo(2);
        assertThat(snapshot.getDefinition().getInstructions()).isEqualTo("echo");
    }

    @Test
    void shouldFailToSnapshotUnknownAgent() {
        assertThatThrownBy(() -> adapter.snapshot("ghost"))
                .isInstanceOf(AgentRegistry.AgentNotFoundException.class);
    }

    @Test
    void shouldRestoreAfterRemoveAndRecreate() {
        // Given
        Agent b = agent("b");
        agent("c");
        harness.connectionRegistry.addConnection("b", "c", "pong");
        b.setSelfState("remembered");
        b.getCache().append("a", "ping", "pending");
        adapter.sync("b").block();
        harness.agentRegistry.remove("b");

        // When
        Agent recreated = agent("b");
        boolean unused = adapter.restore("b", adapter.storedForCreate("b").block());

        // Then
        assertThat(unused).isTrue();
        assertThat(recreated.getSelfState()).isEqualTo("remembered");
        assertThat(recreated.getCache().drainUnused()).extracting(CachedMessage::payload).containsExactly("pending");
        assertThat(harness.connectionRegistry.resolve("b", "pong")).containsExactly("c");
        assertThat(recreated.getCache().append("a", "ping", "next").appended().sequence()).isEqualTo(2);
    }

    @Test
    void shouldReportNothingToRestoreForNewAgent() {
        agent("fresh");

        StepVerifier.create(adapter.storedForCreate("fresh"))
                .verifyComplete();
    }

    @Test
    void shouldRestoreStateIntoAgentThatIsNotRegistered() {
        // Given
        Agent b = agent("b");
        b.setSelfState("remembered");
        b.getCache().append("a", "ping", "pending");
        AgentSnapshot snapshot = adapter.snapshot("b");
        harness.agentRegistry.remove("b");
        Agent unregistered = harness.agentRegistry.build(AgentDefinition.builder().id("b").build());

        // When
        adapter.restoreState(unregistered, snapshot);

        // Then
        assertThat(harness.agentRegistry.contains("b")).isFalse();
        assertThat(unregistered.getSelfState()).isEqualTo("remembered");
        assertThat(unregistered.getCache().drainUnused()).extracting(CachedMessage::payload)
                .containsExactly("pending");
    }

    @Test
    void shouldForgetStoredState() {
        agent("b");
        adapter.sync("b").block();

        StepVerifier.create(adapter.forget("b")).expectNext(true).verifyComplete();
        StepVerifier.create(adapter.loadStored("b")).verifyComplete();
    }

    @Nested
    @DisplayName("with persistence switched off")
    class Disabled {

        private AgentPersistenceAdapter disabledAdapter;
        private InMemoryAgentStateStore store;

        @BeforeEach
        void setUp() {
            SwarmProperties.PersistenceProperties config = new SwarmProperties.PersistenceProperties();
            config.setEnabled(false);
            store = new InMemoryAgentStateStore();
            disabledAdapter = new AgentPersistenceAdapter(harness.agentRegistry, harness.connectionRegistry,
                    store, config);
        }

        @Test
        void shouldNotWriteAnything() {
            agent("b");

            disabledAdapter.sync("b").block();
            disabledAdapter.syncAfterActivation("b").block();

            StepVerifier.create(store.listAgentIds()).verifyComplete();
            assertThat(disabledAdapter.isSyncOnActivation()).isFalse();
            assertThat(disabledAdapter.isRestoreOnCreate()).isFalse();
        }

        @Test
        void shouldNotRestore() {
            agent("b");
            store.save(AgentSnapshot.builder().agentId("b").selfState("old").build()).block();

            StepVerifier.create(disabledAdapter.storedForCreate("b")).verifyComplete();
        }
    }

    @Test
    void shouldOnlySyncAfterActivationWhenConfigured() {
        SwarmProperties.PersistenceProperties config = new SwarmProperties.PersistenceProperties();
        config.setSyncOnActivation(false);
        InMemoryAgentStateStore store = new InMemoryAgentStateStore();
        AgentPersistenceAdapter manualAdapter = new AgentPersistenceAdapter(harness.agentRegistry,
                new ConnectionRegistry(), store, config);
        agent("b");

        manualAdapter.syncAfterActivation("b").block();
        StepVerifier.create(store.load("b")).verifyComplete();

        manualAdapter.sync("b").block();
        StepVerifier.create(store.load("b")).expectNextCount(1).verifyComplete();
    }
}
