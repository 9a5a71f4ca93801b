package com.z254.swarm.hive.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.HiveTestHarness;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RedisAgentStateStore}.
 */
@ExtendWith(MockitoExtension.class)
class RedisAgentStateStoreTest {

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = HiveTestHarness.objectMapper();
    private RedisAgentStateStore store;

    @BeforeEach
    void setUp() {
        SwarmProperties properties = new SwarmProperties();
        properties.getPersistence().setRedisKeyPrefix("test:agent:");
        store = new RedisAgentStateStore(redisTemplate, objectMapper, properties);
    }

    private AgentSnapshot snapshot() {
        return AgentSnapshot.builder()
                .agentId("b")
                .selfState("waiting")
                .outputConnections(Map.of("answer", List.of("out")))
                .nextSequence(4)
                .build();
    }

    @Test
    void shouldSaveSnapshotAsJsonUnderPrefixedKey() throws Exception {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.set(eq("test:agent:b"), any())).thenReturn(Mono.just(true));

        // When
        StepVerifier.create(store.save(snapshot())).verifyComplete();

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("test:agent:b"), json.capture());
        AgentSnapshot written = objectMapper.readValue(json.getValue(), AgentSnapshot.class);
        assertThat(written.getSelfState()).isEqualTo("waiting");
        assertThat(written.getOutputConnections()).containsEntry("answer", List.of("out"));
    }

    @Test
    void shouldLoadStoredSnapshot() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("test:agent:b"))
                .thenReturn(Mono.just(objectMapper.writeValueAsString(snapshot())));

        StepVerifier.create(store.load("b"))
                .assertNext(loaded -> {
                    assertThat(loaded.getAgentId()).isEqualTo("b");
                    assertThat(loaded.getNextSequence()).isEqualTo(4);
                })
                .verifyComplete();
    }

    @Test
    void shouldCompleteEmptyForUnknownAgent() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("test:agent:ghost")).thenReturn(Mono.empty());

        StepVerifier.create(store.load("ghost")).verifyComplete();
    }

    @Test
    void shouldFailOnCorruptSnapshot() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("test:agent:b")).thenReturn(Mono.just("{not json"));

        StepVerifier.create(store.load("b"))
                .expectError(IllegalStateException.class)
                .verify();
    }

    @Test
    void shouldReportWhetherDeleteRemovedAKey() {
        when(redisTemplate.delete("test:agent:b")).thenReturn(Mono.just(1L));
        when(redisTemplate.delete("test:agent:ghost")).thenReturn(Mono.just(0L));

        StepVerifier.create(store.delete("b")).expectNext(true).verifyComplete();
        StepVerifier.create(store.delete("ghost")).expectNext(false).verifyComplete();
    }

    @Test
    void shouldListAgentIdsWithoutPrefix() {
        when(redisTemplate.scan(any(ScanOptions.class)))
                .thenReturn(Flux.just("test:agent:c", "test:agent:a"));

        StepVerifier.create(store.listAgentIds())
                .expectNext("a", "c")
                .verifyComplete();
    }
}
