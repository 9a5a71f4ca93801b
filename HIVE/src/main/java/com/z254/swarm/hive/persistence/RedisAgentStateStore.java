package com.z254.swarm.hive.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Snapshot store keeping each agent's snapshot as a JSON string under
 * {@code <swarm.persistence.redis-key-prefix><agentId>}.
 */
@Component
@ConditionalOnProperty(prefix = "swarm.persistence", name = "store", havingValue = "redis")
@Slf4j
public class RedisAgentStateStore implements AgentStateStore {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisAgentStateStore(
            ReactiveRedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            SwarmProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getPersistence().getRedisKeyPrefix();
    }

    @Override
    public Mono<Void> save(AgentSnapshot snapshot) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(snapshot))
                .onErrorMap(JsonProcessingException.class,
                        e -> new IllegalStateException("Failed to serialize snapshot of " + snapshot.getAgentId(), e))
                .flatMap(json -> redisTemplate.opsForValue().set(key(snapshot.getAgentId()), json))
                .doOnSuccess(ok -> log.debug("Saved snapshot of {} to redis", snapshot.getAgentId()))
                .then();
    }

    @Override
    public Mono<AgentSnapshot> load(String agentId) {
        return redisTemplate.opsForValue().get(key(agentId))
                .map(json -> {
                    try {
                        return objectMapper.readValue(json, AgentSnapshot.class);
                    } catch (JsonProcessingException e) {
                        throw new IllegalStateException("Corrupt snapshot of " + agentId, e);
                    }
                });
    }

    @Override
    public Mono<Boolean> delete(String agentId) {
        return redisTemplate.delete(key(agentId)).map(count -> count > 0);
    }

    @Override
    public Flux<String> listAgentIds() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(keyPrefix + "*").build())
                .map(key -> key.substring(keyPrefix.length()))
                .sort();
    }

    @Override
    public String getType() {
        return "redis";
    }

    private String key(String agentId) {
        return keyPrefix + agentId;
    }
}
