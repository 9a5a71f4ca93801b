package com.z254.swarm.hive.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.agent.ActivationEngine;
import com.z254.swarm.hive.agent.Agent;
import com.z254.swarm.hive.agent.AgentService;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.HiveException;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import com.z254.swarm.hive.domain.model.Capability;
import com.z254.swarm.hive.domain.model.Checkpoint;
import com.z254.swarm.hive.observability.HiveEventLogger;
import com.z254.swarm.hive.registry.AgentRegistry;
import com.z254.swarm.hive.registry.ConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Saves and restores whole-system checkpoints as JSON files under
 * {@code swarm.checkpoint.directory}.
 *
 * <p>A checkpoint holds a snapshot of every reasoning agent (agents without the REASON
 * capability are stateless from the system's point of view and skipped) plus the explore
 * registrations. Loading creates missing agents from their stored definitions, then restores
 * every snapshot and re-triggers agents left with unused input.
 */
@Service
@Slf4j
public class CheckpointService {

    private static final String SUFFIX = ".json";
    private static final Pattern VALID_NAME = Pattern.compile("[\\w.-]+");
    private static final DateTimeFormatter NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneId.systemDefault());

    private final Path directory;
    private final AgentRegistry agentRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final AgentService agentService;
    private final ActivationEngine activationEngine;
    private final AgentPersistenceAdapter persistenceAdapter;
    private final HiveEventLogger eventLogger;
    private final ObjectMapper objectMapper;

    @Autowired
    public CheckpointService(SwarmProperties properties,
                             AgentRegistry agentRegistry,
                             ConnectionRegistry connectionRegistry,
                             AgentService agentService,
                             ActivationEngine activationEngine,
                             AgentPersistenceAdapter persistenceAdapter,
                             HiveEventLogger eventLogger,
                             ObjectMapper objectMapper) {
        this(Paths.get(properties.getCheckpoint().getDirectory()), agentRegistry, connectionRegistry,
                agentService, activationEngine, persistenceAdapter, eventLogger, objectMapper);
    }

    public CheckpointService(Path directory,
                             AgentRegistry agentRegistry,
                             ConnectionRegistry connectionRegistry,
                             AgentService agentService,
                             ActivationEngine activationEngine,
                             AgentPersistenceAdapter persistenceAdapter,
                             HiveEventLogger eventLogger,
                             ObjectMapper objectMapper) {
        this.directory = directory;
        this.agentRegistry = agentRegistry;
        this.connectionRegistry = connectionRegistry;
        this.agentService = agentService;
        this.activationEngine = activationEngine;
        this.persistenceAdapter = persistenceAdapter;
        this.eventLogger = eventLogger;
        this.objectMapper = objectMapper;
    }

    /**
     * Write a checkpoint of the live system.
     *
     * @param name checkpoint name, or null for a timestamped one
     */
    public Mono<Checkpoint.Info> save(String name) {
        return Mono.fromCallable(() -> {
            Instant now = Instant.now();
            String checkpointName = name == null || name.isBlank() ? "checkpoint_" + NAME_FORMAT.format(now) : name;
            Path file = fileFor(checkpointName);

            List<Agent> agents = agentRegistry.list();
            List<AgentSnapshot> snapshots = new ArrayList<>();
            for (Agent agent : agents) {
                if (agent.can(Capability.REASON) && !agent.isRemoved()) {
                    snapshots.add(persistenceAdapter.snapshot(agent.getId()));
                }
            }
            Checkpoint checkpoint = Checkpoint.builder()
                    .metadata(Checkpoint.Info.builder()
                            .name(checkpointName)
                            .createdAt(now)
                            .totalAgents(agents.size())
                            .savedAgents(snapshots.size())
                            .build())
                    .agents(snapshots)
                    .build();
            checkpoint.getExplorations().putAll(connectionRegistry.explorations());

            try {
                Files.createDirectories(directory);
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), checkpoint);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write checkpoint " + file, e);
            }
            log.info("Saved checkpoint {} with {} of {} agents", checkpointName, snapshots.size(), agents.size());
            eventLogger.logCheckpoint("save", checkpointName, snapshots.size());
            return checkpoint.getMetadata();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Restore a checkpoint into the live system.
     *
     * @return metadata of the loaded checkpoint
     */
    public Mono<Checkpoint.Info> load(String name) {
        return read(name).flatMap(checkpoint -> Flux.fromIterable(checkpoint.getAgents())
                .concatMap(snapshot -> ensureAgent(snapshot).thenReturn(snapshot))
                .doOnNext(snapshot -> persistenceAdapter.restore(snapshot.getAgentId(), snapshot))
                .then(Mono.fromRunnable(() -> {
                    checkpoint.getExplorations().forEach((keyword, agentIds) ->
                            agentIds.forEach(agentId -> connectionRegistry.explore(agentId, keyword)));
                    checkpoint.getAgents().forEach(snapshot -> activationEngine.trigger(snapshot.getAgentId()));
                    log.info("Loaded checkpoint {} ({} agents)", name, checkpoint.getAgents().size());
                    eventLogger.logCheckpoint("load", name, checkpoint.getAgents().size());
                }))
                .thenReturn(checkpoint.getMetadata()));
    }

    /**
     * Metadata of every checkpoint, newest first.
     */
    public Flux<Checkpoint.Info> list() {
        return Mono.fromCallable(() -> {
                    if (!Files.isDirectory(directory)) {
                        return List.<Path>of();
                    }
                    try (Stream<Path> files = Files.list(directory)) {
                        return files.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).toList();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .flatMap(path -> readFile(path).map(Checkpoint::getMetadata)
                        .onErrorResume(e -> {
                            log.warn("Skipping unreadable checkpoint {}: {}", path, e.getMessage());
                            return Mono.empty();
                        }))
                .sort(Comparator.comparing(Checkpoint.Info::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())));
    }

    public Mono<Checkpoint.Info> latest() {
        return list().next();
    }

    /**
     * @return true if the checkpoint existed
     */
    public Mono<Boolean> delete(String name) {
        return Mono.fromCallable(() -> {
            boolean deleted = Files.deleteIfExists(fileFor(name));
            if (deleted) {
                eventLogger.logCheckpoint("delete", name, 0);
            }
            return deleted;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Checkpoint> read(String name) {
        return Mono.fromCallable(() -> fileFor(name))
                .flatMap(file -> Files.exists(file)
                        ? readFile(file)
                        : Mono.error(new CheckpointNotFoundException(name)));
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Mono<Void> ensureAgent(AgentSnapshot snapshot) {
        if (agentRegistry.contains(snapshot.getAgentId())) {
            return Mono.empty();
        }
        if (snapshot.getDefinition() == null) {
            return Mono.error(new IllegalStateException("Checkpoint snapshot of " + snapshot.getAgentId()
                    + " has no definition"));
        }
        return agentService.createAgent(snapshot.getDefinition()).then();
    }

    private Mono<Checkpoint> readFile(Path file) {
        return Mono.fromCallable(() -> objectMapper.readValue(file.toFile(), Checkpoint.class))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Path fileFor(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new InvalidCheckpointNameException(name);
        }
        return directory.resolve(name + SUFFIX);
    }

    public static class CheckpointNotFoundException extends HiveException {
        public CheckpointNotFoundException(String name) {
            super("Checkpoint not found: " + name);
        }
    }

    public static class InvalidCheckpointNameException extends HiveException {
        public InvalidCheckpointNameException(String name) {
            super("Invalid checkpoint name: " + name);
        }
    }
}
