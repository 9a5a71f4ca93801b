package com.z254.swarm.hive.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.AgentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * Snapshot store keeping one JSON file per agent under {@code swarm.persistence.directory}.
 * Each write goes to its own temporary file first and is moved into place, so concurrent
 * saves of one agent never interleave inside a file.
 */
@Component
@ConditionalOnProperty(prefix = "swarm.persistence", name = "store", havingValue = "file")
@Slf4j
public class FileAgentStateStore implements AgentStateStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileAgentStateStore(SwarmProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getPersistence().getDirectory()), objectMapper);
    }

    public FileAgentStateStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> save(AgentSnapshot snapshot) {
        return Mono.<Void>fromRunnable(() -> {
            Path target = fileFor(snapshot.getAgentId());
            Path temp = null;
            try {
                Files.createDirectories(directory);
                temp = Files.createTempFile(directory, target.getFileName() + ".", ".tmp");
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new UncheckedIOException("Failed to save snapshot of " + snapshot.getAgentId(), e);
            }
            log.debug("Saved snapshot of {} to {}", snapshot.getAgentId(), target);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<AgentSnapshot> load(String agentId) {
        return Mono.fromCallable(() -> {
            Path file = fileFor(agentId);
            if (!Files.exists(file)) {
                return null;
            }
            try {
                return objectMapper.readValue(file.toFile(), AgentSnapshot.class);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read snapshot " + file, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Boolean> delete(String agentId) {
        return Mono.fromCallable(() -> {
            try {
                return Files.deleteIfExists(fileFor(agentId));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete snapshot of " + agentId, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Flux<String> listAgentIds() {
        return Mono.fromCallable(() -> {
            if (!Files.isDirectory(directory)) {
                return List.<String>of();
            }
            try (Stream<Path> files = Files.list(directory)) {
                return files.map(path -> path.getFileName().toString())
                        .filter(name -> name.endsWith(SUFFIX))
                        .map(name -> URLDecoder.decode(name.substring(0, name.length() - SUFFIX.length()),
                                StandardCharsets.UTF_8))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + directory, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).flatMapMany(Flux::fromIterable);
    }

    @Override
    public String getType() {
        return "file";
    }

    Path fileFor(String agentId) {
        return directory.resolve(URLEncoder.encode(agentId, StandardCharsets.UTF_8) + SUFFIX);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary snapshot file {}: {}", temp, e.getMessage());
        }
    }
}
