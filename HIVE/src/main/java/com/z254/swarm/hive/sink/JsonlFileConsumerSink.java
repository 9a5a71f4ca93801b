package com.z254.swarm.hive.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.swarm.hive.config.SwarmProperties;
import com.z254.swarm.hive.domain.model.CachedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends consumed payloads as JSON lines to {@code <directory>/<agentId>.jsonl}.
 */
@Component
@Slf4j
public class JsonlFileConsumerSink implements ConsumerSink {

    public static final String NAME = "file";

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public JsonlFileConsumerSink(SwarmProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getSink().getDirectory()), objectMapper);
    }

    public JsonlFileConsumerSink(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void accept(String agentId, CachedMessage message) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", Instant.now().toString());
        line.put("agentId", agentId);
        line.put("sequence", message.sequence());
        line.put("senderId", message.senderId());
        line.put("keyword", message.keyword());
        line.put("payload", message.payload());

        Path file = fileFor(agentId);
        try {
            Files.createDirectories(directory);
            String json = objectMapper.writeValueAsString(line) + System.lineSeparator();
            Files.writeString(file, json, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
        log.debug("Appended message {} of {} to {}", message.sequence(), agentId, file);
    }

    public Path fileFor(String agentId) {
        return directory.resolve(agentId + ".jsonl");
    }
}
