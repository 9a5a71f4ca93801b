package com.z254.swarm.hive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * HIVE - asynchronous agent message bus and activation engine of SWARM.
 *
 * <p>HIVE provides:
 * <ul>
 *   <li>Connection Registry - keyword-tagged routing links, changed at runtime by agents themselves</li>
 *   <li>Message Caches - per-agent ordered inbound caches with used flags, dedup and eviction</li>
 *   <li>Activation Engine - bounded worker pool running reasoning calls for triggered agents</li>
 *   <li>Persistence - per-agent snapshots (memory, file, Redis) and whole-system checkpoints</li>
 *   <li>Admin API - agents, connections, producer messages, checkpoints</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class HiveApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiveApplication.class, args);
    }
}
