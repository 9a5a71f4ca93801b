package com.z254.swarm.hive.domain.model;

/**
 * Role flags of an agent. A single agent type carries any combination of them.
 */
public enum Capability {

    /**
     * Injects text from an external source into the bus.
     */
    PRODUCE,

    /**
     * Hands received payloads to an external sink.
     */
    CONSUME,

    /**
     * Processes accumulated input through the reasoning collaborator.
     */
    REASON
}
