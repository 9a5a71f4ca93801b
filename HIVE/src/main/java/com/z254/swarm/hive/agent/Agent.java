package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.cache.MessageCache;
import com.z254.swarm.hive.domain.model.AgentDefinition;
import com.z254.swarm.hive.domain.model.AgentState;
import com.z254.swarm.hive.domain.model.Capability;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An addressable processing unit: a definition, a message cache and an activation state machine.
 *
 * <p>There is one agent type. What an agent does on activation follows from its capabilities:
 * {@link Capability#REASON} agents call the reasoning collaborator, {@link Capability#CONSUME}
 * agents hand payloads to a sink, pure {@link Capability#PRODUCE} agents never activate.
 * Agents are owned by the {@code AgentRegistry}; connections live in the {@code ConnectionRegistry}.
 */
public class Agent {

    private final String id;
    private final AgentDefinition definition;
    private final Set<Capability> capabilities;
    private final MessageCache cache;
    private final AgentStateMachine stateMachine = new AgentStateMachine();
    private final Instant createdAt = Instant.now();

    private volatile String selfState = "";

    public Agent(AgentDefinition definition, Set<Capability> capabilities, MessageCache cache) {
        this.id = definition.getId();
        this.definition = definition;
        this.capabilities = capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        this.cache = cache;
    }

    public String getId() {
        return id;
    }

    public AgentDefinition getDefinition() {
        return definition;
    }

    public String getKind() {
        return definition.getKind();
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Whether deliveries can ever start an activation for this agent.
     */
    public boolean isActivatable() {
        return can(Capability.REASON) || can(Capability.CONSUME);
    }

    /**
     * Whether a delivery under {@code keyword} should trigger this agent.
     */
    public boolean triggersOn(String keyword) {
        return isActivatable() && definition.activatesOn(keyword);
    }

    public MessageCache getCache() {
        return cache;
    }

    public AgentStateMachine getStateMachine() {
        return stateMachine;
    }

    public AgentState getState() {
        return stateMachine.getState();
    }

    public boolean isRemoved() {
        return stateMachine.isRemoved();
    }

    public String getSelfState() {
        return selfState;
    }

    public void setSelfState(String selfState) {
        this.selfState = selfState != null ? selfState : "";
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Agent{" + id + ", kind=" + definition.getKind() + ", state=" + getState() + "}";
    }
}
