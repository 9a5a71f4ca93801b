package com.z254.swarm.hive.domain.model;

/**
 * Lifecycle states of an agent's activation state machine.
 */
public enum AgentState {
    IDLE,
    TRIGGERED,
    PROCESSING,
    REMOVED;

    public boolean isTerminal() {
        return this == REMOVED;
    }
}
