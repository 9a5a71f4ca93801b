package com.z254.swarm.hive.agent;

import com.z254.swarm.hive.domain.model.AgentState;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Activation lifecycle of one agent: IDLE -> TRIGGERED -> PROCESSING -> IDLE, terminal REMOVED.
 *
 * <p>Transitions are compare-and-set, so at most one caller wins the right to schedule the agent
 * and at most one activation is PROCESSING at a time. Triggers that arrive while the agent is
 * TRIGGERED collapse; triggers that arrive while it is PROCESSING set a re-evaluation flag that
 * {@link #finishProcessing()} honours.
 */
public class AgentStateMachine {

    private final AtomicReference<AgentState> state = new AtomicReference<>(AgentState.IDLE);
    private final AtomicBoolean reevaluate = new AtomicBoolean(false);
    private final AtomicInteger attempts = new AtomicInteger(0);

    public AgentState getState() {
        return state.get();
    }

    /**
     * Signal that input worth processing arrived.
     *
     * @return true if the caller must schedule the agent (IDLE -> TRIGGERED happened)
     */
    public boolean trigger() {
        while (true) {
            AgentState current = state.get();
            switch (current) {
                case IDLE:
                    if (state.compareAndSet(AgentState.IDLE, AgentState.TRIGGERED)) {
                        return true;
                    }
                    break;
                case PROCESSING:
                    reevaluate.set(true);
                    if (state.get() == AgentState.PROCESSING) {
                        return false;
                    }
                    // processing finished in between; take the IDLE path
                    break;
                default:
                    return false;
            }
        }
    }

    /**
     * TRIGGERED -> PROCESSING.
     *
     * @return false if the agent was not TRIGGERED (removed, or already taken by another worker)
     */
    public boolean beginProcessing() {
        return state.compareAndSet(AgentState.TRIGGERED, AgentState.PROCESSING);
    }

    /**
     * PROCESSING -> IDLE, or straight back to TRIGGERED when triggers arrived meanwhile.
     *
     * @return true if the agent is TRIGGERED again and must be rescheduled
     */
    public boolean finishProcessing() {
        if (!state.compareAndSet(AgentState.PROCESSING, AgentState.IDLE)) {
            return false;
        }
        if (reevaluate.getAndSet(false)) {
            return state.compareAndSet(AgentState.IDLE, AgentState.TRIGGERED);
        }
        return false;
    }

    /**
     * PROCESSING -> TRIGGERED after a failed activation; pending triggers fold into the retry.
     *
     * @return true if the agent must be rescheduled
     */
    public boolean failProcessing() {
        reevaluate.set(false);
        return state.compareAndSet(AgentState.PROCESSING, AgentState.TRIGGERED);
    }

    /**
     * Any state -> REMOVED.
     */
    public void remove() {
        state.set(AgentState.REMOVED);
    }

    public boolean isRemoved() {
        return state.get() == AgentState.REMOVED;
    }

    /**
     * Count one more attempt at the current input.
     *
     * @return the 1-based attempt number
     */
    public int nextAttempt() {
        return attempts.incrementAndGet();
    }

    public int getAttempts() {
        return attempts.get();
    }

    public void resetAttempts() {
        attempts.set(0);
    }
}
