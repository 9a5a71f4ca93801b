package com.z254.swarm.hive.domain.model;

/**
 * One instruction parsed from reasoning output: publish {@code payload} under {@code keyword},
 * optionally restricted to a single destination.
 */
public record OutputDirective(String keyword, String payload, String destinationHint) {

    public static final String SELF_STATE = "self_state";
    public static final String SIGNAL = "signal";

    public static OutputDirective of(String keyword, String payload) {
        return new OutputDirective(keyword, payload, null);
    }

    public boolean hasDestinationHint() {
        return destinationHint != null && !destinationHint.isBlank();
    }

    public boolean isSelfState() {
        return SELF_STATE.equals(keyword);
    }

    public boolean isSignal() {
        return SIGNAL.equals(keyword);
    }
}
