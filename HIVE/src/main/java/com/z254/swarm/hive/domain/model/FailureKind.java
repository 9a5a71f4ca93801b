package com.z254.swarm.hive.domain.model;

/**
 * Classification of failures surfaced by the bus and the activation engine.
 */
public enum FailureKind {
    DELIVERY_MISS,
    ACTIVATION_TIMEOUT,
    MALFORMED_OUTPUT,
    TRANSPORT_ERROR,
    CACHE_OVERFLOW,
    REGISTRY_INCONSISTENCY;

    /**
     * Whether this failure belongs to an activation and goes through the retry path.
     */
    public boolean isActivationFailure() {
        return this == ACTIVATION_TIMEOUT || this == MALFORMED_OUTPUT || this == TRANSPORT_ERROR;
    }
}
