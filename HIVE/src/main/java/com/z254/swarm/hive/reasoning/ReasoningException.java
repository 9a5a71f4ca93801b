package com.z254.swarm.hive.reasoning;

import com.z254.swarm.hive.domain.model.FailureKind;

/**
 * Failure of a reasoning call, classified for the activation retry path.
 */
public class ReasoningException extends RuntimeException {

    private final FailureKind kind;

    public ReasoningException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReasoningException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static ReasoningException malformed(String message) {
        return new ReasoningException(FailureKind.MALFORMED_OUTPUT, message);
    }

    public static ReasoningException transport(String message, Throwable cause) {
        return new ReasoningException(FailureKind.TRANSPORT_ERROR, message, cause);
    }
}
