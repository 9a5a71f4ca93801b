package com.z254.swarm.hive.domain.model;

/**
 * Registry mutation requested by an agent's reasoning output inside a {@code <signal>} directive.
 *
 * @param type    signal type
 * @param keyword keyword the signal applies to (may be null for EXPLORE / STOP_EXPLORE)
 * @param agentId counterpart agent id for CONNECT / DISCONNECT / ACCEPT_INPUT
 */
public record ControlSignal(Type type, String keyword, String agentId) {

    public enum Type {
        EXPLORE,
        STOP_EXPLORE,
        SEEK,
        CONNECT,
        DISCONNECT,
        ACCEPT_INPUT,
        REJECT_INPUT
    }

    /**
     * Whether the fields the signal type needs are present.
     */
    public boolean isComplete() {
        return switch (type) {
            case EXPLORE, STOP_EXPLORE -> true;
            case SEEK, REJECT_INPUT -> hasText(keyword);
            case CONNECT, DISCONNECT, ACCEPT_INPUT -> hasText(keyword) && hasText(agentId);
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
