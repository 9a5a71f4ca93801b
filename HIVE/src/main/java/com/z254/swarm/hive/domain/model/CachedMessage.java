package com.z254.swarm.hive.domain.model;

import java.time.Instant;

/**
 * An inbound message held in an agent's cache.
 *
 * @param sequence   per-cache arrival order, strictly increasing
 * @param senderId   id of the agent (or external producer) that sent the payload
 * @param keyword    keyword the message was routed under
 * @param payload    message text
 * @param used       whether an activation has consumed this entry
 * @param receivedAt arrival time
 */
public record CachedMessage(long sequence, String senderId, String keyword, String payload,
                            boolean used, Instant receivedAt) {

    public CachedMessage markUsed() {
        return used ? this : new CachedMessage(sequence, senderId, keyword, payload, true, receivedAt);
    }

    /**
     * Whether this entry and {@code other} come from the same sender under the same keyword.
     */
    public boolean sameOrigin(CachedMessage other) {
        return senderId.equals(other.senderId) && keyword.equals(other.keyword);
    }
}
