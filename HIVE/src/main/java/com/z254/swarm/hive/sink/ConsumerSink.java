package com.z254.swarm.hive.sink;

import com.z254.swarm.hive.domain.model.CachedMessage;

/**
 * External destination that consume-capable agents hand their payloads to.
 * A thrown exception fails the activation and sends it through the retry path.
 */
public interface ConsumerSink {

    /**
     * Name an agent selects the sink by, through its {@code sink} param.
     */
    String getName();

    void accept(String agentId, CachedMessage message);
}
