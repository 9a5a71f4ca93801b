package com.z254.swarm.hive.sink;

import com.z254.swarm.hive.domain.model.CachedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes consumed payloads to the {@code swarm.sink} logger.
 */
@Component
public class LoggingConsumerSink implements ConsumerSink {

    public static final String NAME = "log";

    private static final Logger SINK_LOG = LoggerFactory.getLogger("swarm.sink");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void accept(String agentId, CachedMessage message) {
        SINK_LOG.info("[{}] {}/{} : {}", agentId, message.senderId(), message.keyword(), message.payload());
    }
}
