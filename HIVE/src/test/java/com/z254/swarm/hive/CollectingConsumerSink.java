package com.z254.swarm.hive;

import com.z254.swarm.hive.domain.model.CachedMessage;
import com.z254.swarm.hive.sink.ConsumerSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumer sink that keeps what it receives, optionally failing the first few calls.
 */
public class CollectingConsumerSink implements ConsumerSink {

    public static final String NAME = "memory";

    private final List<CachedMessage> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft;

    public CollectingConsumerSink() {
        this(0);
    }

    public CollectingConsumerSink(int failFirst) {
        this.failuresLeft = new AtomicInteger(failFirst);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void accept(String agentId, CachedMessage message) {
        if (failuresLeft.getAndDecrement() > 0) {
            throw new IllegalStateException("sink unavailable");
        }
        received.add(message);
    }

    public List<CachedMessage> getReceived() {
        return received;
    }
}
