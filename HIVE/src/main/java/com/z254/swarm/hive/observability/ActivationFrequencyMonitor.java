package com.z254.swarm.hive.observability;

import com.z254.swarm.hive.config.SwarmProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks how often each agent completes an activation.
 *
 * <p>For every agent it reports the instant frequency (inverse of the gap between the last two
 * activations) and the moving average over a sliding window.
 */
@Component
public class ActivationFrequencyMonitor {

    private final Map<String, Tracker> trackers = new ConcurrentHashMap<>();
    private final Duration window;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ActivationFrequencyMonitor(SwarmProperties properties, MeterRegistry meterRegistry) {
        this(properties.getActivation().getFrequencyWindow(), Clock.systemUTC(), meterRegistry);
    }

    public ActivationFrequencyMonitor(Duration window, Clock clock, MeterRegistry meterRegistry) {
        this.window = window;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public void record(String agentId) {
        trackers.computeIfAbsent(agentId, id -> new Tracker(Counter.builder("swarm.activation.completed")
                        .tag("agent", id)
                        .register(meterRegistry)))
                .record(clock.millis());
    }

    public Optional<FrequencyStats> stats(String agentId) {
        Tracker tracker = trackers.get(agentId);
        return tracker != null ? Optional.of(tracker.stats(agentId, clock.millis())) : Optional.empty();
    }

    /**
     * Stats of every tracked agent, ordered by id.
     */
    public Map<String, FrequencyStats> allStats() {
        long now = clock.millis();
        Map<String, FrequencyStats> all = new TreeMap<>();
        trackers.forEach((agentId, tracker) -> all.put(agentId, tracker.stats(agentId, now)));
        return all;
    }

    public void unregister(String agentId) {
        Tracker tracker = trackers.remove(agentId);
        if (tracker != null) {
            meterRegistry.remove(tracker.counter);
        }
    }

    /**
     * @param instantHz       inverse of the last inter-activation gap, 0 with fewer than two activations
     * @param movingAverageHz activations in the window divided by the window length
     */
    public record FrequencyStats(String agentId, long totalActivations, int activationsInWindow,
                                 long windowSeconds, double instantHz, double movingAverageHz) {
    }

    private final class Tracker {
        private final Counter counter;
        private final Deque<Long> timestamps = new ArrayDeque<>();
        private long total;
        private long previous = -1;
        private long last = -1;

        private Tracker(Counter counter) {
            this.counter = counter;
        }

        synchronized void record(long nowMillis) {
            previous = last;
            last = nowMillis;
            total++;
            timestamps.addLast(nowMillis);
            prune(nowMillis);
            counter.increment();
        }

        synchronized FrequencyStats stats(String agentId, long nowMillis) {
            prune(nowMillis);
            double instant = 0.0;
            if (previous >= 0) {
                long gap = Math.max(1, last - previous);
                instant = 1000.0 / gap;
            }
            double seconds = Math.max(1, window.toMillis()) / 1000.0;
            return new FrequencyStats(agentId, total, timestamps.size(), window.toSeconds(),
                    instant, timestamps.size() / seconds);
        }

        private void prune(long nowMillis) {
            long cutoff = nowMillis - window.toMillis();
            while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoff) {
                timestamps.removeFirst();
            }
        }
    }
}
