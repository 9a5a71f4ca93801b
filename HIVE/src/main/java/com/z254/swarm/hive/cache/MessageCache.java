package com.z254.swarm.hive.cache;

import com.z254.swarm.hive.domain.model.CachedMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered store of the messages delivered to one agent.
 *
 * <p>Entries keep their arrival order and carry a used flag. Consuming an entry only flips the
 * flag; entries leave the cache through capacity eviction, {@link #reduce()} or {@link #clear()}.
 * All operations are serialized on the cache's own monitor and never wait on anything else.
 */
public class MessageCache {

    private final String agentId;
    private final CachePolicy policy;
    private final Object lock = new Object();

    // sequence -> entry; insertion order is arrival order
    private final LinkedHashMap<Long, CachedMessage> entries = new LinkedHashMap<>();
    private long nextSequence = 1;

    public MessageCache(String agentId, CachePolicy policy) {
        this.agentId = agentId;
        this.policy = policy;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * Append a message, assigning the next sequence number, then evict if over capacity.
     */
    public AppendResult append(String senderId, String keyword, String payload) {
        synchronized (lock) {
            CachedMessage message = new CachedMessage(nextSequence++, senderId, keyword, payload,
                    false, Instant.now());
            entries.put(message.sequence(), message);
            List<CachedMessage> evicted = evictOverCapacity();
            return new AppendResult(message, evicted);
        }
    }

    /**
     * Unused entries in arrival order. Does not mark anything used.
     *
     * @param keywordFilter keywords to keep, or null/empty for all
     */
    public List<CachedMessage> drainUnused(Set<String> keywordFilter) {
        boolean filtered = keywordFilter != null && !keywordFilter.isEmpty();
        synchronized (lock) {
            List<CachedMessage> unused = new ArrayList<>();
            for (CachedMessage message : entries.values()) {
                if (!message.used() && (!filtered || keywordFilter.contains(message.keyword()))) {
                    unused.add(message);
                }
            }
            return unused;
        }
    }

    public List<CachedMessage> drainUnused() {
        return drainUnused(null);
    }

    /**
     * Mark entries used. Unknown or already used sequence numbers are ignored.
     *
     * @return how many entries changed
     */
    public int markUsed(Collection<Long> sequences) {
        int marked = 0;
        synchronized (lock) {
            for (Long sequence : sequences) {
                CachedMessage message = entries.get(sequence);
                if (message != null && !message.used()) {
                    entries.put(sequence, message.markUsed());
                    marked++;
                }
            }
        }
        return marked;
    }

    /**
     * Collapse each run of adjacent unused entries from the same sender under the same keyword
     * into its most recent entry. Used entries are left untouched and break runs.
     * No-op unless the policy enables dedup.
     *
     * @return the entries removed
     */
    public List<CachedMessage> reduce() {
        if (!policy.isDedupEnabled()) {
            return List.of();
        }
        synchronized (lock) {
            List<CachedMessage> superseded = new ArrayList<>();
            CachedMessage previous = null;
            for (CachedMessage current : entries.values()) {
                if (previous != null && !previous.used() && !current.used()
                        && previous.sameOrigin(current) && policy.dedupApplies(current.keyword())) {
                    superseded.add(previous);
                }
                previous = current;
            }
            superseded.forEach(message -> entries.remove(message.sequence()));
            return superseded;
        }
    }

    /**
     * Remove every entry. Sequence numbering continues.
     */
    public int clear() {
        synchronized (lock) {
            int size = entries.size();
            entries.clear();
            return size;
        }
    }

    /**
     * Ordered snapshot of all entries, used and unused.
     */
    public List<CachedMessage> entries() {
        synchronized (lock) {
            return List.copyOf(entries.values());
        }
    }

    public long nextSequence() {
        synchronized (lock) {
            return nextSequence;
        }
    }

    /**
     * Replace the contents with persisted entries.
     */
    public void restore(List<CachedMessage> restored, long restoredNextSequence) {
        synchronized (lock) {
            entries.clear();
            long highest = 0;
            for (CachedMessage message : restored) {
                entries.put(message.sequence(), message);
                highest = Math.max(highest, message.sequence());
            }
            nextSequence = Math.max(restoredNextSequence, highest + 1);
            evictOverCapacity();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public int unusedCount() {
        synchronized (lock) {
            return (int) entries.values().stream().filter(message -> !message.used()).count();
        }
    }

    public boolean hasUnused() {
        synchronized (lock) {
            for (CachedMessage message : entries.values()) {
                if (!message.used()) {
                    return true;
                }
            }
            return false;
        }
    }

    // Oldest used entries go first, then oldest unused. Caller holds the lock.
    private List<CachedMessage> evictOverCapacity() {
        int overflow = entries.size() - policy.getCapacity();
        if (overflow <= 0) {
            return List.of();
        }
        List<CachedMessage> evicted = new ArrayList<>(overflow);
        Iterator<Map.Entry<Long, CachedMessage>> used = entries.entrySet().iterator();
        while (overflow > 0 && used.hasNext()) {
            CachedMessage message = used.next().getValue();
            if (message.used()) {
                used.remove();
                evicted.add(message);
                overflow--;
            }
        }
        Iterator<Map.Entry<Long, CachedMessage>> unused = entries.entrySet().iterator();
        while (overflow > 0 && unused.hasNext()) {
            evicted.add(unused.next().getValue());
            unused.remove();
            overflow--;
        }
        return evicted;
    }

    /**
     * Outcome of one append.
     *
     * @param appended the new entry
     * @param evicted  entries removed to respect capacity, oldest first
     */
    public record AppendResult(CachedMessage appended, List<CachedMessage> evicted) {

        /**
         * Unused entries lost to eviction.
         */
        public long droppedUnused() {
            return evicted.stream().filter(message -> !message.used()).count();
        }

        public boolean overflowed() {
            return droppedUnused() > 0;
        }

        /**
         * Whether the appended entry itself survived eviction.
         */
        public boolean retained() {
            return evicted.stream().noneMatch(message -> message.sequence() == appended.sequence());
        }
    }
}
