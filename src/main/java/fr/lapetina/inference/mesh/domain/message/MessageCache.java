package fr.lapetina.inference.mesh.domain.message;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ids of messages already processed or originated by this node, with the time they
 * were first seen. Entries are only removed by {@link #purgeOlderThan(Duration)}.
 */
public final class MessageCache {

    private final Map<String, Long> seen = new ConcurrentHashMap<>();
    private final Clock clock;

    public MessageCache(Clock clock) {
        this.clock = clock;
    }

    public MessageCache() {
        this(Clock.systemUTC());
    }

    /**
     * Records the id.
     *
     * @return true if the id was not seen before
     */
    public boolean markSeen(String messageId) {
        return seen.putIfAbsent(messageId, clock.millis()) == null;
    }

    public boolean contains(String messageId) {
        return seen.containsKey(messageId);
    }

    /**
     * @return number of ids removed
     */
    public int purgeOlderThan(Duration maxAge) {
        long cutoff = clock.millis() - maxAge.toMillis();
        int removed = 0;
        Iterator<Map.Entry<String, Long>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() < cutoff) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return seen.size();
    }
}
