package fr.lapetina.inference.mesh.domain.dht;

import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Peer bookkeeping and a flat key/value store, keyed by XOR distance to this node.
 *
 * Peers live in k-buckets indexed by the bit length of their distance from self, most
 * recently seen first. When a bucket overflows, the least recently seen peer is dropped
 * and forgotten. All state is guarded by a single lock.
 */
public final class DistributedHashTable {

    private static final Logger log = LoggerFactory.getLogger(DistributedHashTable.class);

    public static final int DEFAULT_K = 20;
    public static final Duration DEFAULT_STALE_THRESHOLD = Duration.ofSeconds(300);

    private final String selfId;
    private final int bucketSize;
    private final long staleThresholdMillis;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, LinkedList<String>> buckets = new HashMap<>();
    private final Map<String, NodeCapability> nodeInfo = new HashMap<>();
    private final Map<String, StoredValue> dataStore = new HashMap<>();

    public DistributedHashTable(String selfId, int bucketSize, Duration staleThreshold, Clock clock) {
        if (bucketSize < 1) {
            throw new IllegalArgumentException("Bucket size must be at least 1");
        }
        this.selfId = selfId;
        this.bucketSize = bucketSize;
        this.staleThresholdMillis = staleThreshold.toMillis();
        this.clock = clock;
    }

    public DistributedHashTable(String selfId) {
        this(selfId, DEFAULT_K, DEFAULT_STALE_THRESHOLD, Clock.systemUTC());
    }

    /**
     * Inserts or refreshes a peer. The existing entry, if any, is replaced by the new
     * capability and moved to the front of its bucket.
     */
    public void addNode(NodeCapability capability) {
        String nodeId = capability.getNodeId();
        if (selfId.equals(nodeId)) {
            return;
        }
        int index = XorDistance.bucketIndex(XorDistance.distance(selfId, nodeId));

        lock.lock();
        try {
            LinkedList<String> bucket = buckets.computeIfAbsent(index, i -> new LinkedList<>());
            bucket.remove(nodeId);
            bucket.addFirst(nodeId);
            nodeInfo.put(nodeId, capability);

            while (bucket.size() > bucketSize) {
                String evicted = bucket.removeLast();
                nodeInfo.remove(evicted);
                log.debug("Bucket overflow, dropping peer: bucket={}, nodeId={}", index, evicted);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean removeNode(String nodeId) {
        lock.lock();
        try {
            NodeCapability removed = nodeInfo.remove(nodeId);
            if (removed == null) {
                return false;
            }
            int index = XorDistance.bucketIndex(XorDistance.distance(selfId, nodeId));
            LinkedList<String> bucket = buckets.get(index);
            if (bucket != null) {
                bucket.remove(nodeId);
                if (bucket.isEmpty()) {
                    buckets.remove(index);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a peer as just seen and moves it to the front of its bucket.
     *
     * @return false if the peer is unknown
     */
    public boolean touch(String nodeId) {
        lock.lock();
        try {
            NodeCapability capability = nodeInfo.get(nodeId);
            if (capability == null) {
                return false;
            }
            capability.touch(clock.millis());
            LinkedList<String> bucket = buckets.get(
                    XorDistance.bucketIndex(XorDistance.distance(selfId, nodeId)));
            if (bucket != null && bucket.remove(nodeId)) {
                bucket.addFirst(nodeId);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns up to {@code count} known peers ordered by XOR distance to {@code targetKey}.
     *
     * Every peer in the target's bucket or a lower one is closer to the target than any peer
     * in a higher bucket. Those are all collected; higher buckets are then added in
     * increasing order until {@code count} candidates are gathered.
     */
    public List<NodeCapability> findClosestNodes(String targetKey, int count) {
        if (count <= 0) {
            return List.of();
        }
        int targetIndex = XorDistance.bucketIndex(XorDistance.distance(selfId, targetKey));

        List<NodeCapability> candidates = new ArrayList<>();
        lock.lock();
        try {
            List<Integer> order = new ArrayList<>(buckets.keySet());
            order.sort(Comparator.naturalOrder());
            for (Integer index : order) {
                if (index <= targetIndex) {
                    collect(index, candidates);
                }
            }
            for (Integer index : order) {
                if (index > targetIndex) {
                    if (candidates.size() >= count) {
                        break;
                    }
                    collect(index, candidates);
                }
            }
        } finally {
            lock.unlock();
        }

        long targetHash = XorDistance.hash(targetKey);
        candidates.sort((a, b) -> Long.compareUnsigned(
                XorDistance.hash(a.getNodeId()) ^ targetHash,
                XorDistance.hash(b.getNodeId()) ^ targetHash));
        return candidates.size() > count ? List.copyOf(candidates.subList(0, count)) : candidates;
    }

    private void collect(int bucketIndex, List<NodeCapability> into) {
        for (String nodeId : buckets.get(bucketIndex)) {
            NodeCapability capability = nodeInfo.get(nodeId);
            if (capability != null) {
                into.add(capability);
            }
        }
    }

    /**
     * Peers advertising the model and seen within the staleness window.
     */
    public List<NodeCapability> findNodesWithModel(String modelId) {
        long now = clock.millis();
        lock.lock();
        try {
            return nodeInfo.values().stream()
                    .filter(n -> n.hostsModel(modelId))
                    .filter(n -> n.isFresh(now, staleThresholdMillis))
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every peer not heard from within the staleness window.
     *
     * @return ids of the evicted peers
     */
    public List<String> evictStaleNodes() {
        long now = clock.millis();
        List<String> stale;
        lock.lock();
        try {
            stale = nodeInfo.values().stream()
                    .filter(n -> !n.isFresh(now, staleThresholdMillis))
                    .map(NodeCapability::getNodeId)
                    .toList();
            stale.forEach(this::removeNode);
        } finally {
            lock.unlock();
        }
        if (!stale.isEmpty()) {
            log.debug("Evicted stale peers: count={}, nodes={}", stale.size(), stale);
        }
        return stale;
    }

    public Optional<NodeCapability> getNode(String nodeId) {
        lock.lock();
        try {
            return Optional.ofNullable(nodeInfo.get(nodeId));
        } finally {
            lock.unlock();
        }
    }

    public List<NodeCapability> getAllNodes() {
        lock.lock();
        try {
            return List.copyOf(nodeInfo.values());
        } finally {
            lock.unlock();
        }
    }

    public int knownNodeCount() {
        lock.lock();
        try {
            return nodeInfo.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last-writer-wins store.
     */
    public void storeData(String key, Object value) {
        lock.lock();
        try {
            dataStore.put(key, new StoredValue(value, clock.millis(), selfId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Object> getData(String key) {
        lock.lock();
        try {
            StoredValue stored = dataStore.get(key);
            return stored != null ? Optional.ofNullable(stored.value()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public String getSelfId() {
        return selfId;
    }

    private record StoredValue(Object value, long storedAt, String storedBy) {
    }
}
