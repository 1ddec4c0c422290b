package fr.lapetina.inference.mesh.domain.consensus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Byzantine-tolerant agreement over independent replica results.
 *
 * Results are clustered greedily: each joins the first cluster whose first member is
 * similar to it, or opens a new one. The largest cluster wins if it reaches
 * {@link #requiredAgreement(int)}. A winning cluster of numbers is merged into their
 * mean; any other cluster yields its most frequent value.
 *
 * Similarity:
 * - numbers: relative difference within the numeric tolerance; two zeros are equal; a zero
 *   and a non-zero are compared by absolute difference
 * - maps: same key set and similar values per key
 * - lists: same length and similar elements pairwise
 * - anything else: {@link Objects#equals(Object, Object)}
 *
 * Stateless and thread-safe.
 */
public final class ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    public static final double DEFAULT_BYZANTINE_TOLERANCE = 0.33;
    public static final double DEFAULT_NUMERIC_TOLERANCE = 0.01;

    private final double byzantineTolerance;
    private final double numericTolerance;

    public ConsensusEngine(double byzantineTolerance, double numericTolerance) {
        if (byzantineTolerance < 0 || byzantineTolerance >= 1) {
            throw new IllegalArgumentException("Byzantine tolerance must be in [0, 1), got " + byzantineTolerance);
        }
        if (numericTolerance < 0) {
            throw new IllegalArgumentException("Numeric tolerance must be non-negative, got " + numericTolerance);
        }
        this.byzantineTolerance = byzantineTolerance;
        this.numericTolerance = numericTolerance;
    }

    public ConsensusEngine() {
        this(DEFAULT_BYZANTINE_TOLERANCE, DEFAULT_NUMERIC_TOLERANCE);
    }

    /**
     * Cluster size needed to accept a value out of {@code responses} results:
     * {@code floor(N * (1 - tolerance))}, at least 2, never more than N.
     */
    public int requiredAgreement(int responses) {
        if (responses <= 0) {
            return 0;
        }
        int required = Math.max(2, (int) Math.floor(responses * (1 - byzantineTolerance)));
        return Math.min(responses, required);
    }

    public ConsensusOutcome decide(String taskId, List<NodeResult> results) {
        if (results.isEmpty()) {
            return new ConsensusOutcome.NoConsensus(0, 0, 0);
        }

        int required = requiredAgreement(results.size());
        List<Cluster> clusters = cluster(results);
        clusters.sort(Comparator.comparingInt(Cluster::size).reversed());

        Cluster largest = clusters.get(0);
        if (largest.size() >= required) {
            Object value = merge(largest.values);
            log.info("Consensus reached: taskId={}, responses={}, required={}, agreeing={}",
                    taskId, results.size(), required, largest.nodeIds);
            return new ConsensusOutcome.Agreed(value, largest.nodeIds, required);
        }

        log.warn("No consensus: taskId={}, responses={}, required={}, largestCluster={}, clusters={}",
                taskId, results.size(), required, largest.size(), clusters.size());
        return new ConsensusOutcome.NoConsensus(largest.size(), required, results.size());
    }

    private List<Cluster> cluster(List<NodeResult> results) {
        List<Cluster> clusters = new ArrayList<>();
        for (NodeResult result : results) {
            Cluster target = null;
            for (Cluster cluster : clusters) {
                if (similar(result.value(), cluster.representative())) {
                    target = cluster;
                    break;
                }
            }
            if (target == null) {
                target = new Cluster();
                clusters.add(target);
            }
            target.add(result);
        }
        return clusters;
    }

    /**
     * Recursive similarity check used for clustering.
     */
    public boolean similar(Object a, Object b) {
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> mapA = (Map<?, ?>) a;
            Map<?, ?> mapB = (Map<?, ?>) b;
            if (!mapA.keySet().equals(mapB.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : mapA.entrySet()) {
                if (!similar(entry.getValue(), mapB.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            List<?> listA = (List<?>) a;
            List<?> listB = (List<?>) b;
            if (listA.size() != listB.size()) {
                return false;
            }
            Iterator<?> itB = listB.iterator();
            for (Object element : listA) {
                if (!similar(element, itB.next())) {
                    return false;
                }
            }
            return true;
        }
        if (isNumeric(a) && isNumeric(b)) {
            double x = ((Number) a).doubleValue();
            double y = ((Number) b).doubleValue();
            if (x == 0 && y == 0) {
                return true;
            }
            if (x == 0 || y == 0) {
                return Math.abs(x - y) <= numericTolerance;
            }
            return Math.abs(x - y) / Math.max(Math.abs(x), Math.abs(y)) <= numericTolerance;
        }
        return Objects.equals(a, b);
    }

    private Object merge(List<Object> values) {
        if (values.size() == 1) {
            return values.get(0);
        }
        if (values.stream().allMatch(ConsensusEngine::isNumeric)) {
            return values.stream().mapToDouble(v -> ((Number) v).doubleValue()).average().orElse(0.0);
        }

        // Most frequent by string form; first seen wins ties
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, Object> firstByKey = new LinkedHashMap<>();
        for (Object value : values) {
            String key = String.valueOf(value);
            counts.merge(key, 1, Integer::sum);
            firstByKey.putIfAbsent(key, value);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return firstByKey.get(best);
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    public double getByzantineTolerance() {
        return byzantineTolerance;
    }

    public double getNumericTolerance() {
        return numericTolerance;
    }

    private static final class Cluster {
        private final List<Object> values = new ArrayList<>();
        private final List<String> nodeIds = new ArrayList<>();

        void add(NodeResult result) {
            values.add(result.value());
            nodeIds.add(result.nodeId());
        }

        Object representative() {
            return values.get(0);
        }

        int size() {
            return nodeIds.size();
        }
    }
}
