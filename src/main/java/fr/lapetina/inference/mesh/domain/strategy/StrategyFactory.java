package fr.lapetina.inference.mesh.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of node selection strategies by configuration name.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<NodeSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(ReliabilityFirstStrategy.NAME, ReliabilityFirstStrategy::new);
        register(LeastLoadedStrategy.NAME, LeastLoadedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name     Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<NodeSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<NodeSelectionStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<NodeSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, falling back to reliability-first when the name is unknown.
     */
    public static NodeSelectionStrategy createOrDefault(String name) {
        return create(name).orElseGet(ReliabilityFirstStrategy::new);
    }
}
