package fr.lapetina.inference.mesh.domain.model;

/**
 * Role a node plays in the mesh.
 *
 * FULL_NODE: runs inference and coordinates tasks
 * COMPUTE_NODE: runs inference only
 * COORDINATOR: coordinates tasks, hosts no models
 * GATEWAY: entry point for external clients
 */
public enum NodeType {
    FULL_NODE,
    COMPUTE_NODE,
    COORDINATOR,
    GATEWAY;

    /**
     * Parses a configuration value, accepting either the enum name or its lower/kebab-case form.
     */
    public static NodeType fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return FULL_NODE;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        return switch (normalized) {
            case "FULL", "FULL_NODE" -> FULL_NODE;
            case "COMPUTE", "COMPUTE_NODE", "COMPUTE_ONLY" -> COMPUTE_NODE;
            case "COORDINATOR", "COORDINATOR_ONLY" -> COORDINATOR;
            case "GATEWAY" -> GATEWAY;
            default -> throw new IllegalArgumentException("Unknown node type: " + value);
        };
    }
}
