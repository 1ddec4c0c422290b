/**
 * Core value objects: node capabilities, inference tasks and results, model shards.
 *
 * <p>Records are immutable. {@link fr.lapetina.inference.mesh.domain.model.NodeCapability}
 * keeps its load, reliability and last-seen time in atomics so handlers and the coordinator
 * can update it concurrently.
 */
package fr.lapetina.inference.mesh.domain.model;
