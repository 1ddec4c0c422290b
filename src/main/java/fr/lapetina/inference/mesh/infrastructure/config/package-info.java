/**
 * YAML configuration model and loader.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code node} - Identity, capabilities and hosted models</li>
 *   <li>{@code network} - Bootstrap peers, gossip TTL and background loop intervals</li>
 *   <li>{@code dht} - Routing table bucket size</li>
 *   <li>{@code consensus} - Byzantine and numeric tolerances</li>
 *   <li>{@code inference} - Redundancy, timeouts and selection strategy</li>
 *   <li>{@code disruptor} - Ring buffer and wait strategy settings</li>
 *   <li>{@code executor} - Local inference backend</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.inference.mesh.infrastructure.config.MeshConfig
 */
package fr.lapetina.inference.mesh.infrastructure.config;
