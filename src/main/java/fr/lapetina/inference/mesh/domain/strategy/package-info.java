/**
 * Peer selection for replicated inference.
 *
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code reliability-first}</td><td>Highest reliability, then compute power</td></tr>
 *   <tr><td>{@code least-loaded}</td><td>Lowest current load, skipping overloaded peers when possible</td></tr>
 * </table>
 *
 * <p>Custom strategies implement {@link fr.lapetina.inference.mesh.domain.strategy.NodeSelectionStrategy}
 * and register with {@link fr.lapetina.inference.mesh.domain.strategy.StrategyFactory}.
 */
package fr.lapetina.inference.mesh.domain.strategy;
