/**
 * LMAX Disruptor event loop for inbound mesh messages.
 *
 * <p>Raw frames from the transport are published into a pre-allocated ring buffer and
 * flow through handlers in sequence:
 * <pre>
 * Decode → Deduplication → Dispatch → Gossip Forward → Metrics → Completion
 * </pre>
 *
 * <p>An undecodable or already-seen message skips every later stage. A failing message
 * handler does not stop the message from being forwarded.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.mesh.disruptor.GossipPipeline} - Ring buffer and handler chain</li>
 *   <li>{@link fr.lapetina.inference.mesh.disruptor.exception.BackpressureException} - Thrown when the ring buffer is full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.inference.mesh.disruptor;
