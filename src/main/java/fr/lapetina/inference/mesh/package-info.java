/**
 * Inference Mesh - peer-to-peer coordination layer for distributed AI inference.
 *
 * <p>Each node joins a gossip network, advertises its capabilities and the models it hosts,
 * and can run inference tasks across its peers. Tasks are either replicated on several peers
 * and settled by consensus, or executed as a pipeline over model shards placed on different
 * peers. Inbound traffic is processed by an LMAX Disruptor event loop.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.mesh.MeshNodeFactory} - Main entry point for creating
 *       a fully-wired node from YAML configuration</li>
 *   <li>{@link fr.lapetina.inference.mesh.network.NetworkManager} - Node lifecycle and the
 *       public inference API</li>
 *   <li>{@link fr.lapetina.inference.mesh.InferenceMeshApplication} - Standalone launcher running
 *       a small mesh on an in-process transport</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (InMemoryTransportHub hub = new InMemoryTransportHub();
 *      MeshNodeFactory node = MeshNodeFactory.create("config.yaml", hub).start()) {
 *     InferenceResult result = node.getNetworkManager()
 *             .requestInference("llama2", "Hello!")
 *             .join();
 *     System.out.println(result.result());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Kademlia-style routing table with XOR distance</li>
 *   <li>TTL-bounded gossip with duplicate suppression</li>
 *   <li>Byzantine-tolerant consensus over replicated results</li>
 *   <li>Layer sharding with replicated shard placement</li>
 *   <li>Circuit breaker around the local Ollama backend</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.inference.mesh.MeshNodeFactory
 * @see fr.lapetina.inference.mesh.disruptor.GossipPipeline
 */
package fr.lapetina.inference.mesh;
