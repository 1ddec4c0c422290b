package fr.lapetina.inference.mesh;

import fr.lapetina.inference.mesh.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import fr.lapetina.inference.mesh.infrastructure.transport.InMemoryTransportHub;
import fr.lapetina.inference.mesh.network.NetworkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point: runs a small single-JVM mesh on an in-process transport hub.
 *
 * The first node uses the configuration as is. Every further node loads the same file,
 * gets the id {@code <first id>-<n>} and bootstraps through the first node.
 */
public class InferenceMeshApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceMeshApplication.class);

    private final String configPath;
    private final int nodeCount;
    private final InMemoryTransportHub hub = new InMemoryTransportHub();
    private final List<MeshNodeFactory> nodes = new ArrayList<>();
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public InferenceMeshApplication(String configPath, int nodeCount) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("Node count must be at least 1, got " + nodeCount);
        }
        this.configPath = configPath;
        this.nodeCount = nodeCount;
    }

    public void start() {
        log.info("Starting inference mesh: nodes={}, config={}", nodeCount, configPath);

        MeshNodeFactory seed = MeshNodeFactory.create(configPath, hub).start();
        nodes.add(seed);
        String seedId = seed.getNetworkManager().getNodeId();
        String seedAddress = seed.getTransport().localAddress();

        for (int i = 1; i < nodeCount; i++) {
            MeshConfig config = new ConfigLoader(configPath).load();
            config.getNode().setId(seedId + "-" + i);
            config.getNode().setAddress("");
            MeshNodeFactory node = MeshNodeFactory.create(config, hub).start(List.of(seedAddress));
            nodes.add(node);
        }

        for (MeshNodeFactory node : nodes) {
            NetworkStatus status = node.getNetworkManager().getNetworkStatus();
            log.info("Node ready: nodeId={}, type={}, connectedPeers={}, knownNodes={}",
                    status.nodeId(), status.nodeType(), status.connectedPeers(), status.knownNodes());
        }
        log.info("Inference mesh started with {} nodes", nodes.size());
    }

    public List<MeshNodeFactory> getNodes() {
        return List.copyOf(nodes);
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    @Override
    public void close() {
        log.info("Shutting down inference mesh...");

        for (MeshNodeFactory node : nodes) {
            try {
                node.close();
            } catch (Exception e) {
                log.warn("Error closing node", e);
            }
        }
        nodes.clear();

        try {
            hub.close();
        } catch (Exception e) {
            log.warn("Error closing transport hub", e);
        }

        log.info("Inference mesh shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";
        int nodeCount = args.length > 1 ? Integer.parseInt(args[1]) : 3;

        try {
            InferenceMeshApplication app = new InferenceMeshApplication(configPath, nodeCount);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start inference mesh", e);
            System.exit(1);
        }
    }
}
