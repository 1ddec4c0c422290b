package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.domain.message.MessageCache;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.infrastructure.config.MeshConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;
import java.util.function.IntSupplier;

/**
 * Background loops that keep membership current.
 *
 * Heartbeat: broadcasts this node's load and active inference count.
 * Maintenance: evicts peers not heard from within the staleness window from the DHT and the
 * peer table, and occasionally re-announces this node.
 * Cache cleanup: purges old message ids from the de-duplication cache.
 *
 * A failing iteration is logged and the loop keeps its schedule.
 */
public final class PeerLivenessMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PeerLivenessMonitor.class);

    private final NodeContext context;
    private final PeerTable peerTable;
    private final MessageCache messageCache;
    private final IntSupplier activeInferences;
    private final Runnable reannounce;
    private final DoubleSupplier random;
    private final MeshConfig.NetworkConfig config;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PeerLivenessMonitor(
            NodeContext context,
            PeerTable peerTable,
            MessageCache messageCache,
            IntSupplier activeInferences,
            Runnable reannounce,
            DoubleSupplier random,
            MeshConfig.NetworkConfig config
    ) {
        this.context = context;
        this.peerTable = peerTable;
        this.messageCache = messageCache;
        this.activeInferences = activeInferences;
        this.reannounce = reannounce;
        this.random = random;
        this.config = config;
        this.scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "mesh-liveness-" + context.selfId());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            schedule("heartbeat", this::sendHeartbeat, config.getHeartbeatIntervalMs());
            schedule("maintenance", this::runMaintenance, config.getMaintenanceIntervalMs());
            schedule("cache-cleanup", this::cleanupMessageCache, config.getCacheCleanupIntervalMs());
            log.info("Liveness monitor started: heartbeatMs={}, maintenanceMs={}, cacheCleanupMs={}",
                    config.getHeartbeatIntervalMs(), config.getMaintenanceIntervalMs(),
                    config.getCacheCleanupIntervalMs());
        }
    }

    private void schedule(String name, Runnable task, long intervalMs) {
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Background loop iteration failed: loop={}", name, e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public void sendHeartbeat() {
        MessagePayload.Heartbeat heartbeat = new MessagePayload.Heartbeat(
                context.clock().millis(),
                context.self().getCurrentLoad(),
                activeInferences.getAsInt());
        int peers = context.router().broadcast(context.newMessage(MessageType.HEARTBEAT, heartbeat));
        log.debug("Heartbeat sent: peers={}, load={}, activeInferences={}",
                peers, heartbeat.load(), heartbeat.activeInferences());
    }

    /**
     * @return ids of the peers evicted in this pass
     */
    public List<String> runMaintenance() {
        List<String> stale = context.dht().evictStaleNodes();
        for (String nodeId : stale) {
            context.router().disconnect(nodeId);
        }
        for (String peerId : peerTable.idlePeers(config.getStaleThresholdMs())) {
            context.router().disconnect(peerId);
        }
        if (!stale.isEmpty()) {
            log.debug("Maintenance evicted stale peers: count={}", stale.size());
        }
        if (random.getAsDouble() < config.getReannounceProbability()) {
            log.debug("Maintenance re-announcing this node");
            reannounce.run();
        }
        return stale;
    }

    public int cleanupMessageCache() {
        int purged = messageCache.purgeOlderThan(Duration.ofMillis(config.getMessageCacheTtlMs()));
        if (purged > 0) {
            log.debug("Message cache cleaned: purged={}, remaining={}", purged, messageCache.size());
        }
        return purged;
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Liveness monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
