package fr.lapetina.inference.mesh.network;

import fr.lapetina.inference.mesh.domain.dht.DistributedHashTable;
import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.NodeDescriptor;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.domain.model.NodeCapability;
import fr.lapetina.inference.mesh.domain.sharding.ShardRegistry;

import java.time.Clock;

/**
 * Node state shared by the message handlers and background loops.
 */
public record NodeContext(
        NodeCapability self,
        DistributedHashTable dht,
        ShardRegistry shardRegistry,
        MessageRouter router,
        PeerInferenceClient inferenceClient,
        Clock clock,
        int messageTtl
) {

    public String selfId() {
        return self.getNodeId();
    }

    public P2PMessage newMessage(MessageType type, MessagePayload payload) {
        return P2PMessage.create(type, selfId(), payload, messageTtl, clock.millis());
    }

    /**
     * Adds or refreshes a peer learned from an announcement or a discovery reply, keeping
     * the reliability this node has observed for it, and connects to it when possible.
     */
    public void learnPeer(NodeDescriptor descriptor) {
        if (selfId().equals(descriptor.nodeId())) {
            return;
        }
        long now = clock.millis();
        NodeCapability capability = dht.getNode(descriptor.nodeId())
                .map(existing -> descriptor.toCapability(now, existing.getReliabilityScore()))
                .orElseGet(() -> descriptor.toCapability(now));
        dht.addNode(capability);
        router.ensureConnected(descriptor.nodeId(), capability.getAddress());
    }
}
