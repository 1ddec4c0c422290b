package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a model announcement. A plain announcement marks the model on the announcer;
 * one carrying a shard plan registers the plan and its placement instead.
 */
public final class ModelAnnounceHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(ModelAnnounceHandler.class);

    private final NodeContext context;

    public ModelAnnounceHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.ModelAnnounce announce = message.payloadAs(MessagePayload.ModelAnnounce.class);
        String modelId = announce.modelId();
        String announcer = announce.nodeId() != null ? announce.nodeId() : message.senderId();

        if (announce.hasShardPlan()) {
            context.shardRegistry().register(announce.shards(), announce.placement());
            context.dht().storeData("shards:" + modelId, announce.shards());
            log.info("Shard plan registered: modelId={}, shards={}, from={}",
                    modelId, announce.shards().size(), announcer);
            return;
        }

        context.dht().storeData("model:" + modelId, announce);
        context.dht().getNode(announcer).ifPresent(node -> node.addModel(modelId));
        log.debug("Model announced: modelId={}, nodeId={}", modelId, announcer);
    }
}
