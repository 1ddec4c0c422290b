package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;

/**
 * Completes the pending dispatch the response answers.
 */
public final class InferenceResponseHandler implements MessageHandler {

    private final NodeContext context;

    public InferenceResponseHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        context.inferenceClient().complete(message.payloadAs(MessagePayload.InferenceResponse.class));
    }
}
