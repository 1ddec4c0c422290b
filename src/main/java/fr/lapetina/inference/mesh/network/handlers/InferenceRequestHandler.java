package fr.lapetina.inference.mesh.network.handlers;

import fr.lapetina.inference.mesh.domain.message.MessagePayload;
import fr.lapetina.inference.mesh.domain.message.MessageType;
import fr.lapetina.inference.mesh.domain.message.P2PMessage;
import fr.lapetina.inference.mesh.network.NodeContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * Runs requested work on the local executor and replies to the requester.
 * Execution is asynchronous; the reply is sent when the executor completes.
 */
public final class InferenceRequestHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(InferenceRequestHandler.class);

    private final NodeContext context;

    public InferenceRequestHandler(NodeContext context) {
        this.context = context;
    }

    @Override
    public void handle(P2PMessage message) {
        MessagePayload.InferenceRequest request = message.payloadAs(MessagePayload.InferenceRequest.class);
        String requester = message.senderId();

        log.debug("Executing inference request: requestId={}, taskId={}, model={}, shard={}, requester={}",
                request.requestId(), request.taskId(), request.modelId(), request.shardId(), requester);

        context.inferenceClient()
                .executeLocally(request.modelId(), request.shardId(), request.inputData())
                .whenComplete((output, ex) -> {
                    MessagePayload.InferenceResponse response;
                    if (ex == null) {
                        response = new MessagePayload.InferenceResponse(
                                request.requestId(), request.taskId(), true, output, null);
                    } else {
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause() : ex;
                        log.warn("Inference request failed: requestId={}, taskId={}, model={}, error={}",
                                request.requestId(), request.taskId(), request.modelId(), cause.getMessage());
                        response = new MessagePayload.InferenceResponse(
                                request.requestId(), request.taskId(), false, null, cause.getMessage());
                    }
                    context.router().send(requester, context.newMessage(MessageType.INFERENCE_RESPONSE, response));
                });
    }
}
