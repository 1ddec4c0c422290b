package fr.lapetina.inference.mesh.infrastructure.executor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs whole models on a local Ollama server through {@code /api/generate}.
 *
 * Ollama has no notion of layer shards, so shard calls are refused. A circuit breaker
 * fails calls fast while the server keeps erroring.
 */
public final class OllamaInferenceExecutor implements InferenceExecutor {

    private static final Logger log = LoggerFactory.getLogger(OllamaInferenceExecutor.class);

    public static final String NAME = "ollama";

    private final URI generateUri;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public OllamaInferenceExecutor(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            CircuitBreaker circuitBreaker
    ) {
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.generateUri = URI.create(base + "api/generate");
        this.requestTimeout = requestTimeout;
        this.circuitBreaker = circuitBreaker;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public CompletableFuture<Object> execute(String modelId, String shardId, Object input) {
        if (shardId != null) {
            return CompletableFuture.failedFuture(new InferenceExecutionException(
                    "Ollama backend cannot run partial shard " + shardId));
        }
        if (!circuitBreaker.tryAcquire()) {
            log.warn("Call refused by circuit breaker: model={}, uri={}", modelId, generateUri);
            return CompletableFuture.failedFuture(new InferenceExecutionException(
                    "Circuit breaker open for " + circuitBreaker.getBackend()));
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(generateUri)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(modelId, input)))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new InferenceExecutionException("Failed to encode request for " + modelId, e));
        }

        long start = System.nanoTime();
        log.debug("Sending generate request: model={}, uri={}", modelId, generateUri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
                    if (ex != null) {
                        circuitBreaker.onFailure();
                        Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                ? ex.getCause() : ex;
                        log.error("Backend call failed: model={}, latencyMs={}, errorType={}, error={}",
                                modelId, latencyMs, cause.getClass().getSimpleName(), cause.getMessage());
                        throw new InferenceExecutionException("Ollama call failed: " + cause.getMessage(), cause);
                    }
                    return handleResponse(modelId, response, latencyMs);
                });
    }

    String buildRequestBody(String modelId, Object input) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelId);
        body.put("prompt", toPrompt(input));
        body.put("stream", false);
        return objectMapper.writeValueAsString(body);
    }

    private String toPrompt(Object input) throws JsonProcessingException {
        if (input instanceof String) {
            return (String) input;
        }
        if (input instanceof Map && ((Map<?, ?>) input).get("prompt") instanceof String) {
            return (String) ((Map<?, ?>) input).get("prompt");
        }
        return objectMapper.writeValueAsString(input);
    }

    private Object handleResponse(String modelId, HttpResponse<String> response, long latencyMs) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            circuitBreaker.onFailure();
            log.warn("Backend returned error: model={}, status={}, latencyMs={}", modelId, status, latencyMs);
            throw new InferenceExecutionException("Ollama returned HTTP " + status + ": " + errorText(response.body()));
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            circuitBreaker.onSuccess();
            log.info("Backend call succeeded: model={}, status={}, latencyMs={}", modelId, status, latencyMs);
            return root.path("response").asText("");
        } catch (IOException e) {
            circuitBreaker.onFailure();
            throw new InferenceExecutionException("Unreadable Ollama response for " + modelId, e);
        }
    }

    private String errorText(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            return root.path("error").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
