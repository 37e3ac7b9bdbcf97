package com.loadspec.service.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.config.ParserProperties;
import com.loadspec.dto.llm.OllamaGenerateRequest;
import com.loadspec.dto.llm.OllamaGenerateResponse;
import com.loadspec.dto.llm.OllamaPullRequest;
import com.loadspec.dto.llm.OllamaTagsResponse;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import com.loadspec.model.backend.ResponseFormat;
import com.loadspec.model.backend.ResponseMetadata;
import com.loadspec.model.backend.ServiceHealth;
import com.loadspec.model.backend.TokenUsage;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Adapter for a self-hosted Ollama server.
 * <p>
 * Requests go through a bounded {@link ConnectionPool}. Server health is cached and re-probed when the
 * cached answer is older than the health check interval or was negative. When the configured model is
 * missing at startup it is pulled, provided auto-pull is enabled.
 */
@Slf4j
public class OllamaBackend extends AbstractAiBackend {

    public static final String NAME = "ollama";
    public static final String DEFAULT_ENDPOINT = "http://localhost:11434";
    public static final String DEFAULT_MODEL = "llama3.2:1b";

    private static final Duration PULL_TIMEOUT = Duration.ofMinutes(10);

    private final ParserProperties.Pool poolConfig;
    private final ConnectionPool pool;
    private final ReentrantLock healthLock = new ReentrantLock();
    private volatile boolean healthy;
    private volatile Instant lastHealthCheck;

    public OllamaBackend(ParserProperties.Backend config, ParserProperties.Pool poolConfig, WebClient webClient) {
        super(config, webClient);
        this.poolConfig = poolConfig;
        this.pool = new ConnectionPool(NAME, poolConfig.getMaxConnections(), poolConfig.getAcquireTimeoutMs());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String defaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected void doInitialize() {
        String model = model(null);
        OllamaTagsResponse tags = webClient.get()
                .uri("/api/tags")
                .retrieve()
                .bodyToMono(OllamaTagsResponse.class)
                .timeout(Duration.ofMillis(poolConfig.getHealthCheckTimeoutMs()))
                .block();
        markHealth(true);

        boolean installed = tags != null && tags.getModels().stream()
                .anyMatch(m -> model.equals(m.getName()) || (m.getName() != null && m.getName().startsWith(model + ":")));
        if (installed) {
            return;
        }
        if (!config.isAutoPullModel()) {
            throw new AiServiceException(AiErrorType.MODEL_UNAVAILABLE, NAME,
                    "Model '" + model + "' is not installed and auto-pull is disabled");
        }
        pullModel(model);
    }

    private void pullModel(String model) {
        log.info("Model '{}' not installed, pulling it", model);
        Retry pullRetry = Retry.of("ollama-pull", RetryConfig.custom()
                .maxAttempts(3)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        Duration.ofMillis(Math.max(1, config.getRetryBaseDelayMs())), 2))
                .retryOnException(e -> e instanceof WebClientRequestException
                        || (e instanceof WebClientResponseException w && w.getStatusCode().is5xxServerError()))
                .build());

        webClient.post()
                .uri("/api/pull")
                .bodyValue(new OllamaPullRequest(model, false))
                .retrieve()
                .bodyToMono(String.class)
                .transformDeferred(RetryOperator.of(pullRetry))
                .timeout(PULL_TIMEOUT)
                .block();
        log.info("Model '{}' pulled", model);
    }

    @Override
    protected CompletionResponse doGenerate(CompletionRequest request) {
        ensureHealthy();

        OllamaGenerateRequest body = new OllamaGenerateRequest();
        body.setModel(model(request));
        body.setPrompt(request.prompt());
        body.setSystem(request.systemPrompt());
        body.setFormat(request.format() == ResponseFormat.JSON ? "json" : null);
        body.getOptions().put("temperature", temperature(request));
        body.getOptions().put("top_p", 0.9);
        body.getOptions().put("top_k", 40);
        body.getOptions().put("num_predict", maxTokens(request));
        body.getOptions().putAll(request.options());

        long started = System.currentTimeMillis();
        OllamaGenerateResponse response = pool.withConnection(() -> webClient.post()
                .uri("/api/generate")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(OllamaGenerateResponse.class)
                .timeout(timeout())
                .block());

        JsonNode text = response == null ? null : response.getResponse();
        if (text == null || !text.isTextual()) {
            throw new AiServiceException(AiErrorType.INVALID_RESPONSE, NAME,
                    "Ollama response field 'response' is missing or not a string");
        }
        return new CompletionResponse(text.asText(),
                response.getModel() != null ? response.getModel() : body.getModel(),
                TokenUsage.of(response.getPromptEvalCount(), response.getEvalCount()),
                new ResponseMetadata(NAME, System.currentTimeMillis() - started, false));
    }

    /**
     * Probes {@code /api/tags} and records the outcome as the cached health.
     */
    @Override
    public boolean healthCheck() {
        boolean result = probe();
        markHealth(result);
        return result;
    }

    private boolean probe() {
        try {
            OllamaTagsResponse tags = webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(OllamaTagsResponse.class)
                    .timeout(Duration.ofMillis(poolConfig.getHealthCheckTimeoutMs()))
                    .block();
            return tags != null;
        } catch (Exception e) {
            log.warn("Ollama health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Uses the cached health when it is positive and fresh, probes the server otherwise.
     *
     * @throws AiServiceException SERVICE_UNAVAILABLE when the server does not answer.
     */
    private void ensureHealthy() {
        healthLock.lock();
        try {
            boolean stale = lastHealthCheck == null
                    || Duration.between(lastHealthCheck, Instant.now()).toMillis() > poolConfig.getHealthCheckIntervalMs();
            if (stale || !healthy) {
                healthCheck();
            }
        } finally {
            healthLock.unlock();
        }
        if (!healthy) {
            throw new AiServiceException(AiErrorType.SERVICE_UNAVAILABLE, NAME, "Ollama server is not healthy");
        }
    }

    private void markHealth(boolean value) {
        healthy = value;
        lastHealthCheck = Instant.now();
    }

    public ServiceHealth serviceHealth() {
        return new ServiceHealth(healthy, lastHealthCheck, pool.activeConnections(), pool.queuedRequests());
    }

    ConnectionPool pool() {
        return pool;
    }
}
