package com.loadspec.service.backend;

import com.loadspec.config.ParserProperties;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import com.loadspec.model.backend.ErrorStatistics;
import com.loadspec.service.api.AiBackend;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Shared plumbing of the backend adapters: readiness, the retry policy and error classification.
 * <p>
 * Each attempt that fails is classified and counted. Only failures whose type is retryable are retried,
 * with exponential backoff (randomized when jitter is enabled) capped at the configured maximum delay.
 * Subclasses implement a single attempt in {@link #doGenerate(CompletionRequest)}.
 */
@Slf4j
public abstract class AbstractAiBackend implements AiBackend {

    protected final ParserProperties.Backend config;
    protected final WebClient webClient;
    protected final AiErrorClassifier classifier = new AiErrorClassifier();

    private final Retry retry;
    private volatile boolean ready;

    protected AbstractAiBackend(ParserProperties.Backend config, WebClient webClient) {
        this.config = config;
        this.webClient = webClient;
        this.retry = Retry.of(name() + "-completion", retryConfig(config));
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("{} attempt {} failed ({}), retrying in {} ms", name(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage(), event.getWaitInterval().toMillis()));
    }

    static RetryConfig retryConfig(ParserProperties.Backend config) {
        Duration base = Duration.ofMillis(Math.max(1, config.getRetryBaseDelayMs()));
        Duration max = Duration.ofMillis(Math.max(base.toMillis(), config.getRetryMaxDelayMs()));
        IntervalFunction interval = config.isJitter()
                ? IntervalFunction.ofExponentialRandomBackoff(base, 2, 0.5, max)
                : IntervalFunction.ofExponentialBackoff(base, 2, max);
        return RetryConfig.custom()
                .maxAttempts(Math.max(1, config.getMaxRetries()))
                .intervalFunction(interval)
                .retryOnException(e -> e instanceof AiServiceException ai && ai.isRetryable())
                .build();
    }

    @Override
    public final void initialize() {
        if (ready) {
            return;
        }
        try {
            doInitialize();
        } catch (RuntimeException e) {
            AiServiceException classified = classifier.classify(e, name());
            classifier.record(classified);
            log.error("{} backend failed to initialize: {}", name(), classified.getMessage());
            throw classified;
        }
        ready = true;
        log.info("{} backend ready (model {})", name(), model(null));
    }

    @Override
    public final CompletionResponse generateCompletion(CompletionRequest request) {
        if (!ready) {
            throw new AiServiceException(AiErrorType.SERVICE_UNAVAILABLE, name(), name() + " backend is not initialized");
        }
        try {
            return retry.executeSupplier(() -> attempt(request));
        } catch (AiServiceException e) {
            log.error("{} completion failed after retries: {} ({})", name(), e.getMessage(), e.getType());
            throw e;
        }
    }

    private CompletionResponse attempt(CompletionRequest request) {
        long started = System.currentTimeMillis();
        try {
            CompletionResponse response = doGenerate(request);
            if (response == null || response.text() == null || response.text().isBlank()) {
                throw new AiServiceException(AiErrorType.INVALID_RESPONSE, name(), name() + " returned an empty completion");
            }
            log.debug("{} answered in {} ms: {}", name(), System.currentTimeMillis() - started, response.text());
            return response;
        } catch (RuntimeException e) {
            AiServiceException classified = classifier.classify(e, name());
            classifier.record(classified);
            throw classified;
        }
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public ErrorStatistics errorStatistics() {
        return classifier.statistics();
    }

    protected Duration timeout() {
        return Duration.ofMillis(config.getTimeoutMs());
    }

    protected String model(CompletionRequest request) {
        if (request != null && request.model() != null && !request.model().isBlank()) {
            return request.model();
        }
        return ParserProperties.orDefault(config.getModel(), defaultModel());
    }

    protected double temperature(CompletionRequest request) {
        return request.temperature() != null ? request.temperature() : config.getTemperature();
    }

    protected int maxTokens(CompletionRequest request) {
        return request.maxTokens() != null ? request.maxTokens() : config.getMaxTokens();
    }

    protected abstract String defaultModel();

    /**
     * Credential, reachability and model checks. Any exception thrown here is classified.
     */
    protected abstract void doInitialize();

    /**
     * One completion attempt, without retries.
     */
    protected abstract CompletionResponse doGenerate(CompletionRequest request);
}
