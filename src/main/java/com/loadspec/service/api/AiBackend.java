package com.loadspec.service.api;

import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import com.loadspec.model.backend.ErrorStatistics;

/**
 * Uniform contract over an AI completion service. Implementations own their transport,
 * retry policy and error classification.
 */
public interface AiBackend {

    /**
     * Prepares the backend for use (credential and reachability checks, model provisioning).
     *
     * @throws com.loadspec.exception.AiServiceException if the backend cannot be made ready.
     */
    void initialize();

    /**
     * Runs one completion, retrying transient failures with backoff. Only the final failure propagates.
     *
     * @param request The completion request.
     * @return A response with non-blank text.
     * @throws com.loadspec.exception.AiServiceException classified by failure type.
     */
    CompletionResponse generateCompletion(CompletionRequest request);

    /**
     * Lightweight reachability probe. Never throws.
     *
     * @return {@code true} if the service answered.
     */
    boolean healthCheck();

    boolean isReady();

    String name();

    ErrorStatistics errorStatistics();
}
