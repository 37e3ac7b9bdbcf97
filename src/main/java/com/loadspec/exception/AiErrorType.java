package com.loadspec.exception;

/**
 * Classification of backend failures. Each type carries whether a retry can help and how
 * the operator can work around it.
 */
public enum AiErrorType {
    CONNECTION_FAILED(true, "Check that the model server is running and reachable at the configured endpoint."),
    MODEL_UNAVAILABLE(true, "Pull the configured model or switch to one that is installed."),
    TIMEOUT(true, "Increase loadspec.backend.timeout-ms or use a smaller model."),
    RATE_LIMITED(true, "Wait before retrying or lower the request rate to the provider."),
    INVALID_RESPONSE(false, "Rephrase the input more explicitly; the deterministic parser will be used meanwhile."),
    RESOURCE_EXHAUSTED(true, "Raise loadspec.pool.max-connections or reduce concurrent parse calls."),
    SERVICE_UNAVAILABLE(true, "The backend is down or restarting; results will come from the deterministic parser."),
    AUTHENTICATION_FAILED(false, "Verify the API key in loadspec.backend.api-key."),
    UNKNOWN(false, "Inspect the logs with --verbose for details.");

    private final boolean retryable;
    private final String degradationHint;

    AiErrorType(boolean retryable, String degradationHint) {
        this.retryable = retryable;
        this.degradationHint = degradationHint;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String degradationHint() {
        return degradationHint;
    }
}
