package com.loadspec.exception;

import lombok.Getter;

/**
 * A classified failure talking to an AI completion backend.
 */
@Getter
public class AiServiceException extends ParserException {

    private final AiErrorType type;
    private final boolean retryable;
    private final Integer statusCode;
    private final String provider;

    public AiServiceException(AiErrorType type, String provider, String message) {
        this(type, provider, message, null, null);
    }

    public AiServiceException(AiErrorType type, String provider, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = type.isRetryable();
    }

    /**
     * Authentication failures need operator action before anything else works.
     *
     * @return {@code true} for {@link AiErrorType#AUTHENTICATION_FAILED}.
     */
    public boolean isCritical() {
        return type == AiErrorType.AUTHENTICATION_FAILED;
    }
}
