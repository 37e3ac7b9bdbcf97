package com.loadspec.service.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.ErrorStatistics;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps transport and provider failures onto {@link AiErrorType}s and keeps per-backend error statistics.
 * <p>
 * Classification looks through the whole cause chain, so a timeout wrapped by Reactor or by
 * {@link WebClientRequestException} is still reported as a timeout. Statistics hold a count and the
 * last occurrence per type, plus the most recent {@value #RECENT_ERRORS} error descriptions.
 */
public class AiErrorClassifier {

    static final int RECENT_ERRORS = 100;

    private final Map<AiErrorType, Long> counts = new EnumMap<>(AiErrorType.class);
    private final Map<AiErrorType, Instant> lastOccurrence = new EnumMap<>(AiErrorType.class);
    private final Deque<String> recent = new ArrayDeque<>();

    /**
     * @param error    Whatever the transport or adapter threw.
     * @param provider Backend name, carried on the result.
     * @return {@code error} itself when it is already classified, otherwise a new classified exception.
     */
    public AiServiceException classify(Throwable error, String provider) {
        if (error instanceof AiServiceException classified) {
            return classified;
        }
        WebClientResponseException response = causeOf(error, WebClientResponseException.class);
        if (response != null) {
            int status = response.getStatusCode().value();
            return new AiServiceException(fromStatus(status), provider,
                    "HTTP " + status + " from " + provider + ": " + response.getStatusText(), status, error);
        }
        if (causeOf(error, TimeoutException.class) != null
                || causeOf(error, SocketTimeoutException.class) != null
                || causeOf(error, io.netty.handler.timeout.TimeoutException.class) != null) {
            return new AiServiceException(AiErrorType.TIMEOUT, provider, provider + " did not answer in time", null, error);
        }
        if (causeOf(error, ConnectException.class) != null
                || causeOf(error, UnknownHostException.class) != null
                || causeOf(error, WebClientRequestException.class) != null) {
            return new AiServiceException(AiErrorType.CONNECTION_FAILED, provider,
                    "Cannot reach " + provider + ": " + rootMessage(error), null, error);
        }
        if (causeOf(error, JsonProcessingException.class) != null || causeOf(error, DecodingException.class) != null) {
            return new AiServiceException(AiErrorType.INVALID_RESPONSE, provider,
                    "Unreadable response from " + provider + ": " + rootMessage(error), null, error);
        }
        return new AiServiceException(fromMessage(rootMessage(error)), provider, rootMessage(error), null, error);
    }

    static AiErrorType fromStatus(int status) {
        if (status == 401 || status == 403) {
            return AiErrorType.AUTHENTICATION_FAILED;
        }
        if (status == 429) {
            return AiErrorType.RATE_LIMITED;
        }
        if (status == 404) {
            return AiErrorType.MODEL_UNAVAILABLE;
        }
        if (status >= 500) {
            return AiErrorType.SERVICE_UNAVAILABLE;
        }
        return AiErrorType.UNKNOWN;
    }

    static AiErrorType fromMessage(String message) {
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return AiErrorType.TIMEOUT;
        }
        if (lower.contains("connection refused") || lower.contains("econnrefused")) {
            return AiErrorType.CONNECTION_FAILED;
        }
        if (lower.contains("rate limit")) {
            return AiErrorType.RATE_LIMITED;
        }
        if (lower.contains("model")) {
            return AiErrorType.MODEL_UNAVAILABLE;
        }
        if (lower.contains("parse") || lower.contains("json")) {
            return AiErrorType.INVALID_RESPONSE;
        }
        return AiErrorType.UNKNOWN;
    }

    public synchronized void record(AiServiceException error) {
        counts.merge(error.getType(), 1L, Long::sum);
        lastOccurrence.put(error.getType(), Instant.now());
        if (recent.size() == RECENT_ERRORS) {
            recent.removeFirst();
        }
        recent.addLast(Instant.now() + " " + error.getType() + ": " + error.getMessage());
    }

    public synchronized ErrorStatistics statistics() {
        return new ErrorStatistics(counts, lastOccurrence, new ArrayList<>(recent));
    }

    private static <T extends Throwable> T causeOf(Throwable error, Class<T> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : error.getMessage();
        return message != null ? message : root.getClass().getSimpleName();
    }
}
