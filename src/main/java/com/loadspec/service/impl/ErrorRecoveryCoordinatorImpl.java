package com.loadspec.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.recovery.ErrorLevel;
import com.loadspec.model.recovery.ParseError;
import com.loadspec.model.recovery.RecoveryResult;
import com.loadspec.model.recovery.RecoveryStrategy;
import com.loadspec.model.recovery.StrategyType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.service.api.ErrorRecoveryCoordinator;
import com.loadspec.service.api.RecoveryExecutor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies pipeline failures and drives recovery strategies. Attempt counters are kept per
 * (level, type, input prefix) key in a bounded cache so repeated failures on the same input stop
 * being retried once the budget is spent.
 */
@Service
@Slf4j
public class ErrorRecoveryCoordinatorImpl implements ErrorRecoveryCoordinator {

    static final String MAX_RETRIES_EXCEEDED = "max_retries_exceeded";
    static final double FALLBACK_CONFIDENCE = 0.6;
    private static final double FALLBACK_MARGIN = 0.1;
    private static final int KEY_INPUT_PREFIX = 100;
    private static final long MAX_RETRY_DELAY_MS = 5000;

    private final ParserProperties.Recovery config;
    private final Cache<String, Integer> attempts;

    public ErrorRecoveryCoordinatorImpl(ParserProperties properties) {
        this.config = properties.getRecovery();
        this.attempts = Caffeine.newBuilder()
                .maximumSize(config.getAttemptCacheSize())
                .expireAfterWrite(Duration.ofMinutes(config.getAttemptCacheTtlMinutes()))
                .build();
    }

    @Override
    public ParseError classify(Throwable error, ErrorLevel level) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        String type = determineType(error, message, level);
        List<String> suggestions = new ArrayList<>(suggestionsFor(type));
        if (error instanceof AiServiceException aiError) {
            suggestions.add(aiError.getType().degradationHint());
        }
        RecoveryStrategy strategy = primaryStrategy(type, level);
        log.debug("Classified {} failure as {} -> {}", level, type, strategy.strategy().label());
        return new ParseError(level, type, message, suggestions, strategy);
    }

    @Override
    public List<RecoveryStrategy> strategiesFor(ParseError error) {
        Stream<RecoveryStrategy> candidates = Stream.of(error.recoveryStrategy());
        if (config.isEnableFallback() && error.level() != ErrorLevel.FALLBACK
                && error.recoveryStrategy().strategy() != StrategyType.FALLBACK) {
            double ceiling = error.recoveryStrategy().confidence() - FALLBACK_MARGIN;
            candidates = Stream.concat(candidates,
                    Stream.of(fallbackStrategy(Math.max(0.05, Math.min(FALLBACK_CONFIDENCE, ceiling)))));
        }
        return candidates
                .filter(RecoveryStrategy::canRecover)
                .sorted(Comparator.comparingDouble(RecoveryStrategy::confidence).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public RecoveryResult recover(ParseError error, String input, RecoveryExecutor executor) {
        String key = recoveryKey(error, input);
        int used = attempts.asMap().getOrDefault(key, 0);
        if (used >= config.getMaxRetries()) {
            log.warn("Recovery budget spent for {} ({} attempts)", key, used);
            return new RecoveryResult(false, null, error, used, List.of(MAX_RETRIES_EXCEEDED), null, 0);
        }

        List<String> path = new ArrayList<>();
        ParseError lastError = error;
        for (RecoveryStrategy strategy : strategiesFor(error)) {
            int attempt = used + path.size() + 1;
            path.add(strategy.strategy().label());
            attempts.put(key, attempt);
            try {
                if (strategy.strategy() == StrategyType.RETRY && strategy.retryDelayMs() > 0) {
                    Thread.sleep(strategy.retryDelayMs());
                }
                LoadTestSpec spec = executor.execute(strategy);
                attempts.invalidate(key);
                log.info("Recovered from {} via {}", error.type(), strategy.strategy().label());
                return new RecoveryResult(true, spec, null, attempt, path, strategy.strategy(), strategy.confidence());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError = classify(e, error.level());
                break;
            } catch (Exception e) {
                log.debug("Recovery strategy {} failed: {}", strategy.strategy().label(), e.getMessage());
                lastError = classify(e, error.level());
            }
        }

        int total = used + path.size();
        attempts.put(key, total);
        return new RecoveryResult(false, null, lastError, total, path, null, 0);
    }

    /**
     * Current attempt count for a key, 0 when none is recorded.
     */
    int attemptsFor(ParseError error, String input) {
        return attempts.asMap().getOrDefault(recoveryKey(error, input), 0);
    }

    void resetAttempts() {
        attempts.invalidateAll();
    }

    static String recoveryKey(ParseError error, String input) {
        String prefix = input == null ? "" : input.substring(0, Math.min(KEY_INPUT_PREFIX, input.length()));
        return error.level().name().toLowerCase(Locale.ROOT) + ":" + error.type() + ":" + prefix;
    }

    private static String determineType(Throwable error, String message, ErrorLevel level) {
        String text = message.toLowerCase(Locale.ROOT);
        switch (level) {
            case INPUT:
                if (text.contains("invalid format")) {
                    return "invalid_format";
                }
                if (text.contains("missing")) {
                    return "missing_data";
                }
                if (text.contains("malformed")) {
                    return "malformed_input";
                }
                return "input_processing_error";
            case AI:
                if (error instanceof AiServiceException aiError) {
                    switch (aiError.getType()) {
                        case TIMEOUT:
                            return "ai_timeout";
                        case RATE_LIMITED:
                            return "rate_limit";
                        case INVALID_RESPONSE:
                            return "invalid_ai_response";
                        case CONNECTION_FAILED:
                        case SERVICE_UNAVAILABLE:
                            return "network_error";
                        default:
                            break;
                    }
                }
                if (text.contains("timeout")) {
                    return "ai_timeout";
                }
                if (text.contains("rate limit")) {
                    return "rate_limit";
                }
                if (text.contains("invalid response")) {
                    return "invalid_ai_response";
                }
                if (text.contains("network")) {
                    return "network_error";
                }
                return "ai_processing_error";
            case VALIDATION:
                if (text.contains("schema")) {
                    return "schema_validation_error";
                }
                if (text.contains("required field")) {
                    return "missing_required_field";
                }
                if (text.contains("invalid value")) {
                    return "invalid_field_value";
                }
                return "validation_error";
            default:
                return "fallback_error";
        }
    }

    private static List<String> suggestionsFor(String type) {
        switch (type) {
            case "invalid_format":
                return List.of("Try providing input in a more structured format",
                        "Include clear HTTP method and URL");
            case "missing_data":
                return List.of("Provide complete request information",
                        "Include required fields like URL and method");
            case "rate_limit":
                return List.of("Wait a moment before retrying", "Consider using a different AI provider");
            case "network_error":
                return List.of("Check your internet connection", "Verify AI provider configuration");
            case "invalid_ai_response":
                return List.of("The AI response was malformed - retrying with enhanced prompt");
            default:
                return List.of("Review input format and try again", "Check system logs for more details");
        }
    }

    private RecoveryStrategy primaryStrategy(String type, ErrorLevel level) {
        switch (type) {
            case "rate_limit":
                return new RecoveryStrategy(true, StrategyType.RETRY, 0.9, 0.9,
                        config.getMaxRetries(), config.getRetryDelayMs() * 2);
            case "network_error":
            case "ai_timeout":
                return retryStrategy(0.8, 1);
            case "invalid_ai_response":
                return promptEnhancementStrategy(0.7);
            case "malformed_input":
            case "invalid_format":
                return fallbackStrategy(0.8);
            case "missing_data":
                return promptEnhancementStrategy(0.6);
            default:
                break;
        }
        switch (level) {
            case INPUT:
                return fallbackStrategy(0.6);
            case AI:
                return retryStrategy(0.5, 1);
            case VALIDATION:
                return promptEnhancementStrategy(0.5);
            default:
                return new RecoveryStrategy(false, StrategyType.USER_INPUT, 0, 0, 0, 0);
        }
    }

    private RecoveryStrategy retryStrategy(double baseConfidence, int attempt) {
        double confidence = Math.max(0.1, baseConfidence - attempt * 0.1);
        long delay = Math.min(MAX_RETRY_DELAY_MS, config.getRetryDelayMs() * (1L << (attempt - 1)));
        return new RecoveryStrategy(attempt <= config.getMaxRetries(), StrategyType.RETRY, confidence, confidence,
                config.getMaxRetries(), delay);
    }

    private RecoveryStrategy promptEnhancementStrategy(double confidence) {
        return new RecoveryStrategy(config.isEnablePromptEnhancement(), StrategyType.ENHANCE_PROMPT,
                confidence, confidence, 2, 0);
    }

    private RecoveryStrategy fallbackStrategy(double confidence) {
        return new RecoveryStrategy(config.isEnableFallback(), StrategyType.FALLBACK, confidence, confidence, 1, 0);
    }
}
