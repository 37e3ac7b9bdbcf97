package com.loadspec.config;

import com.loadspec.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Every tunable of the parsing pipeline, bound from {@code loadspec.*}.
 * <p>
 * Single-value bounds are enforced by Bean Validation during binding, so a bad value aborts startup
 * with Spring Boot's binding report. Relationships between values are checked in {@link #validate()}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "loadspec")
public class ParserProperties {

    @Valid
    private Backend backend = new Backend();

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Preprocessing preprocessing = new Preprocessing();

    @Valid
    private Confidence confidence = new Confidence();

    @Valid
    private Recovery recovery = new Recovery();

    @Valid
    private Correction correction = new Correction();

    /**
     * Cross-field checks that annotations cannot express.
     *
     * @throws InvalidConfigurationException listing every violated relationship.
     */
    @PostConstruct
    public void validate() {
        List<String> problems = new ArrayList<>();
        if (backend.getRetryBaseDelayMs() > backend.getRetryMaxDelayMs()) {
            problems.add("loadspec.backend.retry-base-delay-ms (" + backend.getRetryBaseDelayMs()
                    + ") must not exceed loadspec.backend.retry-max-delay-ms (" + backend.getRetryMaxDelayMs() + ")");
        }
        if (confidence.getFallbackFloor() > confidence.getFallbackCeiling()) {
            problems.add("loadspec.confidence.fallback-floor (" + confidence.getFallbackFloor()
                    + ") must not exceed loadspec.confidence.fallback-ceiling (" + confidence.getFallbackCeiling() + ")");
        }
        if (!"ollama".equals(backend.getProvider()) && (backend.getApiKey() == null || backend.getApiKey().isBlank())) {
            problems.add("loadspec.backend.api-key is required for provider '" + backend.getProvider()
                    + "' (set LOADSPEC_API_KEY)");
        }
        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException("Invalid load-spec configuration: " + String.join("; ", problems));
        }
    }

    @Data
    public static class Backend {

        @Pattern(regexp = "ollama|openai|claude", message = "must be one of: ollama, openai, claude")
        private String provider = "ollama";

        /** Blank means the provider's default endpoint. */
        private String endpoint = "";

        /** Blank means the provider's default model. */
        private String model = "";

        private String apiKey = "";

        /** Total attempts per completion, the first call included. */
        @Min(1)
        @Max(10)
        private int maxRetries = 3;

        @Min(1000)
        @Max(600000)
        private long timeoutMs = 30000;

        @Min(0)
        private long retryBaseDelayMs = 1000;

        @Min(0)
        private long retryMaxDelayMs = 10000;

        private boolean jitter = true;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.1;

        @Min(16)
        @Max(32000)
        private int maxTokens = 2000;

        private boolean autoPullModel = true;
    }

    @Data
    public static class Pool {

        @Min(1)
        @Max(100)
        private int maxConnections = 5;

        @Min(1)
        private long acquireTimeoutMs = 30000;

        @Min(0)
        private long healthCheckIntervalMs = 30000;

        @Min(100)
        private long healthCheckTimeoutMs = 5000;
    }

    @Data
    public static class Preprocessing {

        @Min(100)
        @Max(1000000)
        private int maxInputLength = 10000;
    }

    @Data
    public static class Confidence {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double aiFloor = 0.3;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackFloor = 0.1;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fallbackCeiling = 0.8;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lowConfidenceThreshold = 0.5;
    }

    @Data
    public static class Recovery {

        @Min(1)
        @Max(10)
        private int maxRetries = 3;

        @Min(0)
        private long retryDelayMs = 1000;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;

        private boolean enableFallback = true;

        private boolean enablePromptEnhancement = true;

        @Min(1)
        private long attemptCacheSize = 1000;

        @Min(1)
        private long attemptCacheTtlMinutes = 10;
    }

    @Data
    public static class Correction {

        @Min(0)
        @Max(5)
        private int maxRemoteRounds = 2;

        @Min(0)
        private int maxLocallyCorrectableErrors = 3;
    }

    /**
     * Convenience used where only a non-blank value makes sense.
     *
     * @param value    Configured value.
     * @param fallback Default when {@code value} is blank.
     * @return The effective value.
     */
    public static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
