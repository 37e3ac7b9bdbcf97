package com.loadspec.service.backend;

import com.loadspec.config.HttpClientFactory;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.InvalidConfigurationException;
import com.loadspec.service.api.AiBackend;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Creates the backend adapter named by {@code loadspec.backend.provider}.
 */
@Component
@Slf4j
public class AiBackendFactory {

    public static final List<String> SUPPORTED_PROVIDERS = List.of(
            OllamaBackend.NAME, OpenAiBackend.NAME, ClaudeBackend.NAME);

    private final ParserProperties properties;
    private final HttpClientFactory httpClientFactory;

    public AiBackendFactory(ParserProperties properties, HttpClientFactory httpClientFactory) {
        this.properties = properties;
        this.httpClientFactory = httpClientFactory;
    }

    /**
     * @return A new, not yet initialized adapter.
     * @throws InvalidConfigurationException for an unknown provider or a hosted provider without API key.
     */
    public AiBackend create() {
        ParserProperties.Backend backend = properties.getBackend();
        String provider = backend.getProvider() == null ? "" : backend.getProvider().trim();
        Duration timeout = Duration.ofMillis(backend.getTimeoutMs());

        AiBackend created = switch (provider) {
            case OllamaBackend.NAME -> new OllamaBackend(backend, properties.getPool(),
                    httpClientFactory.create(endpoint(backend, OllamaBackend.DEFAULT_ENDPOINT), timeout));
            case OpenAiBackend.NAME -> {
                requireApiKey(backend, provider);
                yield new OpenAiBackend(backend,
                        httpClientFactory.create(endpoint(backend, OpenAiBackend.DEFAULT_ENDPOINT), timeout));
            }
            case ClaudeBackend.NAME -> {
                requireApiKey(backend, provider);
                yield new ClaudeBackend(backend,
                        httpClientFactory.create(endpoint(backend, ClaudeBackend.DEFAULT_ENDPOINT), timeout));
            }
            default -> throw new InvalidConfigurationException("Unsupported AI provider '" + provider
                    + "'. Supported providers: " + String.join(", ", SUPPORTED_PROVIDERS));
        };
        log.info("Using {} backend at {}", created.name(), endpoint(backend, defaultEndpoint(provider)));
        return created;
    }

    private static String endpoint(ParserProperties.Backend backend, String fallback) {
        String endpoint = ParserProperties.orDefault(backend.getEndpoint(), fallback);
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }

    private static String defaultEndpoint(String provider) {
        return switch (provider) {
            case OpenAiBackend.NAME -> OpenAiBackend.DEFAULT_ENDPOINT;
            case ClaudeBackend.NAME -> ClaudeBackend.DEFAULT_ENDPOINT;
            default -> OllamaBackend.DEFAULT_ENDPOINT;
        };
    }

    private static void requireApiKey(ParserProperties.Backend backend, String provider) {
        if (backend.getApiKey() == null || backend.getApiKey().isBlank()) {
            throw new InvalidConfigurationException("Provider '" + provider
                    + "' requires loadspec.backend.api-key (or LOADSPEC_API_KEY)");
        }
    }
}
