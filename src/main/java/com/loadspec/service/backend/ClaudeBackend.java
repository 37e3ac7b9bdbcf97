package com.loadspec.service.backend;

import com.loadspec.config.ParserProperties;
import com.loadspec.dto.llm.ChatMessage;
import com.loadspec.dto.llm.ClaudeMessagesRequest;
import com.loadspec.dto.llm.ClaudeMessagesResponse;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import com.loadspec.model.backend.ResponseFormat;
import com.loadspec.model.backend.ResponseMetadata;
import com.loadspec.model.backend.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Adapter for the Anthropic Messages API. The API has no JSON mode, so JSON requests get an extra
 * line in the system prompt instead.
 */
@Slf4j
public class ClaudeBackend extends AbstractAiBackend {

    public static final String NAME = "claude";
    public static final String DEFAULT_ENDPOINT = "https://api.anthropic.com";
    public static final String DEFAULT_MODEL = "claude-3-haiku-20240307";
    static final String API_VERSION = "2023-06-01";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    public ClaudeBackend(ParserProperties.Backend config, WebClient webClient) {
        super(config, webClient);
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
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new AiServiceException(AiErrorType.AUTHENTICATION_FAILED, NAME, "No API key configured for Claude");
        }
        if (!healthCheck()) {
            throw new AiServiceException(AiErrorType.CONNECTION_FAILED, NAME, "Claude API is not reachable");
        }
    }

    @Override
    protected CompletionResponse doGenerate(CompletionRequest request) {
        String system = request.systemPrompt();
        if (request.format() == ResponseFormat.JSON) {
            system = (system == null ? "" : system + "\n\n") + "Respond with a single JSON object and nothing else.";
        }
        ClaudeMessagesRequest body = new ClaudeMessagesRequest();
        body.setModel(model(request));
        body.setSystem(system);
        body.setMessages(List.of(new ChatMessage("user", request.prompt())));
        body.setMaxTokens(maxTokens(request));
        body.setTemperature(temperature(request));

        long started = System.currentTimeMillis();
        ClaudeMessagesResponse response = send(body, timeout());
        if (response == null || response.getContent() == null || response.getContent().isEmpty()) {
            throw new AiServiceException(AiErrorType.INVALID_RESPONSE, NAME, "Claude returned no content");
        }
        String text = response.getContent().stream()
                .filter(block -> "text".equals(block.getType()))
                .map(ClaudeMessagesResponse.ContentBlock::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
        ClaudeMessagesResponse.Usage usage = response.getUsage();
        return new CompletionResponse(text,
                response.getModel() != null ? response.getModel() : body.getModel(),
                usage == null ? TokenUsage.of(null, null) : TokenUsage.of(usage.getInputTokens(), usage.getOutputTokens()),
                new ResponseMetadata(NAME, System.currentTimeMillis() - started, false));
    }

    /**
     * Sends a one-token message; there is no dedicated health endpoint.
     */
    @Override
    public boolean healthCheck() {
        ClaudeMessagesRequest probe = new ClaudeMessagesRequest();
        probe.setModel(model(null));
        probe.setMessages(List.of(new ChatMessage("user", "ping")));
        probe.setMaxTokens(1);
        try {
            return send(probe, HEALTH_TIMEOUT) != null;
        } catch (Exception e) {
            log.warn("Claude health check failed: {}", e.getMessage());
            return false;
        }
    }

    private ClaudeMessagesResponse send(ClaudeMessagesRequest body, Duration timeout) {
        return webClient.post()
                .uri("/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", API_VERSION)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ClaudeMessagesResponse.class)
                .timeout(timeout)
                .block();
    }
}
