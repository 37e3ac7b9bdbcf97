package com.loadspec.service.backend;

import com.loadspec.config.ParserProperties;
import com.loadspec.dto.llm.ChatCompletionRequest;
import com.loadspec.dto.llm.ChatCompletionResponse;
import com.loadspec.dto.llm.ChatMessage;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import com.loadspec.model.backend.ResponseFormat;
import com.loadspec.model.backend.ResponseMetadata;
import com.loadspec.model.backend.TokenUsage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Adapter for OpenAI-compatible chat completion APIs.
 */
@Slf4j
public class OpenAiBackend extends AbstractAiBackend {

    public static final String NAME = "openai";
    public static final String DEFAULT_ENDPOINT = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-3.5-turbo";

    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(5);

    public OpenAiBackend(ParserProperties.Backend config, WebClient webClient) {
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
            throw new AiServiceException(AiErrorType.AUTHENTICATION_FAILED, NAME, "No API key configured for OpenAI");
        }
        if (!healthCheck()) {
            throw new AiServiceException(AiErrorType.CONNECTION_FAILED, NAME, "OpenAI API is not reachable");
        }
    }

    @Override
    protected CompletionResponse doGenerate(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null) {
            messages.add(new ChatMessage("system", request.systemPrompt()));
        }
        messages.add(new ChatMessage("user", request.prompt()));

        ChatCompletionRequest body = new ChatCompletionRequest(model(request), messages);
        body.setTemperature(temperature(request));
        body.setMaxTokens(maxTokens(request));
        if (request.format() == ResponseFormat.JSON) {
            body.setResponseFormat(new ChatCompletionRequest.ResponseFormat("json_object"));
        }

        long started = System.currentTimeMillis();
        ChatCompletionResponse response = webClient.post()
                .uri("/chat/completions")
                .header("Authorization", "Bearer " + config.getApiKey())
                .body(Mono.just(body), ChatCompletionRequest.class)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .timeout(timeout())
                .block();

        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new AiServiceException(AiErrorType.INVALID_RESPONSE, NAME, "OpenAI returned no choices");
        }
        ChatCompletionResponse.Usage usage = response.getUsage();
        return new CompletionResponse(response.getChoices().get(0).getMessage().getContent(),
                response.getModel() != null ? response.getModel() : body.getModel(),
                usage == null ? TokenUsage.of(null, null) : TokenUsage.of(usage.getPromptTokens(), usage.getCompletionTokens()),
                new ResponseMetadata(NAME, System.currentTimeMillis() - started, false));
    }

    @Override
    public boolean healthCheck() {
        try {
            webClient.get()
                    .uri("/models")
                    .header("Authorization", "Bearer " + config.getApiKey())
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(HEALTH_TIMEOUT)
                    .block();
            return true;
        } catch (Exception e) {
            log.warn("OpenAI health check failed: {}", e.getMessage());
            return false;
        }
    }
}
