package com.loadspec.model.backend;

import java.util.Map;

/**
 * A backend-neutral completion request. Adapters map {@code systemPrompt} and {@code prompt} onto
 * separate messages where their API supports it, or concatenate them otherwise.
 *
 * @param systemPrompt Instructions, may be {@code null}.
 * @param prompt       The user turn.
 * @param model        Model override, {@code null} for the configured model.
 * @param temperature  Sampling temperature, {@code null} for the configured value.
 * @param maxTokens    Output token cap, {@code null} for the configured value.
 * @param format       Desired response shape.
 * @param options      Provider-specific extras.
 */
public record CompletionRequest(String systemPrompt,
                                String prompt,
                                String model,
                                Double temperature,
                                Integer maxTokens,
                                ResponseFormat format,
                                Map<String, Object> options) {

    public CompletionRequest {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static CompletionRequest json(String systemPrompt, String prompt) {
        return new CompletionRequest(systemPrompt, prompt, null, null, null, ResponseFormat.JSON, Map.of());
    }

    public static CompletionRequest text(String prompt) {
        return new CompletionRequest(null, prompt, null, null, null, ResponseFormat.TEXT, Map.of());
    }

    public CompletionRequest withPrompt(String newPrompt) {
        return new CompletionRequest(systemPrompt, newPrompt, model, temperature, maxTokens, format, options);
    }
}
