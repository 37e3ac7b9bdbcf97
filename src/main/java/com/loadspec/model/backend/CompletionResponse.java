package com.loadspec.model.backend;

/**
 * A completion returned by a backend adapter.
 *
 * @param text     The generated text, never blank.
 * @param model    The model that produced it.
 * @param usage    Token counts as reported by the provider.
 * @param metadata Provider name, round-trip duration and cache flag.
 */
public record CompletionResponse(String text, String model, TokenUsage usage, ResponseMetadata metadata) {
}
