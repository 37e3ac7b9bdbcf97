package com.loadspec.model.backend;

public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static TokenUsage of(Integer promptTokens, Integer completionTokens) {
        int prompt = promptTokens == null ? 0 : promptTokens;
        int completion = completionTokens == null ? 0 : completionTokens;
        return new TokenUsage(prompt, completion, prompt + completion);
    }
}
