package com.loadspec.model.parse;

/**
 * A worked input/output pair shown to the backend.
 *
 * @param input       Sample operator text.
 * @param output      The expected JSON specification.
 * @param description What the example demonstrates.
 * @param relevance   Relevance to the current input in {@code [0, 1]}.
 */
public record PromptExample(String input, String output, String description, double relevance) {

    public PromptExample withRelevance(double newRelevance) {
        return new PromptExample(input, output, description, newRelevance);
    }
}
