package com.loadspec.model.parse;

import java.util.List;

/**
 * A backend-neutral instruction package. Adapters decide how to map it onto their wire format;
 * {@link #render(String)} gives the flattened single-string form.
 *
 * @param systemPrompt         Schema and format guidance.
 * @param contextualExamples   Examples ranked by relevance.
 * @param clarifications       One clarification per ambiguity plus format notes.
 * @param parsingInstructions  Directives derived from the context.
 * @param fallbackInstructions Defaults to use when the input says nothing.
 */
public record EnhancedPrompt(String systemPrompt,
                             List<PromptExample> contextualExamples,
                             List<String> clarifications,
                             List<String> parsingInstructions,
                             List<String> fallbackInstructions) {

    public EnhancedPrompt {
        contextualExamples = List.copyOf(contextualExamples);
        clarifications = List.copyOf(clarifications);
        parsingInstructions = List.copyOf(parsingInstructions);
        fallbackInstructions = List.copyOf(fallbackInstructions);
    }

    /**
     * Instruction text without the user input: system text, examples, clarifications and directives.
     *
     * @return The instruction block.
     */
    public String instructions() {
        StringBuilder sb = new StringBuilder(systemPrompt);
        if (!contextualExamples.isEmpty()) {
            sb.append("\n\nEXAMPLES:\n");
            for (int i = 0; i < contextualExamples.size(); i++) {
                PromptExample example = contextualExamples.get(i);
                sb.append("\nExample ").append(i + 1).append(" (").append(example.description()).append("):\n")
                        .append("Input: ").append(example.input()).append("\n")
                        .append("Output: ").append(example.output()).append("\n");
            }
        }
        if (!clarifications.isEmpty()) {
            sb.append("\nCLARIFICATIONS:\n");
            clarifications.forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        if (!parsingInstructions.isEmpty()) {
            sb.append("\nPARSING INSTRUCTIONS:\n");
            parsingInstructions.forEach(p -> sb.append("- ").append(p).append("\n"));
        }
        if (!fallbackInstructions.isEmpty()) {
            sb.append("\nDEFAULTS WHEN UNSPECIFIED:\n");
            fallbackInstructions.forEach(f -> sb.append("- ").append(f).append("\n"));
        }
        return sb.toString();
    }

    /**
     * Flattens the package into one prompt string ending with the user input.
     *
     * @param userInput The cleaned operator text.
     * @return The full prompt.
     */
    public String render(String userInput) {
        return instructions()
                + "\nUSER INPUT:\n" + userInput + "\n\n"
                + "Respond with valid JSON only. Do not include explanations or markdown formatting.";
    }
}
