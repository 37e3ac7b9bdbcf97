package com.loadspec.service.api;

import com.loadspec.model.parse.EnhancedPrompt;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.PromptExample;
import java.util.List;

public interface PromptBuilder {

    /**
     * Composes the backend-neutral instruction package for a context.
     *
     * @param context The refined parse context.
     * @return The prompt package.
     */
    EnhancedPrompt buildPrompt(ParseContext context);

    /**
     * Picks the worked examples most relevant to the context, at most five.
     *
     * @param context The refined parse context.
     * @return Examples ordered by descending relevance.
     */
    List<PromptExample> selectExamples(ParseContext context);

    /**
     * Builds the follow-up prompt asking the backend to fix a response that failed validation.
     *
     * @param context          The parse context.
     * @param previousResponse The rejected response text.
     * @param errors           The validation errors to fix.
     * @return The corrective prompt.
     */
    String buildCorrectionPrompt(ParseContext context, String previousResponse, List<String> errors);

    /**
     * Extends a prompt with the failure of a previous attempt so the backend can avoid repeating it.
     *
     * @param prompt        The original prompt package.
     * @param previousError Description of what went wrong.
     * @return A new package carrying the extra directive.
     */
    EnhancedPrompt enhanceWithError(EnhancedPrompt prompt, String previousError);
}
