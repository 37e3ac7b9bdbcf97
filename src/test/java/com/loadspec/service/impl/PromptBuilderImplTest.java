package com.loadspec.service.impl;

import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.Ambiguity;
import com.loadspec.model.parse.EnhancedPrompt;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.PromptExample;
import com.loadspec.model.parse.StructuredData;
import org.junit.jupiter.api.Test;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PromptBuilderImplTest {

    private final InputPreprocessorImpl preprocessor = new InputPreprocessorImpl(new ParserProperties());
    private final FormatDetectorImpl detector = new FormatDetectorImpl();
    private final ContextEnhancerImpl enhancer = new ContextEnhancerImpl();
    private final PromptBuilderImpl promptBuilder = new PromptBuilderImpl();

    private ParseContext context(String input) {
        String cleaned = preprocessor.sanitize(input);
        StructuredData data = preprocessor.extractStructuredData(cleaned);
        ParseContext context = enhancer.buildContext(input, cleaned, data, detector.detectFormat(cleaned, data));
        return enhancer.resolveAmbiguities(enhancer.inferMissingFields(context));
    }

    @Test
    void buildPrompt_shouldDirectBackendToKeepLiteralBody() {
        ParseContext context = context("POST https://api.example.com/sync with 5 users {\"requestId\":\"r-1\",\"payload\":[{\"externalId\":\"X\"}]}");

        EnhancedPrompt prompt = promptBuilder.buildPrompt(context);

        assertThat(prompt.parsingInstructions())
                .contains("Use HTTP method: POST", "Target URL: https://api.example.com/sync", "User count: 5")
                .contains(PromptBuilderImpl.LITERAL_BODY_DIRECTIVE);
        assertThat(prompt.render(context.cleanedInput()))
                .contains("PARSING INSTRUCTIONS:")
                .contains("USER INPUT:\n" + context.cleanedInput())
                .endsWith("Respond with valid JSON only. Do not include explanations or markdown formatting.");
    }

    @Test
    void selectExamples_shouldRankSpikeExampleFirstForSpikeInput() {
        List<PromptExample> examples = promptBuilder.selectExamples(
                context("Spike test with 1000 requests in 10 seconds to GET /api/users"));

        assertThat(examples).isNotEmpty().hasSizeLessThanOrEqualTo(5);
        assertThat(examples.get(0).input()).startsWith("Spike test");
        assertThat(examples.get(0).relevance()).isCloseTo(0.8, within(1e-9));
        assertThat(examples).extracting(PromptExample::input).doesNotHaveDuplicates();
    }

    @Test
    void buildPrompt_shouldAddDefensiveInstructionsForVagueInput() {
        ParseContext context = context("something vague please");

        EnhancedPrompt prompt = promptBuilder.buildPrompt(context);

        assertThat(context.ambiguities()).hasSizeGreaterThan(3);
        assertThat(prompt.fallbackInstructions())
                .contains("Very low confidence input: use a minimal viable test configuration.",
                        "Highly ambiguous input: get the method and URL right before anything else.");
        assertThat(prompt.systemPrompt()).contains("low confidence").contains("Ambiguity handling:");
        assertThat(prompt.clarifications()).anyMatch(c -> c.startsWith("HTTP method unclear. Use GET"));
    }

    @Test
    void buildCorrectionPrompt_shouldListErrorsPreviousResponseAndInput() {
        ParseContext context = context("GET https://api.example.com/users");

        String prompt = promptBuilder.buildCorrectionPrompt(context, "{\"requests\":[]}",
                List.of("requests must not be empty"));

        assertThat(prompt)
                .contains("- requests must not be empty")
                .contains("PREVIOUS RESPONSE:\n{\"requests\":[]}")
                .contains("ORIGINAL INPUT:\nGET https://api.example.com/users")
                .doesNotContain(PromptBuilderImpl.LITERAL_BODY_DIRECTIVE);
    }

    @Test
    void enhanceWithError_shouldAppendInstructionAndKeepTheRest() {
        EnhancedPrompt prompt = promptBuilder.buildPrompt(context("GET https://api.example.com/users"));

        EnhancedPrompt enhanced = promptBuilder.enhanceWithError(prompt, "missing duration");

        assertThat(enhanced.parsingInstructions()).hasSize(prompt.parsingInstructions().size() + 1);
        assertThat(enhanced.parsingInstructions().get(enhanced.parsingInstructions().size() - 1))
                .startsWith("A previous attempt failed with: missing duration");
        assertThat(enhanced.systemPrompt()).isEqualTo(prompt.systemPrompt());
        assertThat(enhanced.contextualExamples()).isEqualTo(prompt.contextualExamples());
    }

    @Test
    void clarify_shouldPreferFirstCandidate() {
        String text = PromptBuilderImpl.clarify(new Ambiguity("url",
                List.of("https://a.example.com", "https://b.example.com"), "Multiple URLs found"));

        assertThat(text).isEqualTo("URL incomplete or ambiguous (Multiple URLs found). Use https://a.example.com unless another candidate fits better.");
    }
}
