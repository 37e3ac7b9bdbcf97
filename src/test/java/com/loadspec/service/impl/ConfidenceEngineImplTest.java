package com.loadspec.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.parse.StructuredData;
import com.loadspec.model.spec.HttpMethod;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceEngineImplTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final InputPreprocessorImpl preprocessor = new InputPreprocessorImpl(new ParserProperties());
    private final FormatDetectorImpl detector = new FormatDetectorImpl();
    private final ContextEnhancerImpl enhancer = new ContextEnhancerImpl();
    private final ConfidenceEngineImpl engine = new ConfidenceEngineImpl(new ParserProperties());

    private ParseContext context(String input) {
        String cleaned = preprocessor.sanitize(input);
        StructuredData data = preprocessor.extractStructuredData(cleaned);
        ParseContext context = enhancer.buildContext(input, cleaned, data, detector.detectFormat(cleaned, data));
        return enhancer.resolveAmbiguities(enhancer.inferMissingFields(context));
    }

    private static LoadTestSpec spec(TestType testType, HttpMethod method, String url, LoadPatternType pattern, int users) {
        LoadTestSpec spec = new LoadTestSpec();
        spec.setId("test_1_abcdefghi");
        spec.setTestType(testType);
        spec.setRequests(new ArrayList<>(List.of(new RequestSpec(method, url))));
        spec.setLoadPattern(new LoadPattern(pattern, users));
        spec.setDuration(TestDuration.seconds(30));
        return spec;
    }

    @Test
    void calculateConfidence_shouldRewardCompleteSpecAndPenalizeAmbiguities() {
        ParseContext context = context("GET https://api.example.com/users with 50 users for 2 minutes");
        LoadTestSpec spec = spec(TestType.STRESS, HttpMethod.GET, "https://api.example.com/users", LoadPatternType.RAMP_UP, 50);

        double confidence = engine.calculateConfidence(spec, context);

        double expected = Math.max(0.3, Math.min(1.0, context.confidence() + 0.3 - 0.05 * context.ambiguities().size()));
        assertThat(confidence).isCloseTo(expected, within(1e-9));
    }

    @Test
    void calculateConfidence_shouldNeverDropBelowAiFloor() {
        ParseContext context = context("something vague please");
        LoadTestSpec spec = new LoadTestSpec();

        assertThat(engine.calculateConfidence(spec, context)).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void deriveAssumptions_shouldListFieldsTheInputNeverMentioned() {
        ParseContext context = context("please run a load test");
        LoadTestSpec spec = spec(TestType.BASELINE, HttpMethod.GET, "/api/endpoint", LoadPatternType.CONSTANT, 10);

        List<Assumption> assumptions = engine.deriveAssumptions(spec, context);

        assertThat(assumptions).extracting(Assumption::field).contains("method", "url", "virtualUsers", "duration");
        assertThat(assumptions).filteredOn(a -> a.field().equals("url")).singleElement()
                .satisfies(a -> assertThat(a.alternatives()).isEqualTo(ContextEnhancerImpl.DEFAULT_BASE_URLS));
    }

    @Test
    void deriveAssumptions_shouldStayEmptyForFullyExplicitInput() {
        ParseContext context = context("stress test GET https://api.example.com/users with 50 users for 2 minutes ramp up");
        LoadTestSpec spec = spec(TestType.STRESS, HttpMethod.GET, "https://api.example.com/users", LoadPatternType.RAMP_UP, 50);

        assertThat(engine.deriveAssumptions(spec, context)).isEmpty();
    }

    @Test
    void generateWarnings_shouldFlagRiskyConfigurations() {
        ParseContext context = context("GET https://api.example.com/users with 500 users");
        LoadTestSpec spec = spec(TestType.BASELINE, HttpMethod.GET, "https://api.example.com/users", LoadPatternType.CONSTANT, 500);

        List<String> warnings = engine.generateWarnings(spec, context, 0.2);

        assertThat(warnings).contains(
                "Input had low confidence - please verify the generated specification",
                "API endpoint detected but no authentication headers found",
                "High user count with constant load - consider using ramp-up pattern");
    }

    @Test
    void generateWarnings_shouldNotFlagAuthenticatedEndpoints() {
        ParseContext context = context("GET https://api.example.com/users with 5 users for 1 minute");
        LoadTestSpec spec = spec(TestType.BASELINE, HttpMethod.GET, "https://api.example.com/users", LoadPatternType.CONSTANT, 5);
        spec.primaryRequest().getHeaders().put("Authorization", "Bearer token");

        assertThat(engine.generateWarnings(spec, context, 0.9))
                .doesNotContain("API endpoint detected but no authentication headers found");
    }

    @Test
    void generateSuggestions_shouldAdviseWithoutChangingSpec() {
        ParseContext context = context("POST https://api.example.com/orders");
        LoadTestSpec spec = spec(TestType.BASELINE, HttpMethod.POST, "https://api.example.com/orders", LoadPatternType.CONSTANT, 10);

        List<String> suggestions = engine.generateSuggestions(spec, context);

        assertThat(suggestions)
                .contains("Provide a JSON body for the POST request to https://api.example.com/orders")
                .contains("Specify the number of virtual users (e.g. 'with 50 users')");
        assertThat(spec.primaryRequest().hasPayload()).isFalse();
        assertThat(spec.primaryRequest().getHeaders()).isEmpty();
    }

    @Test
    void explain_shouldDescribeExtractionAndResolutions() throws Exception {
        ParseContext context = context("POST https://api.example.com/orders with 5 users {\"sku\":\"A1\"}");
        LoadTestSpec spec = spec(TestType.BASELINE, HttpMethod.POST, "https://api.example.com/orders", LoadPatternType.CONSTANT, 5);
        spec.primaryRequest().useLiteralBody(objectMapper.readTree("{\"sku\":\"A1\"}"));
        spec.primaryRequest().getHeaders().put("Content-Type", "application/json");

        ParseExplanation explanation = engine.explain(spec, context);

        assertThat(explanation.extractedComponents()).contains(
                "Methods: POST", "URLs: https://api.example.com/orders", "Body: literal JSON object", "User counts: 5");
        assertThat(explanation.ambiguityResolutions())
                .anyMatch(r -> r.startsWith("content-type: ") && r.endsWith("-> application/json"));
    }
}
