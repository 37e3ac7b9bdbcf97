package com.loadspec.service.impl;

import com.loadspec.model.parse.Ambiguity;
import com.loadspec.model.parse.EnhancedPrompt;
import com.loadspec.model.parse.ExtractedComponents;
import com.loadspec.model.parse.InferredFields;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.PromptExample;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.TestType;
import com.loadspec.service.api.PromptBuilder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Composes the instruction package sent to the AI backend.
 * <p>
 * The package is assembled from:
 * <ul>
 *   <li>A system prompt describing the output schema, specialised for the detected input format.</li>
 *   <li>Up to five worked examples chosen by rule and ranked by relevance to the context.</li>
 *   <li>One clarification per ambiguity, telling the model which default to prefer.</li>
 *   <li>Directives built from what was already extracted, including the rule that a literal JSON
 *       body is passed through verbatim.</li>
 *   <li>Fallback defaults for anything the input does not say.</li>
 * </ul>
 */
@Service
@Slf4j
public class PromptBuilderImpl implements PromptBuilder {

    private static final int MAX_EXAMPLES = 5;
    private static final int EXAMPLES_PER_RULE = 2;

    static final String LITERAL_BODY_DIRECTIVE = "The input contains a complete literal JSON object. Use it verbatim as "
            + "requests[0].body. Never decompose it into payload template variables and never rename or drop its fields.";

    private static final String BASE_PROMPT = "You are the assistant of a load testing tool. You convert operator input "
            + "(natural language, curl commands, raw HTTP requests or JSON mixed with text) into a structured load test specification.\n\n"
            + "Extract:\n"
            + "- HTTP method, URL, headers and request body\n"
            + "- Load pattern (constant, ramp-up, spike, step)\n"
            + "- Test duration and virtual users or requests per second\n"
            + "- Test type (baseline, spike, stress, endurance, volume)\n\n"
            + "Respond with ONE JSON object of this shape:\n"
            + "{\n"
            + "  \"id\": \"string\",\n"
            + "  \"name\": \"string\",\n"
            + "  \"description\": \"string\",\n"
            + "  \"testType\": \"baseline | spike | stress | endurance | volume\",\n"
            + "  \"requests\": [\n"
            + "    {\n"
            + "      \"method\": \"GET | POST | PUT | DELETE | PATCH | HEAD | OPTIONS\",\n"
            + "      \"url\": \"absolute URL or path starting with /\",\n"
            + "      \"headers\": { \"Header-Name\": \"value\" },\n"
            + "      \"body\": { \"literal\": \"JSON body, only when the input gives a complete object\" },\n"
            + "      \"payload\": { \"template\": \"{\\\"field\\\": \\\"{{variable}}\\\"}\", \"variables\": [ { \"name\": \"variable\", \"type\": \"random_id | uuid | timestamp | random_string | sequence | literal\", \"parameters\": {} } ] }\n"
            + "    }\n"
            + "  ],\n"
            + "  \"loadPattern\": { \"type\": \"constant | ramp-up | spike | step\", \"virtualUsers\": 10, \"requestsPerSecond\": null, \"rampUpTime\": { \"value\": 1, \"unit\": \"minutes\" } },\n"
            + "  \"duration\": { \"value\": 30, \"unit\": \"seconds | minutes | hours\" }\n"
            + "}\n"
            + "A request has either \"body\" or \"payload\", never both. "
            + "loadPattern must contain virtualUsers or requestsPerSecond. duration.value must be positive.";

    private static final List<String> AMBIGUITY_HANDLING = List.of(
            "When several values are possible, choose the most common or reasonable one.",
            "Prefer explicit values over inferred ones.",
            "Use context clues to resolve ambiguities.");

    private static final List<String> BASE_FALLBACK_INSTRUCTIONS = List.of(
            "Extract whatever components are clearly identifiable.",
            "Use 10 virtual users, a constant load pattern and 30 seconds when nothing is specified.",
            "Default to GET when no method or body is given, POST when a body is given.",
            "Keep the JSON structure valid even when data is incomplete.");

    private final List<LibraryEntry> library = createExampleLibrary();
    private final Map<Predicate<ParseContext>, Predicate<LibraryEntry>> selectionRules = createSelectionRules();

    @Override
    public EnhancedPrompt buildPrompt(ParseContext context) {
        String systemPrompt = buildSystemPrompt(context);
        List<PromptExample> examples = selectExamples(context);
        List<String> clarifications = buildClarifications(context);
        List<String> instructions = buildParsingInstructions(context);
        List<String> fallback = buildFallbackInstructions(context);
        log.debug("Composed prompt with {} examples, {} clarifications, {} directives",
                examples.size(), clarifications.size(), instructions.size());
        return new EnhancedPrompt(systemPrompt, examples, clarifications, instructions, fallback);
    }

    @Override
    public List<PromptExample> selectExamples(ParseContext context) {
        Map<String, PromptExample> selected = new LinkedHashMap<>();
        selectionRules.forEach((condition, filter) -> {
            if (condition.test(context)) {
                library.stream()
                        .filter(filter)
                        .map(entry -> entry.example().withRelevance(relevance(entry, context)))
                        .sorted(Comparator.comparingDouble(PromptExample::relevance).reversed())
                        .limit(EXAMPLES_PER_RULE)
                        .forEach(example -> selected.putIfAbsent(example.input(), example));
            }
        });
        return selected.values().stream()
                .sorted(Comparator.comparingDouble(PromptExample::relevance).reversed())
                .limit(MAX_EXAMPLES)
                .collect(Collectors.toList());
    }

    @Override
    public String buildCorrectionPrompt(ParseContext context, String previousResponse, List<String> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("Your previous response could not be used as a load test specification.\n\n")
                .append("ERRORS:\n");
        errors.forEach(e -> sb.append("- ").append(e).append("\n"));
        sb.append("\nPREVIOUS RESPONSE:\n").append(previousResponse).append("\n\n")
                .append("ORIGINAL INPUT:\n").append(context.cleanedInput()).append("\n\n");
        if (context.inferredFields().requestBody() != null) {
            sb.append(LITERAL_BODY_DIRECTIVE).append("\n\n");
        }
        sb.append("Return the complete corrected JSON object. Respond with valid JSON only.");
        return sb.toString();
    }

    @Override
    public EnhancedPrompt enhanceWithError(EnhancedPrompt prompt, String previousError) {
        List<String> instructions = new ArrayList<>(prompt.parsingInstructions());
        instructions.add("A previous attempt failed with: " + previousError
                + ". Return a single complete JSON object with every required field filled.");
        return new EnhancedPrompt(prompt.systemPrompt(), prompt.contextualExamples(), prompt.clarifications(),
                instructions, prompt.fallbackInstructions());
    }

    private String buildSystemPrompt(ParseContext context) {
        StringBuilder sb = new StringBuilder(BASE_PROMPT);
        sb.append("\n\nFormat-specific instructions: ").append(formatInstructions(context));
        if (context.confidence() < 0.5) {
            sb.append("\n\nNote: the input has low confidence (")
                    .append(String.format("%.2f", context.confidence()))
                    .append("). Make conservative assumptions and use defaults where necessary.");
        }
        if (!context.ambiguities().isEmpty()) {
            sb.append("\n\nAmbiguity handling: ").append(String.join(" ", AMBIGUITY_HANDLING));
        }
        return sb.toString();
    }

    private static String formatInstructions(ParseContext context) {
        return switch (context.format()) {
            case NATURAL_LANGUAGE -> "Focus on the intent of the natural language description and infer technical details from context clues.";
            case MIXED_STRUCTURED -> "Parse both the structured fragments and the prose. Explicit structured data wins over inferred values.";
            case CURL_COMMAND -> "Extract every parameter of the curl command: -X method, -H headers, -d/--data body and the URL.";
            case HTTP_RAW -> "Parse the raw HTTP request: request line for method and path, Host header for the base URL, header lines, then the body.";
            case JSON_WITH_TEXT -> "Treat the JSON block as the request body and use the surrounding text for load configuration.";
            case CONCATENATED_REQUESTS -> "The input describes several requests. Emit one entry in requests per request, in input order.";
        };
    }

    private List<String> buildClarifications(ParseContext context) {
        List<String> clarifications = new ArrayList<>();
        for (Ambiguity ambiguity : context.ambiguities()) {
            clarifications.add(clarify(ambiguity));
        }
        switch (context.format()) {
            case CURL_COMMAND -> clarifications.add("Parsing a curl command: read every flag and parameter.");
            case HTTP_RAW -> clarifications.add("Parsing a raw HTTP request: take method, headers and body from the message structure.");
            case CONCATENATED_REQUESTS -> clarifications.add("Multiple requests detected: keep them as separate request entries.");
            case JSON_WITH_TEXT -> clarifications.add("JSON found alongside descriptive text: the JSON is the request body.");
            case MIXED_STRUCTURED -> clarifications.add("Mixed structured data and prose: structured data takes priority.");
            case NATURAL_LANGUAGE -> {
                // nothing format-specific to clarify
            }
        }
        if (context.confidence() < 0.6) {
            clarifications.add("The input is ambiguous or incomplete. Use the defaults below unless the input says otherwise.");
        }
        return clarifications;
    }

    static String clarify(Ambiguity ambiguity) {
        String preferred = ambiguity.possibleValues().isEmpty() ? "a sensible default" : ambiguity.possibleValues().get(0);
        return switch (ambiguity.field()) {
            case "method" -> "HTTP method unclear. Use " + preferred + " unless the input implies otherwise.";
            case "url" -> "URL incomplete or ambiguous (" + ambiguity.reason() + "). Use " + preferred + " unless another candidate fits better.";
            case "userCount" -> "User count unclear. Use " + preferred + " concurrent users unless the input implies otherwise.";
            case "duration" -> "Test duration not specified. Use " + preferred + ".";
            case "content-type" -> "Content-Type missing for a request with a body. Use " + preferred + ".";
            case "loadPattern" -> "Load pattern not specified. Use " + preferred + ".";
            default -> ambiguity.describe();
        };
    }

    private List<String> buildParsingInstructions(ParseContext context) {
        ExtractedComponents components = context.extractedComponents();
        InferredFields inferred = context.inferredFields();
        List<String> instructions = new ArrayList<>();
        if (!components.methods().isEmpty()) {
            instructions.add("Use HTTP method: " + components.methods().get(0));
        }
        if (!components.urls().isEmpty()) {
            instructions.add("Target URL: " + components.urls().get(0));
        }
        if (!components.counts().isEmpty()) {
            instructions.add("User count: " + components.counts().get(0));
        }
        if (!components.headers().isEmpty()) {
            instructions.add("Headers: " + components.headers().entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        if (inferred.testType() != null) {
            instructions.add("Test type: " + inferred.testType().value());
        }
        if (inferred.loadPattern() != null) {
            instructions.add("Load pattern: " + inferred.loadPattern().value());
        }
        if (inferred.duration() != null && !inferred.isDefaulted(InferredFields.DURATION)) {
            instructions.add("Duration: " + inferred.duration().describe());
        }
        if (inferred.requestBody() != null) {
            instructions.add(LITERAL_BODY_DIRECTIVE);
        }
        return instructions;
    }

    private List<String> buildFallbackInstructions(ParseContext context) {
        List<String> instructions = new ArrayList<>(BASE_FALLBACK_INSTRUCTIONS);
        if (context.confidence() < 0.3) {
            instructions.add("Very low confidence input: use a minimal viable test configuration.");
        }
        if (context.ambiguities().size() > 3) {
            instructions.add("Highly ambiguous input: get the method and URL right before anything else.");
        }
        return instructions;
    }

    /**
     * Relevance of a library example: +0.3 for a matching method, +0.3 for the test type,
     * +0.2 for the load pattern and +0.2 when the last URL segment matches.
     */
    private static double relevance(LibraryEntry entry, ParseContext context) {
        double score = 0;
        if (context.extractedComponents().methods().contains(entry.method())) {
            score += 0.3;
        }
        if (entry.testType() == context.inferredFields().testType()) {
            score += 0.3;
        }
        if (entry.loadPattern() == context.inferredFields().loadPattern()) {
            score += 0.2;
        }
        String exampleTail = lastSegment(entry.url());
        boolean urlMatch = context.extractedComponents().urls().stream().anyMatch(url -> {
            String tail = lastSegment(url);
            return (!exampleTail.isEmpty() && url.contains(exampleTail)) || (!tail.isEmpty() && entry.url().contains(tail));
        });
        if (urlMatch) {
            score += 0.2;
        }
        return Math.min(score, 1.0);
    }

    private static String lastSegment(String url) {
        String path = url.contains("?") ? url.substring(0, url.indexOf('?')) : url;
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private Map<Predicate<ParseContext>, Predicate<LibraryEntry>> createSelectionRules() {
        Map<Predicate<ParseContext>, Predicate<LibraryEntry>> rules = new LinkedHashMap<>();
        rules.put(ctx -> ctx.extractedComponents().methods().contains("POST"), e -> e.method().equals("POST"));
        rules.put(ctx -> ctx.extractedComponents().counts().stream().anyMatch(c -> c > 100), e -> e.virtualUsers() > 100);
        rules.put(ctx -> ctx.inferredFields().testType() == TestType.SPIKE, e -> e.testType() == TestType.SPIKE);
        rules.put(ctx -> ctx.extractedComponents().methods().contains("GET"), e -> e.method().equals("GET"));
        rules.put(ctx -> ctx.inferredFields().testType() == TestType.STRESS, e -> e.testType() == TestType.STRESS);
        rules.put(ctx -> true, e -> true);
        return rules;
    }

    private static List<LibraryEntry> createExampleLibrary() {
        return List.of(
                new LibraryEntry(new PromptExample(
                        "POST to /api/users with 50 concurrent users for 2 minutes",
                        "{\"id\":\"test_post_users\",\"name\":\"POST Users API Test\",\"description\":\"POST to /api/users with 50 concurrent users for 2 minutes\","
                                + "\"testType\":\"baseline\",\"requests\":[{\"method\":\"POST\",\"url\":\"/api/users\",\"headers\":{\"Content-Type\":\"application/json\"},"
                                + "\"payload\":{\"template\":\"{\\\"name\\\": \\\"{{name}}\\\", \\\"email\\\": \\\"{{email}}\\\"}\",\"variables\":["
                                + "{\"name\":\"name\",\"type\":\"random_string\",\"parameters\":{\"length\":8}},{\"name\":\"email\",\"type\":\"random_string\",\"parameters\":{}}]}}],"
                                + "\"loadPattern\":{\"type\":\"constant\",\"virtualUsers\":50},\"duration\":{\"value\":2,\"unit\":\"minutes\"}}",
                        "POST with concurrent users and a generated payload", 0),
                        "POST", TestType.BASELINE, LoadPatternType.CONSTANT, "/api/users", 50),
                new LibraryEntry(new PromptExample(
                        "Spike test: 1000 requests to GET https://api.example.com/health in 10 seconds",
                        "{\"id\":\"test_spike_health\",\"name\":\"Health Check Spike Test\",\"description\":\"Spike test: 1000 requests to GET https://api.example.com/health in 10 seconds\","
                                + "\"testType\":\"spike\",\"requests\":[{\"method\":\"GET\",\"url\":\"https://api.example.com/health\"}],"
                                + "\"loadPattern\":{\"type\":\"spike\",\"virtualUsers\":1000},\"duration\":{\"value\":10,\"unit\":\"seconds\"}}",
                        "Spike test with high load in a short window", 0),
                        "GET", TestType.SPIKE, LoadPatternType.SPIKE, "https://api.example.com/health", 1000),
                new LibraryEntry(new PromptExample(
                        "curl -X POST https://api.example.com/orders -H 'Content-Type: application/json' -d '{\"productId\": 123, \"quantity\": 2}'",
                        "{\"id\":\"test_curl_orders\",\"name\":\"Orders API Test\",\"description\":\"curl POST to https://api.example.com/orders\","
                                + "\"testType\":\"baseline\",\"requests\":[{\"method\":\"POST\",\"url\":\"https://api.example.com/orders\",\"headers\":{\"Content-Type\":\"application/json\"},"
                                + "\"body\":{\"productId\":123,\"quantity\":2}}],"
                                + "\"loadPattern\":{\"type\":\"constant\",\"virtualUsers\":10},\"duration\":{\"value\":1,\"unit\":\"minutes\"}}",
                        "curl command whose literal JSON body is kept verbatim", 0),
                        "POST", TestType.BASELINE, LoadPatternType.CONSTANT, "https://api.example.com/orders", 10),
                new LibraryEntry(new PromptExample(
                        "Stress test gradually increasing from 10 to 200 users over 5 minutes hitting /api/login",
                        "{\"id\":\"test_stress_login\",\"name\":\"Login Stress Test\",\"description\":\"Stress test gradually increasing from 10 to 200 users over 5 minutes hitting /api/login\","
                                + "\"testType\":\"stress\",\"requests\":[{\"method\":\"POST\",\"url\":\"/api/login\",\"headers\":{\"Content-Type\":\"application/json\"},"
                                + "\"payload\":{\"template\":\"{\\\"username\\\": \\\"{{username}}\\\", \\\"password\\\": \\\"{{password}}\\\"}\",\"variables\":["
                                + "{\"name\":\"username\",\"type\":\"random_string\",\"parameters\":{\"length\":8}},{\"name\":\"password\",\"type\":\"random_string\",\"parameters\":{\"length\":12}}]}}],"
                                + "\"loadPattern\":{\"type\":\"ramp-up\",\"virtualUsers\":200,\"rampUpTime\":{\"value\":5,\"unit\":\"minutes\"}},\"duration\":{\"value\":10,\"unit\":\"minutes\"}}",
                        "Gradual ramp-up stress test", 0),
                        "POST", TestType.STRESS, LoadPatternType.RAMP_UP, "/api/login", 200),
                new LibraryEntry(new PromptExample(
                        "GET /api/products?category=electronics Authorization: Bearer token123",
                        "{\"id\":\"test_products_auth\",\"name\":\"Products API with Auth\",\"description\":\"GET /api/products?category=electronics Authorization: Bearer token123\","
                                + "\"testType\":\"baseline\",\"requests\":[{\"method\":\"GET\",\"url\":\"/api/products?category=electronics\",\"headers\":{\"Authorization\":\"Bearer token123\"}}],"
                                + "\"loadPattern\":{\"type\":\"constant\",\"virtualUsers\":10},\"duration\":{\"value\":1,\"unit\":\"minutes\"}}",
                        "GET with query parameters and authentication", 0),
                        "GET", TestType.BASELINE, LoadPatternType.CONSTANT, "/api/products?category=electronics", 10));
    }

    private record LibraryEntry(PromptExample example, String method, TestType testType,
                                LoadPatternType loadPattern, String url, int virtualUsers) {
    }
}
