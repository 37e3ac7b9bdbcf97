package com.loadspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.AiServiceException;
import com.loadspec.exception.ParseFailureException;
import com.loadspec.exception.SpecValidationException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.parse.Ambiguity;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.DetailedParseResult;
import com.loadspec.model.parse.EnhancedPrompt;
import com.loadspec.model.parse.ExtractedComponents;
import com.loadspec.model.parse.FallbackParseResult;
import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.InputFormat;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.parse.ParsingIssue;
import com.loadspec.model.parse.SemanticIssue;
import com.loadspec.model.parse.StructuredData;
import com.loadspec.model.recovery.ErrorLevel;
import com.loadspec.model.recovery.ParseError;
import com.loadspec.model.recovery.RecoveryResult;
import com.loadspec.model.recovery.RecoveryStrategy;
import com.loadspec.model.recovery.StrategyType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.service.api.AiBackend;
import com.loadspec.service.api.CommandParser;
import com.loadspec.service.api.ConfidenceEngine;
import com.loadspec.service.api.ContextEnhancer;
import com.loadspec.service.api.ErrorRecoveryCoordinator;
import com.loadspec.service.api.FallbackParser;
import com.loadspec.service.api.FormatDetector;
import com.loadspec.service.api.InputPreprocessor;
import com.loadspec.service.api.PromptBuilder;
import com.loadspec.service.api.ResponseValidator;
import com.loadspec.service.api.SemanticValidator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the full parse pipeline: preprocessing, format detection, context enhancement, prompt
 * composition, the AI round-trip with validation and correction, and scoring. Any failure in the AI
 * or validation stages is handed to the recovery coordinator; when recovery cannot produce a spec
 * the rule-based parser answers instead, so every call ends with a usable specification.
 */
@Service
@Slf4j
public class CommandParserImpl implements CommandParser {

    private static final Pattern ANY_DIGIT = Pattern.compile("\\d+");
    private static final Pattern LOAD_WORDS = Pattern.compile(
            "\\b(?:users?|vus?|rps|requests?\\s+per\\s+second|concurrent|load)\\b", Pattern.CASE_INSENSITIVE);

    private final InputPreprocessor preprocessor;
    private final FormatDetector formatDetector;
    private final ContextEnhancer contextEnhancer;
    private final PromptBuilder promptBuilder;
    private final AiBackend backend;
    private final ResponseValidator responseValidator;
    private final SemanticValidator semanticValidator;
    private final ConfidenceEngine confidenceEngine;
    private final FallbackParser fallbackParser;
    private final ErrorRecoveryCoordinator recoveryCoordinator;
    private final ParserProperties properties;

    public CommandParserImpl(InputPreprocessor preprocessor,
                             FormatDetector formatDetector,
                             ContextEnhancer contextEnhancer,
                             PromptBuilder promptBuilder,
                             AiBackend backend,
                             ResponseValidator responseValidator,
                             SemanticValidator semanticValidator,
                             ConfidenceEngine confidenceEngine,
                             FallbackParser fallbackParser,
                             ErrorRecoveryCoordinator recoveryCoordinator,
                             ParserProperties properties) {
        this.preprocessor = preprocessor;
        this.formatDetector = formatDetector;
        this.contextEnhancer = contextEnhancer;
        this.promptBuilder = promptBuilder;
        this.backend = backend;
        this.responseValidator = responseValidator;
        this.semanticValidator = semanticValidator;
        this.confidenceEngine = confidenceEngine;
        this.fallbackParser = fallbackParser;
        this.recoveryCoordinator = recoveryCoordinator;
        this.properties = properties;
    }

    @Override
    public DetailedParseResult parse(String input) {
        List<String> steps = new ArrayList<>();
        String original = input == null ? "" : input;
        String cleaned = preprocessor.sanitize(original);
        steps.add("Input preprocessing");
        if (cleaned.isBlank()) {
            steps.add("Fallback parsing (empty input)");
            return templateResult(steps);
        }

        ParseContext context = buildContext(original, cleaned, steps);
        EnhancedPrompt prompt = promptBuilder.buildPrompt(context);
        steps.add("Prompt building (" + prompt.contextualExamples().size() + " examples)");

        try {
            LoadTestSpec spec = aiParse(prompt, context);
            steps.add("AI parsing (" + backend.name() + ")");
            return aiResult(spec, context, steps, List.of(), 0);
        } catch (RuntimeException e) {
            return recover(e, prompt, context, steps);
        }
    }

    @Override
    public DetailedParseResult parseWithFallbackOnly(String input) {
        List<String> steps = new ArrayList<>();
        String original = input == null ? "" : input;
        String cleaned = preprocessor.sanitize(original);
        steps.add("Input preprocessing");
        if (cleaned.isBlank()) {
            steps.add("Fallback parsing (empty input)");
            return templateResult(steps);
        }
        ParseContext context = buildContext(original, cleaned, steps);
        FallbackParseResult result = fallbackParse(context);
        steps.add("Fallback parsing (requested)");
        return fallbackResult(result, context, steps, List.of(), List.of(), List.of());
    }

    @Override
    public List<ParsingIssue> diagnose(String input) {
        String original = input == null ? "" : input;
        String cleaned = preprocessor.sanitize(original);
        ParseContext context = buildContext(original, cleaned, new ArrayList<>());
        ExtractedComponents components = context.extractedComponents();

        List<ParsingIssue> issues = new ArrayList<>();
        if (components.urls().isEmpty()) {
            issues.add(issue("missing_url", "No endpoint URL found in the input",
                    List.of("Include a complete URL (e.g. https://api.example.com/endpoint)",
                            "Ensure the URL is properly formatted",
                            "Check that the URL is reachable from the load generators"),
                    List.of("Try with a sample URL: https://httpbin.org/get",
                            "Use a relative path if testing locally: /api/test"),
                    context));
        }
        if (components.methods().isEmpty()) {
            issues.add(issue("missing_method", "No HTTP method found in the input",
                    List.of("Specify the HTTP method (GET, POST, PUT, DELETE)",
                            "Use common patterns like 'GET /api/users' or 'POST to /api/orders'"),
                    List.of("Default to GET for read operations", "Use POST for data submission"),
                    context));
        }
        if (components.counts().isEmpty() && !LOAD_WORDS.matcher(cleaned).find()) {
            issues.add(issue("missing_load_config", "No load configuration found in the input",
                    List.of("Specify the number of virtual users (e.g. '50 users')",
                            "Include a load pattern (e.g. 'ramp up from 1 to 100 users')",
                            "Add a test duration (e.g. 'for 5 minutes')"),
                    List.of("Use the default: 10 users for 30 seconds",
                            "Start with light load: 5 users for 1 minute"),
                    context));
        }
        if (components.jsonBlocks().stream().anyMatch(block -> !block.valid())) {
            issues.add(issue("format_error", "A JSON block in the input could not be parsed",
                    List.of("Check JSON syntax if providing structured data",
                            "Separate natural language from structured data clearly",
                            "Use proper quotes for JSON strings"),
                    List.of("Try rephrasing in natural language", "Provide data in key-value format"),
                    context));
        }
        if (!backendAvailable()) {
            List<String> suggestions = new ArrayList<>(List.of(
                    "Check that the " + backend.name() + " service is running",
                    "Verify API configuration and credentials",
                    "Try again in a few moments"));
            suggestions.addAll(providerHints(backend.name()));
            issues.add(issue("ai_service_error", "The " + backend.name() + " backend is not available",
                    suggestions,
                    List.of("Use fallback parsing mode", "Provide more structured input"),
                    context));
        }
        log.debug("Diagnosed {} issue(s) for input of {} chars", issues.size(), cleaned.length());
        return issues;
    }

    @Override
    public List<String> suggestCorrections(String input) {
        String cleaned = preprocessor.sanitize(input == null ? "" : input);
        LinkedHashSet<String> suggestions = new LinkedHashSet<>();
        for (ParsingIssue issue : diagnose(cleaned)) {
            switch (issue.type()) {
                case "missing_url" -> suggestions.add(
                        "Include the complete API endpoint URL (e.g. https://api.example.com/endpoint)");
                case "missing_method" -> suggestions.add("Specify the HTTP method (GET, POST, PUT, DELETE, etc.)");
                case "missing_load_config" -> suggestions.add(
                        "Specify load parameters like \"100 users\" or \"50 requests per second\"");
                case "format_error" -> suggestions.add("Fix the JSON syntax of the request body");
                default -> {
                }
            }
        }
        if (ContextEnhancerImpl.explicitDuration(cleaned).isEmpty()) {
            suggestions.add("Include a test duration like \"for 5 minutes\" or \"30 seconds\"");
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        if (!lower.contains("http") && !lower.contains("/")) {
            suggestions.add("Include the API endpoint URL you want to test");
        }
        if (!ANY_DIGIT.matcher(cleaned).find()) {
            suggestions.add("Include specific numbers for load parameters (users, requests, duration)");
        }
        return new ArrayList<>(suggestions);
    }

    private ParseContext buildContext(String original, String cleaned, List<String> steps) {
        StructuredData data = preprocessor.extractStructuredData(cleaned);
        FormatDetectionResult detection = formatDetector.detectFormat(cleaned, data);
        steps.add("Format detection (" + detection.format().label() + ")");
        ParseContext context = contextEnhancer.buildContext(original, cleaned, data, detection);
        context = contextEnhancer.resolveAmbiguities(contextEnhancer.inferMissingFields(context));
        steps.add("Context enhancement");
        return context;
    }

    private LoadTestSpec aiParse(EnhancedPrompt prompt, ParseContext context) {
        if (!backend.isReady()) {
            log.info("Initializing {} backend", backend.name());
            backend.initialize();
        }
        String response = backend.generateCompletion(
                CompletionRequest.json(null, prompt.render(context.cleanedInput()))).text();
        return responseValidator.validateAndCorrect(response, context, (previous, errors) -> backend
                .generateCompletion(CompletionRequest.json(null,
                        promptBuilder.buildCorrectionPrompt(context, previous, errors)))
                .text());
    }

    private DetailedParseResult recover(RuntimeException failure, EnhancedPrompt prompt,
                                        ParseContext context, List<String> steps) {
        ErrorLevel level = failure instanceof SpecValidationException ? ErrorLevel.VALIDATION : ErrorLevel.AI;
        ParseError error = recoveryCoordinator.classify(failure, level);
        log.warn("AI parsing failed ({}): {}", error.type(), failure.getMessage());
        steps.add("Error: " + failure.getMessage());

        AtomicReference<FallbackParseResult> fallback = new AtomicReference<>();
        RecoveryResult recovery = recoveryCoordinator.recover(error, context.cleanedInput(), strategy ->
                executeStrategy(strategy, error, failure, prompt, context, fallback));

        List<Assumption> extraAssumptions = new ArrayList<>();
        List<String> extraWarnings = new ArrayList<>();
        if (level == ErrorLevel.AI) {
            extraAssumptions.add(new Assumption("parser", "fallback",
                    "AI backend unavailable: " + failure.getMessage(), List.of()));
            extraWarnings.add("AI backend " + backend.name() + " was unavailable; used rule-based parsing");
        }

        if (recovery.success() && recovery.strategy() == StrategyType.FALLBACK && fallback.get() != null) {
            steps.add("Recovery (" + String.join(" -> ", recovery.recoveryPath()) + ")");
            steps.add("Fallback parsing");
            return fallbackResult(fallback.get(), context, steps, extraAssumptions, extraWarnings,
                    recovery.recoveryPath());
        }
        if (recovery.success()) {
            steps.add("Recovery (" + String.join(" -> ", recovery.recoveryPath()) + ")");
            steps.add("AI parsing (" + backend.name() + ")");
            return aiResult(recovery.spec(), context, steps, recovery.recoveryPath(), recovery.confidence());
        }

        log.warn("Recovery exhausted after {} attempt(s), using rule-based parser", recovery.attemptsUsed());
        List<String> path = new ArrayList<>(recovery.recoveryPath());
        path.add(StrategyType.FALLBACK.label());
        try {
            FallbackParseResult result = fallbackParse(context);
            steps.add("Fallback parsing (recovery exhausted)");
            return fallbackResult(result, context, steps, extraAssumptions, extraWarnings, path);
        } catch (RuntimeException e) {
            ParseError terminal = recoveryCoordinator.classify(e, ErrorLevel.FALLBACK);
            log.error("Rule-based parsing failed ({}), returning template specification", terminal.type(), e);
            steps.add("Error: " + e.getMessage());
            return templateResult(steps);
        }
    }

    private LoadTestSpec executeStrategy(RecoveryStrategy strategy, ParseError error, Throwable failure,
                                         EnhancedPrompt prompt, ParseContext context,
                                         AtomicReference<FallbackParseResult> fallback) {
        return switch (strategy.strategy()) {
            case RETRY -> aiParse(prompt, context);
            case ENHANCE_PROMPT -> aiParse(promptBuilder.enhanceWithError(prompt, error.message()), context);
            case FALLBACK -> {
                FallbackParseResult result = fallbackParse(context);
                fallback.set(result);
                yield result.spec();
            }
            case USER_INPUT -> throw new ParseFailureException(error, failure);
        };
    }

    /**
     * Concatenated requests are parsed one by one and merged into the first spec.
     */
    private FallbackParseResult fallbackParse(ParseContext context) {
        FallbackParseResult result = rulesParse(context);
        attachContextBody(result.spec(), context);
        return result;
    }

    /**
     * A JSON block found during context building becomes the body of a body-carrying primary
     * request that the rules left without one.
     */
    private static void attachContextBody(LoadTestSpec spec, ParseContext context) {
        JsonNode literal = context.inferredFields().requestBody();
        RequestSpec primary = spec.primaryRequest();
        if (literal == null || primary == null || primary.getMethod() == null
                || !primary.getMethod().carriesBody() || primary.hasPayload()) {
            return;
        }
        primary.useLiteralBody(literal.deepCopy());
        primary.getHeaders().putIfAbsent("Content-Type", "application/json");
        log.debug("Attached literal body from input to {} {}", primary.getMethod(), primary.getUrl());
    }

    private FallbackParseResult rulesParse(ParseContext context) {
        if (context.format() != InputFormat.CONCATENATED_REQUESTS) {
            return fallbackParser.parse(context.cleanedInput());
        }
        List<String> parts = preprocessor.separateRequests(context.cleanedInput());
        if (parts.size() < 2) {
            return fallbackParser.parse(context.cleanedInput());
        }
        FallbackParseResult first = fallbackParser.parse(parts.get(0));
        LoadTestSpec merged = first.spec();
        List<String> matched = new ArrayList<>(first.matchedPatterns());
        List<Assumption> assumptions = new ArrayList<>(first.assumptions());
        List<String> warnings = new ArrayList<>(first.warnings());
        double confidence = first.confidence();
        for (String part : parts.subList(1, parts.size())) {
            FallbackParseResult next = fallbackParser.parse(part);
            RequestSpec request = next.spec().primaryRequest();
            if (request != null) {
                merged.getRequests().add(request);
            }
            matched.addAll(next.matchedPatterns());
            warnings.addAll(next.warnings());
            confidence = Math.min(confidence, next.confidence());
        }
        log.info("Merged {} concatenated requests", merged.getRequests().size());
        return new FallbackParseResult(merged, confidence, matched, assumptions, warnings);
    }

    private DetailedParseResult aiResult(LoadTestSpec spec, ParseContext context, List<String> steps,
                                         List<String> recoveryPath, double recoveryConfidence) {
        double confidence = confidenceEngine.calculateConfidence(spec, context);
        if (recoveryConfidence > 0) {
            confidence = Math.max(properties.getConfidence().getAiFloor(), Math.min(confidence, recoveryConfidence));
        }
        List<String> warnings = new ArrayList<>(confidenceEngine.generateWarnings(spec, context, confidence));
        List<String> suggestions = new ArrayList<>(confidenceEngine.generateSuggestions(spec, context));
        addSemanticIssues(spec, warnings, suggestions);
        ParseExplanation explanation = confidenceEngine.explain(spec, context);
        steps.add("Explanation generation");
        return new DetailedParseResult(spec, confidence, context.format(), ambiguities(context),
                suggestions, explanation, warnings,
                confidenceEngine.deriveAssumptions(spec, context), steps, false, recoveryPath);
    }

    private DetailedParseResult fallbackResult(FallbackParseResult result, ParseContext context, List<String> steps,
                                               List<Assumption> extraAssumptions, List<String> extraWarnings,
                                               List<String> recoveryPath) {
        List<Assumption> assumptions = new ArrayList<>(extraAssumptions);
        assumptions.addAll(result.assumptions());
        List<String> warnings = new ArrayList<>(extraWarnings);
        warnings.addAll(result.warnings());
        if (result.confidence() < properties.getConfidence().getLowConfidenceThreshold()) {
            warnings.add("Rule-based parse has low confidence - please verify the generated specification");
        }
        List<String> suggestions = new ArrayList<>(confidenceEngine.generateSuggestions(result.spec(), context));
        addSemanticIssues(result.spec(), warnings, suggestions);
        ParseExplanation base = confidenceEngine.explain(result.spec(), context);
        List<String> extracted = new ArrayList<>(base.extractedComponents());
        extracted.add("Matched rules: " + String.join(", ", result.matchedPatterns()));
        ParseExplanation explanation = new ParseExplanation(extracted, assumptions,
                base.ambiguityResolutions(), suggestions);
        steps.add("Explanation generation");
        return new DetailedParseResult(result.spec(), result.confidence(), context.format(), ambiguities(context),
                suggestions, explanation, warnings, assumptions, steps, true, recoveryPath);
    }

    /**
     * Semantic findings become warnings, their advice joins the suggestions once.
     */
    private void addSemanticIssues(LoadTestSpec spec, List<String> warnings, List<String> suggestions) {
        for (SemanticIssue issue : semanticValidator.review(spec)) {
            if (!warnings.contains(issue.message())) {
                warnings.add(issue.message());
            }
            if (issue.suggestion() != null && !suggestions.contains(issue.suggestion())) {
                suggestions.add(issue.suggestion());
            }
        }
    }

    private DetailedParseResult templateResult(List<String> steps) {
        FallbackParseResult template = fallbackParser.parse("");
        List<String> suggestions = List.of("Describe the test as: <METHOD> <URL> with <N> users for <duration>");
        ParseExplanation explanation = new ParseExplanation(List.of("Input was empty"), template.assumptions(),
                List.of(), suggestions);
        return new DetailedParseResult(template.spec(), template.confidence(), InputFormat.NATURAL_LANGUAGE,
                List.of(), suggestions, explanation, template.warnings(), template.assumptions(), steps, true,
                List.of(StrategyType.FALLBACK.label()));
    }

    private static List<String> ambiguities(ParseContext context) {
        return context.ambiguities().stream().map(Ambiguity::describe).collect(Collectors.toList());
    }

    private boolean backendAvailable() {
        try {
            return backend.isReady() || backend.healthCheck();
        } catch (RuntimeException e) {
            log.debug("Backend health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static ParsingIssue issue(String type, String message, List<String> suggestions,
                                      List<String> recoveryOptions, ParseContext context) {
        LinkedHashSet<String> all = new LinkedHashSet<>(suggestions);
        if (context.confidence() < 0.3) {
            all.add("Try being more specific in your request");
            all.add("Include more details about the API endpoint");
        }
        if (!context.ambiguities().isEmpty()) {
            all.add("Resolve ambiguities by being more explicit");
            context.ambiguities().forEach(a -> all.add("Clarify: " + a.reason()));
        }
        return new ParsingIssue(type, message, new ArrayList<>(all), recoveryOptions);
    }

    static List<String> providerHints(String provider) {
        switch (provider.toLowerCase(Locale.ROOT)) {
            case "openai":
                return List.of("Check OpenAI API key and quota", "Verify model availability (gpt-3.5-turbo, gpt-4)");
            case "claude":
                return List.of("Check Anthropic API key and usage limits", "Verify Claude model access");
            case "ollama":
                return List.of("Ensure Ollama service is running on localhost:11434",
                        "Check if the model is pulled and available");
            default:
                return List.of("Check " + provider + " service configuration");
        }
    }
}
