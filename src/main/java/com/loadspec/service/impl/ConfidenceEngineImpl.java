package com.loadspec.service.impl;

import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.Ambiguity;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.ExtractedComponents;
import com.loadspec.model.parse.InferredFields;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestType;
import com.loadspec.service.api.ConfidenceEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores AI-backed results and explains them: which fields were assumed, what the operator should
 * double-check and how the input could be made less ambiguous.
 */
@Service
@Slf4j
public class ConfidenceEngineImpl implements ConfidenceEngine {

    private static final int HIGH_USER_COUNT = 100;

    private final ParserProperties properties;

    public ConfidenceEngineImpl(ParserProperties properties) {
        this.properties = properties;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Starts from the context confidence, adds 0.2 when the primary request has a method and URL and
     * 0.1 for a positive load volume, then subtracts 0.1 for a defaulted baseline test type and 0.05
     * per ambiguity.
     */
    @Override
    public double calculateConfidence(LoadTestSpec spec, ParseContext context) {
        double confidence = context.confidence();
        RequestSpec primary = spec.primaryRequest();
        if (primary != null && primary.getMethod() != null && primary.getUrl() != null && !primary.getUrl().isBlank()) {
            confidence += 0.2;
        }
        if (spec.getLoadPattern() != null && spec.getLoadPattern().hasPositiveVolume()) {
            confidence += 0.1;
        }
        if (spec.getTestType() == TestType.BASELINE && context.inferredFields().isDefaulted(InferredFields.TEST_TYPE)) {
            confidence -= 0.1;
        }
        confidence -= 0.05 * context.ambiguities().size();
        return Math.max(properties.getConfidence().getAiFloor(), Math.min(confidence, 1.0));
    }

    @Override
    public List<Assumption> deriveAssumptions(LoadTestSpec spec, ParseContext context) {
        List<Assumption> assumptions = new ArrayList<>();
        ExtractedComponents components = context.extractedComponents();
        InferredFields inferred = context.inferredFields();
        RequestSpec primary = spec.primaryRequest();

        if (components.methods().isEmpty() && primary != null) {
            assumptions.add(new Assumption("method", String.valueOf(primary.getMethod()),
                    "HTTP method not specified in the input", List.of("GET", "POST", "PUT", "DELETE")));
        }
        if (components.urls().isEmpty() && primary != null) {
            assumptions.add(new Assumption("url", primary.getUrl(),
                    "URL not found in the input", ContextEnhancerImpl.DEFAULT_BASE_URLS));
        }
        LoadPattern loadPattern = spec.getLoadPattern();
        if (components.counts().isEmpty() && loadPattern != null && loadPattern.getVirtualUsers() != null) {
            assumptions.add(new Assumption("virtualUsers", String.valueOf(loadPattern.getVirtualUsers()),
                    "User count not specified in the input", List.of("1", "10", "50", "100")));
        }
        if (inferred.isDefaulted(InferredFields.DURATION) && spec.getDuration() != null) {
            assumptions.add(new Assumption("duration", spec.getDuration().describe(),
                    "Test duration not specified in the input", List.of("30 seconds", "1 minute", "5 minutes")));
        }
        if (inferred.isDefaulted(InferredFields.TEST_TYPE) && spec.getTestType() != null) {
            assumptions.add(new Assumption("testType", spec.getTestType().value(),
                    "Test type not specified in the input",
                    Arrays.stream(TestType.values())
                            .filter(t -> t != spec.getTestType())
                            .map(TestType::value)
                            .collect(Collectors.toList())));
        }
        if (inferred.isDefaulted(InferredFields.LOAD_PATTERN) && loadPattern != null && loadPattern.getType() != null) {
            assumptions.add(new Assumption("loadPattern", loadPattern.getType().value(),
                    "Load pattern not specified in the input",
                    Arrays.stream(LoadPatternType.values())
                            .filter(p -> p != loadPattern.getType())
                            .map(LoadPatternType::value)
                            .collect(Collectors.toList())));
        }
        return assumptions;
    }

    @Override
    public List<String> generateWarnings(LoadTestSpec spec, ParseContext context, double confidence) {
        List<String> warnings = new ArrayList<>();
        if (confidence < properties.getConfidence().getLowConfidenceThreshold()) {
            warnings.add("Input had low confidence - please verify the generated specification");
        }
        if (!context.ambiguities().isEmpty()) {
            warnings.add(context.ambiguities().size() + " ambiguities were resolved with defaults");
        }
        RequestSpec primary = spec.primaryRequest();
        if (primary != null && primary.getUrl() != null
                && primary.getUrl().toLowerCase(Locale.ROOT).contains("api")
                && primary.header("Authorization") == null) {
            warnings.add("API endpoint detected but no authentication headers found");
        }
        LoadPattern loadPattern = spec.getLoadPattern();
        if (loadPattern != null && loadPattern.getType() == LoadPatternType.CONSTANT
                && loadPattern.getVirtualUsers() != null && loadPattern.getVirtualUsers() > HIGH_USER_COUNT) {
            warnings.add("High user count with constant load - consider using ramp-up pattern");
        }
        return warnings;
    }

    @Override
    public List<String> generateSuggestions(LoadTestSpec spec, ParseContext context) {
        List<String> suggestions = new ArrayList<>();
        if (context.hasAmbiguity("method")) {
            suggestions.add("Specify the HTTP method explicitly (e.g. GET, POST, PUT, DELETE)");
        }
        if (context.hasAmbiguity("url")) {
            suggestions.add("Include the complete URL (e.g. https://api.example.com/users)");
        }
        if (context.hasAmbiguity("userCount")) {
            suggestions.add("Specify the number of virtual users (e.g. 'with 50 users')");
        }
        if (context.hasAmbiguity("duration")) {
            suggestions.add("Specify the test duration (e.g. 'for 5 minutes')");
        }
        if (context.hasAmbiguity("content-type")) {
            suggestions.add("Add a Content-Type header for the request body");
        }
        for (RequestSpec request : spec.getRequests()) {
            if (request.getMethod() != null && request.getMethod().carriesBody() && !request.hasPayload()) {
                suggestions.add("Provide a JSON body for the " + request.getMethod() + " request to " + request.getUrl());
            }
        }
        if (context.confidence() < properties.getConfidence().getLowConfidenceThreshold()) {
            suggestions.add("Describe the test as: <METHOD> <URL> with <N> users for <duration>");
        }
        return suggestions;
    }

    @Override
    public ParseExplanation explain(LoadTestSpec spec, ParseContext context) {
        ExtractedComponents components = context.extractedComponents();
        List<String> extracted = new ArrayList<>();
        extracted.add("Format: " + context.format().label());
        if (!components.methods().isEmpty()) {
            extracted.add("Methods: " + String.join(", ", components.methods()));
        }
        if (!components.urls().isEmpty()) {
            extracted.add("URLs: " + String.join(", ", components.urls()));
        }
        if (!components.headers().isEmpty()) {
            extracted.add("Headers: " + String.join(", ", components.headers().keySet()));
        }
        if (context.inferredFields().requestBody() != null) {
            extracted.add("Body: literal JSON object");
        }
        if (!components.counts().isEmpty()) {
            extracted.add("User counts: " + components.counts().stream().map(String::valueOf).collect(Collectors.joining(", ")));
        }

        List<String> resolutions = context.ambiguities().stream()
                .map(a -> a.describe() + " -> " + resolvedValue(a, spec))
                .collect(Collectors.toList());

        return new ParseExplanation(extracted, deriveAssumptions(spec, context), resolutions,
                generateSuggestions(spec, context));
    }

    private static String resolvedValue(Ambiguity ambiguity, LoadTestSpec spec) {
        RequestSpec primary = spec.primaryRequest();
        LoadPattern loadPattern = spec.getLoadPattern();
        String resolved = switch (ambiguity.field()) {
            case "method" -> primary == null ? null : String.valueOf(primary.getMethod());
            case "url" -> primary == null ? null : primary.getUrl();
            case "userCount" -> loadPattern == null ? null
                    : loadPattern.getVirtualUsers() != null ? loadPattern.getVirtualUsers() + " users"
                    : loadPattern.getRequestsPerSecond() + " requests/s";
            case "duration" -> spec.getDuration() == null ? null : spec.getDuration().describe();
            case "loadPattern" -> loadPattern == null || loadPattern.getType() == null ? null : loadPattern.getType().value();
            case "content-type" -> primary == null ? null : primary.header("Content-Type");
            case "authentication" -> primary == null ? null : primary.header("Authorization");
            default -> null;
        };
        if (resolved != null) {
            return resolved;
        }
        return ambiguity.possibleValues().isEmpty() ? "unresolved" : ambiguity.possibleValues().get(0);
    }
}
