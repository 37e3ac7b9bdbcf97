package com.loadspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.model.parse.Ambiguity;
import com.loadspec.model.parse.ExtractedComponents;
import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.HintKind;
import com.loadspec.model.parse.InferredFields;
import com.loadspec.model.parse.JsonBlock;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ParsingHint;
import com.loadspec.model.parse.StructuredData;
import com.loadspec.model.spec.DurationUnit;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import com.loadspec.service.api.ContextEnhancer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link ContextEnhancer}.
 * <p>
 * The three steps are independent transforms over an immutable {@link ParseContext}:
 * <ul>
 *   <li>{@link #buildContext} merges literal data and hints and sets an initial confidence from the
 *       variety of signals found.</li>
 *   <li>{@link #inferMissingFields} fills test type, duration, load pattern and a literal body, trying an
 *       explicit keyword first, then contextual inference, then a fixed default. Each defaulted field costs
 *       10% of the confidence.</li>
 *   <li>{@link #resolveAmbiguities} records every under- or over-determined field. Method and URL
 *       ambiguities cost 0.2 each, the others 0.05.</li>
 * </ul>
 */
@Service
@Slf4j
public class ContextEnhancerImpl implements ContextEnhancer {

    static final List<String> DEFAULT_BASE_URLS = List.of("http://localhost:8080", "https://api.example.com");

    private static final Map<TestType, Pattern> TEST_TYPE_KEYWORDS = new LinkedHashMap<>();
    private static final Map<LoadPatternType, Pattern> LOAD_PATTERN_KEYWORDS = new LinkedHashMap<>();

    static {
        TEST_TYPE_KEYWORDS.put(TestType.SPIKE, keywords("spike", "burst", "peak"));
        TEST_TYPE_KEYWORDS.put(TestType.STRESS, keywords("stress", "breaking", "limit", "limits"));
        TEST_TYPE_KEYWORDS.put(TestType.ENDURANCE, keywords("endurance", "soak", "sustained", "extended"));
        TEST_TYPE_KEYWORDS.put(TestType.VOLUME, keywords("volume", "large", "bulk"));
        TEST_TYPE_KEYWORDS.put(TestType.BASELINE, keywords("baseline", "benchmark", "load", "performance", "capacity"));

        LOAD_PATTERN_KEYWORDS.put(LoadPatternType.SPIKE, keywords("spike", "burst", "sudden"));
        LOAD_PATTERN_KEYWORDS.put(LoadPatternType.RAMP_UP, keywords("ramp", "ramping", "ramp-up", "gradual", "gradually", "increase", "increasing", "scale"));
        LOAD_PATTERN_KEYWORDS.put(LoadPatternType.STEP, keywords("step", "steps", "staged", "stepped"));
        LOAD_PATTERN_KEYWORDS.put(LoadPatternType.CONSTANT, keywords("constant", "steady", "fixed", "stable"));
    }

    private static final Pattern DURATION = Pattern.compile(
            "\\b(\\d+)\\s*(hours?|hrs?|h|minutes?|mins?|m|seconds?|secs?|s)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONCURRENCY_WORDS = keywords("concurrent", "concurrently", "parallel", "simultaneous");
    private static final Pattern AUTH_HEADER = Pattern.compile("auth|token|api-key", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final double DEFAULT_DISCOUNT = 0.9;
    private static final double CRITICAL_PENALTY = 0.2;
    private static final double MINOR_PENALTY = 0.05;
    private static final double CONFIDENCE_FLOOR = 0.1;

    @Override
    public ParseContext buildContext(String originalInput, String sanitizedInput, StructuredData data, FormatDetectionResult detection) {
        String cleaned = WHITESPACE.matcher(sanitizedInput == null ? "" : sanitizedInput).replaceAll(" ").trim();
        List<ParsingHint> hints = detection.hints();

        Set<String> methods = new LinkedHashSet<>(data.methods());
        hints.stream().filter(h -> h.kind() == HintKind.METHOD).forEach(h -> methods.add(h.value()));

        Set<String> urls = new LinkedHashSet<>(data.urls());
        hints.stream().filter(h -> h.kind() == HintKind.URL).forEach(h -> urls.add(h.value()));

        Set<String> bodies = new LinkedHashSet<>();
        data.jsonBlocks().forEach(b -> bodies.add(b.text()));
        hints.stream().filter(h -> h.kind() == HintKind.BODY).forEach(h -> bodies.add(h.value()));

        List<Integer> counts = hints.stream()
                .filter(h -> h.kind() == HintKind.COUNT)
                .map(h -> parseCount(h.value()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        ExtractedComponents components = new ExtractedComponents(new ArrayList<>(methods), new ArrayList<>(urls),
                data.headers(), new ArrayList<>(bodies), counts, data.jsonBlocks());

        double confidence = 0.3;
        if (!components.methods().isEmpty()) {
            confidence += 0.15;
        }
        if (!components.urls().isEmpty()) {
            confidence += 0.2;
        }
        if (!components.headers().isEmpty()) {
            confidence += 0.1;
        }
        if (!components.jsonBlocks().isEmpty()) {
            confidence += 0.15;
        }
        long strongHints = hints.stream().filter(h -> h.confidence() > 0.8).count();
        confidence += Math.min(strongHints * 0.05, 0.2);
        confidence = Math.min(confidence, 1.0);

        log.debug("Built context: format={}, methods={}, urls={}, confidence={}",
                detection.format().label(), components.methods(), components.urls(), confidence);
        return new ParseContext(originalInput, cleaned, detection.format(), hints, components,
                InferredFields.none(), List.of(), confidence);
    }

    @Override
    public ParseContext inferMissingFields(ParseContext context) {
        String text = context.cleanedInput();
        ExtractedComponents components = context.extractedComponents();
        Set<String> defaulted = new HashSet<>();

        TestType testType = firstKeywordMatch(TEST_TYPE_KEYWORDS, text).orElse(null);
        if (testType == null) {
            if (components.counts().stream().anyMatch(c -> c > 1000)) {
                testType = TestType.STRESS;
            } else if (CONCURRENCY_WORDS.matcher(text).find()) {
                testType = TestType.BASELINE;
            } else {
                testType = TestType.BASELINE;
                defaulted.add(InferredFields.TEST_TYPE);
            }
        }

        TestDuration duration = explicitDuration(text).orElse(null);
        if (duration == null) {
            switch (testType) {
                case STRESS, SPIKE -> duration = TestDuration.seconds(60);
                case ENDURANCE -> duration = TestDuration.minutes(10);
                default -> {
                    duration = TestDuration.seconds(30);
                    defaulted.add(InferredFields.DURATION);
                }
            }
        }

        LoadPatternType loadPattern = firstKeywordMatch(LOAD_PATTERN_KEYWORDS, text).orElse(null);
        if (loadPattern == null) {
            switch (testType) {
                case SPIKE -> loadPattern = LoadPatternType.SPIKE;
                case STRESS -> loadPattern = LoadPatternType.RAMP_UP;
                default -> {
                    loadPattern = LoadPatternType.CONSTANT;
                    defaulted.add(InferredFields.LOAD_PATTERN);
                }
            }
        }

        JsonNode requestBody = components.jsonBlocks().stream()
                .filter(JsonBlock::valid)
                .map(b -> JsonRepair.parseStrict(b.text()))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);

        double confidence = context.confidence();
        for (int i = 0; i < defaulted.size(); i++) {
            confidence *= DEFAULT_DISCOUNT;
        }
        confidence = Math.max(confidence, CONFIDENCE_FLOOR);

        InferredFields fields = new InferredFields(testType, duration, loadPattern, requestBody, defaulted);
        log.debug("Inferred testType={}, duration={}, loadPattern={}, defaulted={}",
                testType.value(), duration.describe(), loadPattern.value(), defaulted);
        return context.withInferredFields(fields, confidence);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The ambiguity set is recomputed from the extracted components and inferred fields only, and a
     * penalty is charged only for fields not already recorded, so running this twice changes nothing.
     */
    @Override
    public ParseContext resolveAmbiguities(ParseContext context) {
        ExtractedComponents components = context.extractedComponents();
        InferredFields inferred = context.inferredFields();
        List<Ambiguity> ambiguities = new ArrayList<>();

        List<String> methods = components.methods();
        if (methods.isEmpty()) {
            ambiguities.add(new Ambiguity("method", List.of("GET", "POST"), "No HTTP method specified"));
        } else if (methods.size() > 1) {
            ambiguities.add(new Ambiguity("method", methods, "Multiple HTTP methods found: " + String.join(", ", methods)));
        }

        List<String> urls = components.urls();
        if (urls.isEmpty()) {
            ambiguities.add(new Ambiguity("url", DEFAULT_BASE_URLS, "No target URL specified"));
        } else if (urls.size() > 1) {
            ambiguities.add(new Ambiguity("url", urls, "Multiple URLs found: " + String.join(", ", urls)));
        } else if (urls.get(0).startsWith("/")) {
            String path = urls.get(0);
            List<String> candidates = new ArrayList<>();
            String host = headerValue(components, "Host");
            if (host != null) {
                candidates.add("https://" + host + path);
            }
            DEFAULT_BASE_URLS.forEach(base -> candidates.add(base + path));
            ambiguities.add(new Ambiguity("url", candidates, "Relative URL " + path + " has no host"));
        }

        List<String> counts = components.counts().stream().distinct().map(String::valueOf).collect(Collectors.toList());
        if (counts.isEmpty()) {
            ambiguities.add(new Ambiguity("userCount", List.of("1", "10", "100"), "No user count specified"));
        } else if (counts.size() > 1) {
            ambiguities.add(new Ambiguity("userCount", counts, "Multiple user counts found: " + String.join(", ", counts)));
        }

        List<String> authHeaders = components.headers().keySet().stream()
                .filter(k -> AUTH_HEADER.matcher(k).find())
                .collect(Collectors.toList());
        if (authHeaders.size() > 1) {
            ambiguities.add(new Ambiguity("authentication", authHeaders,
                    "Multiple authentication headers found: " + String.join(", ", authHeaders)));
        }

        boolean hasBody = inferred.requestBody() != null || !components.bodies().isEmpty();
        if (hasBody && !components.hasHeader("Content-Type")) {
            ambiguities.add(new Ambiguity("content-type", List.of("application/json", "application/x-www-form-urlencoded"),
                    "Request body present but no Content-Type header"));
        }

        if (inferred.isDefaulted(InferredFields.DURATION)) {
            ambiguities.add(new Ambiguity("duration", List.of("30 seconds", "1 minute", "5 minutes"), "No test duration specified"));
        }
        if (inferred.isDefaulted(InferredFields.LOAD_PATTERN)) {
            ambiguities.add(new Ambiguity("loadPattern", List.of("constant", "ramp-up", "spike"), "No load pattern specified"));
        }

        Set<String> alreadyRecorded = context.ambiguities().stream().map(Ambiguity::field).collect(Collectors.toSet());
        double confidence = context.confidence();
        for (Ambiguity ambiguity : ambiguities) {
            if (!alreadyRecorded.contains(ambiguity.field())) {
                confidence -= ambiguity.isCritical() ? CRITICAL_PENALTY : MINOR_PENALTY;
            }
        }
        confidence = Math.max(confidence, CONFIDENCE_FLOOR);

        log.debug("Resolved {} ambiguities, confidence now {}", ambiguities.size(), confidence);
        return context.withAmbiguities(ambiguities, confidence);
    }

    static Optional<TestDuration> explicitDuration(String text) {
        Matcher matcher = DURATION.matcher(text);
        while (matcher.find()) {
            Optional<Integer> value = parseCount(matcher.group(1));
            DurationUnit unit = DurationUnit.fromValue(matcher.group(2));
            if (value.isPresent() && value.get() > 0 && unit != null) {
                return Optional.of(new TestDuration(value.get(), unit));
            }
        }
        return Optional.empty();
    }

    private static <T> Optional<T> firstKeywordMatch(Map<T, Pattern> table, String text) {
        return table.entrySet().stream()
                .filter(e -> e.getValue().matcher(text).find())
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static String headerValue(ExtractedComponents components, String name) {
        return components.headers().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static Optional<Integer> parseCount(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Pattern keywords(String... words) {
        String alternation = String.join("|", words).toLowerCase(Locale.ROOT).replace("-", "\\-");
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
