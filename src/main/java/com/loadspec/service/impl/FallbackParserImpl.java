package com.loadspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.FallbackParseResult;
import com.loadspec.model.spec.DurationUnit;
import com.loadspec.model.spec.HttpMethod;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.PayloadSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import com.loadspec.service.api.FallbackParser;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rule-based parser used when no AI backend is available or every recovery attempt failed.
 * <p>
 * The rules run in a fixed order and each one that matches overwrites the fields it extracts, so a
 * later rule wins over an earlier one for the same field (the URL of {@code url-only} replaces the one
 * found by {@code http-method-url}). When fewer than three rules match, keyword tables fill the fields
 * that are still empty. Each matched rule adds 0.1 to a 0.3 base confidence, capped at the configured
 * fallback ceiling.
 */
@Service
@Slf4j
public class FallbackParserImpl implements FallbackParser {

    static final String DEFAULT_URL = "/api/endpoint";
    static final int DEFAULT_VIRTUAL_USERS = 10;
    private static final int MAX_USERS_FROM_TOTAL = 100;
    private static final double BASE_CONFIDENCE = 0.3;
    private static final double RULE_BONUS = 0.1;
    private static final int KEYWORD_THRESHOLD = 3;

    private static final List<Rule> RULES = List.of(
            new Rule("http-method-url", Pattern.compile("\\b(GET|POST|PUT|DELETE|PATCH)\\s+(\\S+)", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> {
                        d.method = HttpMethod.valueOf(m.group(1).toUpperCase(Locale.ROOT));
                        String target = InputPreprocessorImpl.trimUrl(m.group(2));
                        if (target.startsWith("/") || target.toLowerCase(Locale.ROOT).startsWith("http")) {
                            d.url = target;
                        }
                    }),
            new Rule("url-only", Pattern.compile("(https?://\\S+|(?<![\\w/:.])/[^\\s,;)]+)", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> d.url = InputPreprocessorImpl.trimUrl(m.group(1))),
            new Rule("virtual-users", Pattern.compile("(\\d+)\\s*(users?|virtual\\s*users?|concurrent|parallel)", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> d.virtualUsers = parseInt(m.group(1))),
            new Rule("requests-per-second", Pattern.compile("(\\d+)\\s*(rps|requests?\\s*per\\s*second|req/s)", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> d.requestsPerSecond = parseInt(m.group(1))),
            new Rule("total-requests", Pattern.compile("(\\d+)\\s*(requests?|calls?)", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> d.totalRequests = parseInt(m.group(1))),
            new Rule("duration", Pattern.compile("(?:for\\s+)?(\\d+)\\s*(seconds?|secs?|minutes?|mins?|hours?|hrs?)\\b", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> {
                        Integer value = parseInt(m.group(1));
                        if (value != null && value > 0) {
                            d.duration = new TestDuration(value, DurationUnit.fromValue(m.group(2)));
                        }
                    }),
            new Rule("test-type", Pattern.compile("\\b(spike|stress|endurance|volume|baseline)\\s*test", Pattern.CASE_INSENSITIVE),
                    (m, text, d) -> d.testType = TestType.fromValue(m.group(1))),
            new Rule("payload-json", Pattern.compile("\\b(?:with|payload|body|data)\\s*[:\\-]?\\s*\\{", Pattern.CASE_INSENSITIVE),
                    FallbackParserImpl::extractPayload));

    private static final Map<String, HttpMethod> METHOD_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, TestType> TEST_TYPE_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, LoadPatternType> LOAD_PATTERN_KEYWORDS = new LinkedHashMap<>();

    static {
        METHOD_KEYWORDS.put("get", HttpMethod.GET);
        METHOD_KEYWORDS.put("post", HttpMethod.POST);
        METHOD_KEYWORDS.put("put", HttpMethod.PUT);
        METHOD_KEYWORDS.put("delete", HttpMethod.DELETE);
        METHOD_KEYWORDS.put("patch", HttpMethod.PATCH);
        METHOD_KEYWORDS.put("fetch", HttpMethod.GET);
        METHOD_KEYWORDS.put("retrieve", HttpMethod.GET);
        METHOD_KEYWORDS.put("create", HttpMethod.POST);
        METHOD_KEYWORDS.put("update", HttpMethod.PUT);
        METHOD_KEYWORDS.put("remove", HttpMethod.DELETE);
        METHOD_KEYWORDS.put("modify", HttpMethod.PATCH);

        for (TestType type : TestType.values()) {
            TEST_TYPE_KEYWORDS.put(type.value(), type);
        }
        TEST_TYPE_KEYWORDS.put("load", TestType.BASELINE);
        TEST_TYPE_KEYWORDS.put("performance", TestType.BASELINE);

        LOAD_PATTERN_KEYWORDS.put("spike", LoadPatternType.SPIKE);
        LOAD_PATTERN_KEYWORDS.put("gradually", LoadPatternType.RAMP_UP);
        LOAD_PATTERN_KEYWORDS.put("ramp", LoadPatternType.RAMP_UP);
        LOAD_PATTERN_KEYWORDS.put("increase", LoadPatternType.RAMP_UP);
        LOAD_PATTERN_KEYWORDS.put("constant", LoadPatternType.CONSTANT);
        LOAD_PATTERN_KEYWORDS.put("steady", LoadPatternType.CONSTANT);
        LOAD_PATTERN_KEYWORDS.put("step", LoadPatternType.STEP);
    }

    private static final Pattern ANY_NUMBER = Pattern.compile("\\d+");
    private static final Pattern ABSOLUTE_URL = Pattern.compile("https?://\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE_URL = Pattern.compile("(?<![\\w/:.])/\\S+");
    private static final Pattern METHOD_WORD = Pattern.compile("\\b(GET|POST|PUT|DELETE|PATCH)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern METHOD_LIKE = Pattern.compile(
            "\\b(get|post|put|delete|patch|fetch|create|update|remove)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOAD_WORDS = Pattern.compile("\\d+\\s*(users?|rps|requests?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DURATION_WORDS = Pattern.compile("\\d+\\s*(seconds?|minutes?|hours?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TEST_TYPE_WORDS = Pattern.compile("\\b(spike|stress|endurance|volume|baseline)\\b", Pattern.CASE_INSENSITIVE);

    private final ParserProperties properties;

    public FallbackParserImpl(ParserProperties properties) {
        this.properties = properties;
    }

    @Override
    public FallbackParseResult parse(String input) {
        String text = input == null ? "" : input.trim();
        if (text.isEmpty()) {
            return template();
        }

        Extracted data = new Extracted();
        List<String> matched = new ArrayList<>();
        double confidence = BASE_CONFIDENCE;
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            if (matcher.find()) {
                rule.action().apply(matcher, text, data);
                matched.add(rule.name());
                confidence += RULE_BONUS;
            }
        }
        if (matched.size() < KEYWORD_THRESHOLD && applyKeywords(text, data)) {
            matched.add("keyword-extraction");
            confidence += RULE_BONUS;
        }

        List<Assumption> assumptions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        LoadTestSpec spec = build(text, data, assumptions, warnings);

        double bounded = Math.max(properties.getConfidence().getFallbackFloor(),
                Math.min(confidence, properties.getConfidence().getFallbackCeiling()));
        log.info("Rule-based parse matched {} with confidence {}", matched, String.format("%.2f", bounded));
        return new FallbackParseResult(spec, bounded, matched, assumptions, warnings);
    }

    private LoadTestSpec build(String text, Extracted data, List<Assumption> assumptions, List<String> warnings) {
        HttpMethod method = data.method;
        if (method == null) {
            method = data.body != null || data.payload != null ? HttpMethod.POST : HttpMethod.GET;
            assumptions.add(new Assumption("method", method.name(), "No HTTP method found in the input",
                    List.of("GET", "POST", "PUT", "DELETE")));
        }
        String url = data.url;
        if (url == null) {
            url = DEFAULT_URL;
            assumptions.add(new Assumption("url", url, "No URL found in the input",
                    List.of("http://localhost:8080" + DEFAULT_URL, "https://api.example.com" + DEFAULT_URL)));
            warnings.add("No URL found; replace the placeholder " + DEFAULT_URL + " with the real endpoint");
        }

        RequestSpec request = new RequestSpec(method, url);
        if (method.carriesBody()) {
            request.getHeaders().put("Content-Type", "application/json");
            if (data.body != null) {
                request.useLiteralBody(data.body);
            } else if (data.payload != null) {
                request.setPayload(data.payload);
                ResponseValidatorImpl.completeVariables(data.payload);
            }
        }

        TestType testType = data.testType;
        if (testType == null) {
            testType = TestType.BASELINE;
            assumptions.add(new Assumption("testType", testType.value(), "No test type found in the input",
                    List.of("spike", "stress", "endurance", "volume")));
        }

        LoadPatternType patternType = data.loadPatternType != null ? data.loadPatternType : inferPattern(text, testType);
        LoadPattern loadPattern = new LoadPattern(patternType, null);
        if (data.virtualUsers != null && data.virtualUsers > 0) {
            loadPattern.setVirtualUsers(data.virtualUsers);
        } else if (data.requestsPerSecond != null && data.requestsPerSecond > 0) {
            loadPattern.setRequestsPerSecond(data.requestsPerSecond);
        } else if (data.totalRequests != null && data.totalRequests > 0) {
            loadPattern.setVirtualUsers(Math.min(data.totalRequests, MAX_USERS_FROM_TOTAL));
        } else {
            int users = firstPlausibleNumber(text).orElse(DEFAULT_VIRTUAL_USERS);
            loadPattern.setVirtualUsers(users);
            assumptions.add(new Assumption("virtualUsers", String.valueOf(users), "No user count found in the input",
                    List.of("1", "10", "50", "100")));
        }
        if (patternType == LoadPatternType.RAMP_UP) {
            loadPattern.setRampUpTime(TestDuration.minutes(2));
        }

        TestDuration duration = data.duration;
        if (duration == null) {
            duration = ContextEnhancerImpl.explicitDuration(text).orElse(null);
        }
        if (duration == null) {
            duration = TestDuration.seconds(30);
            assumptions.add(new Assumption("duration", duration.describe(), "No duration found in the input",
                    List.of("1 minute", "5 minutes")));
        }

        LoadTestSpec spec = new LoadTestSpec();
        spec.setId(ResponseValidatorImpl.generateId());
        spec.setName(testType.displayName() + " Test - " + method + " (" + LocalDate.now() + ")");
        spec.setDescription(text);
        spec.setTestType(testType);
        spec.setRequests(new ArrayList<>(List.of(request)));
        spec.setLoadPattern(loadPattern);
        spec.setDuration(duration);
        return spec;
    }

    /**
     * The minimal spec returned for empty input.
     */
    private FallbackParseResult template() {
        RequestSpec request = new RequestSpec(HttpMethod.GET, DEFAULT_URL);
        LoadTestSpec spec = new LoadTestSpec();
        spec.setId(ResponseValidatorImpl.generateId());
        spec.setName("Baseline Test - GET (" + LocalDate.now() + ")");
        spec.setDescription("Template specification for empty input");
        spec.setTestType(TestType.BASELINE);
        spec.setRequests(new ArrayList<>(List.of(request)));
        spec.setLoadPattern(new LoadPattern(LoadPatternType.CONSTANT, DEFAULT_VIRTUAL_USERS));
        spec.setDuration(TestDuration.seconds(30));

        List<Assumption> assumptions = List.of(
                new Assumption("method", "GET", "Input was empty", List.of("GET", "POST", "PUT", "DELETE")),
                new Assumption("url", DEFAULT_URL, "Input was empty", List.of("http://localhost:8080", "https://api.example.com")),
                new Assumption("virtualUsers", String.valueOf(DEFAULT_VIRTUAL_USERS), "Input was empty", List.of("1", "10", "50", "100")));
        List<String> warnings = List.of(
                "Input was empty; returning a template specification",
                "Replace the placeholder " + DEFAULT_URL + " with the real endpoint");
        log.warn("Empty input, returning template specification");
        return new FallbackParseResult(spec, properties.getConfidence().getFallbackFloor(), List.of(), assumptions, warnings);
    }

    @Override
    public boolean canParse(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }
        return ABSOLUTE_URL.matcher(input).find()
                || RELATIVE_URL.matcher(input).find()
                || METHOD_LIKE.matcher(input).find()
                || ANY_NUMBER.matcher(input).find();
    }

    @Override
    public double confidenceScore(String input) {
        if (input == null || input.isBlank()) {
            return 0;
        }
        double score = 0;
        if (ABSOLUTE_URL.matcher(input).find()) {
            score += 0.3;
        } else if (RELATIVE_URL.matcher(input).find()) {
            score += 0.2;
        }
        if (METHOD_WORD.matcher(input).find()) {
            score += 0.2;
        }
        if (LOAD_WORDS.matcher(input).find()) {
            score += 0.2;
        }
        if (DURATION_WORDS.matcher(input).find()) {
            score += 0.1;
        }
        if (TEST_TYPE_WORDS.matcher(input).find()) {
            score += 0.1;
        }
        return Math.min(score, properties.getConfidence().getFallbackCeiling());
    }

    /**
     * Fills fields the rules left empty from the keyword tables.
     *
     * @return {@code true} if any keyword was found.
     */
    private static boolean applyKeywords(String text, Extracted data) {
        String lower = text.toLowerCase(Locale.ROOT);
        Optional<HttpMethod> method = firstKeyword(METHOD_KEYWORDS, lower);
        Optional<TestType> testType = firstKeyword(TEST_TYPE_KEYWORDS, lower);
        Optional<LoadPatternType> pattern = firstKeyword(LOAD_PATTERN_KEYWORDS, lower);
        if (data.method == null) {
            method.ifPresent(m -> data.method = m);
        }
        if (data.testType == null) {
            testType.ifPresent(t -> data.testType = t);
        }
        if (data.loadPatternType == null) {
            pattern.ifPresent(p -> data.loadPatternType = p);
        }
        return method.isPresent() || testType.isPresent() || pattern.isPresent();
    }

    private static <T> Optional<T> firstKeyword(Map<String, T> table, String lower) {
        return table.entrySet().stream()
                .filter(e -> Pattern.compile("\\b" + e.getKey() + "\\b").matcher(lower).find())
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static LoadPatternType inferPattern(String text, TestType testType) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (testType == TestType.SPIKE || lower.contains("spike")) {
            return LoadPatternType.SPIKE;
        }
        if (testType == TestType.STRESS || lower.contains("stress") || lower.contains("gradually") || lower.contains("ramp")) {
            return LoadPatternType.RAMP_UP;
        }
        if (lower.contains("step")) {
            return LoadPatternType.STEP;
        }
        return LoadPatternType.CONSTANT;
    }

    /**
     * Takes the whole brace-balanced object after the keyword. A parseable object becomes a literal
     * body, anything else a payload template.
     */
    private static void extractPayload(Matcher matcher, String text, Extracted data) {
        int open = matcher.end() - 1;
        int close = InputPreprocessorImpl.findMatchingBracket(text, open);
        if (close < 0) {
            return;
        }
        String raw = text.substring(open, close + 1);
        Optional<JsonNode> parsed = JsonRepair.parseStrict(raw).or(() -> JsonRepair.parseRepaired(raw));
        if (parsed.isPresent() && parsed.get().isObject() && !raw.contains("{{")) {
            data.body = parsed.get();
        } else {
            data.payload = new PayloadSpec(raw, new ArrayList<>());
        }
    }

    private static Optional<Integer> firstPlausibleNumber(String text) {
        Matcher matcher = ANY_NUMBER.matcher(text);
        if (matcher.find()) {
            Integer value = parseInt(matcher.group());
            if (value != null && value >= 1 && value <= 10000) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static Integer parseInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Rule(String name, Pattern pattern, RuleAction action) {
    }

    @FunctionalInterface
    private interface RuleAction {
        void apply(Matcher matcher, String text, Extracted data);
    }

    /**
     * Fields gathered by the rules; later rules overwrite earlier ones.
     */
    private static final class Extracted {
        private HttpMethod method;
        private String url;
        private Integer virtualUsers;
        private Integer requestsPerSecond;
        private Integer totalRequests;
        private TestDuration duration;
        private TestType testType;
        private LoadPatternType loadPatternType;
        private JsonNode body;
        private PayloadSpec payload;
    }
}
