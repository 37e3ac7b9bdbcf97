package com.loadspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.SpecValidationException;
import com.loadspec.model.parse.ExtractedComponents;
import com.loadspec.model.parse.InferredFields;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ValidationReport;
import com.loadspec.model.spec.DurationUnit;
import com.loadspec.model.spec.HttpMethod;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.PayloadSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import com.loadspec.model.spec.VariableDefinition;
import com.loadspec.model.spec.VariableType;
import com.loadspec.service.api.CorrectionRequester;
import com.loadspec.service.api.ResponseValidator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns backend text into a {@link LoadTestSpec} that satisfies every structural rule.
 * <p>
 * A response with a few errors is patched locally from the parse context. One with more errors, or one
 * the local patch does not fix, is sent back to the backend for a bounded number of correction rounds.
 * A literal request body found in the input always replaces whatever the backend made of it.
 */
@Service
@Slf4j
public class ResponseValidatorImpl implements ResponseValidator {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");
    private static final String DEFAULT_URL = "/api/endpoint";
    private static final int DEFAULT_VIRTUAL_USERS = 10;
    private static final long MIN_NINE_DIGIT_BASE36 = 101559956668416L;

    private final ParserProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ResponseValidatorImpl(ParserProperties properties) {
        this.properties = properties;
    }

    @Override
    public JsonNode decode(String response) {
        if (response == null || response.isBlank()) {
            throw new SpecValidationException("Backend response is empty", List.of("response is empty"));
        }
        String cleaned = CODE_FENCE.matcher(response).replaceAll("").trim();
        int first = cleaned.indexOf('{');
        int last = cleaned.lastIndexOf('}');
        if (first < 0 || last <= first) {
            throw new SpecValidationException("Backend response holds no JSON object",
                    List.of("response contains no JSON object"));
        }
        String candidate = cleaned.substring(first, last + 1);
        Optional<JsonNode> node = JsonRepair.parseStrict(candidate);
        if (node.isEmpty()) {
            node = JsonRepair.parseRepaired(candidate);
            node.ifPresent(n -> log.debug("Backend JSON needed repair"));
        }
        return node.filter(JsonNode::isObject)
                .orElseThrow(() -> new SpecValidationException("Backend response is not valid JSON",
                        List.of("response is not valid JSON")));
    }

    @Override
    public ValidationReport validate(JsonNode candidate) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (candidate == null || !candidate.isObject()) {
            errors.add("response is not a JSON object");
            return new ValidationReport(errors, warnings);
        }

        JsonNode requests = candidate.get("requests");
        if (requests == null || requests.isNull()) {
            errors.add("requests is missing");
        } else if (!requests.isArray()) {
            errors.add("requests must be an array");
        } else if (requests.isEmpty()) {
            errors.add("requests must contain at least one request");
        } else {
            for (int i = 0; i < requests.size(); i++) {
                validateRequest(requests.get(i), "requests[" + i + "]", errors, warnings);
            }
        }

        JsonNode testType = candidate.get("testType");
        if (testType == null || testType.isNull()) {
            warnings.add("testType is missing");
        } else if (TestType.fromValue(testType.asText()) == null) {
            errors.add("testType '" + testType.asText() + "' is not one of baseline, spike, stress, endurance, volume");
        }

        JsonNode loadPattern = candidate.get("loadPattern");
        if (loadPattern == null || !loadPattern.isObject()) {
            errors.add("loadPattern is missing");
        } else {
            JsonNode type = loadPattern.get("type");
            if (type == null || type.isNull()) {
                warnings.add("loadPattern.type is missing");
            } else if (LoadPatternType.fromValue(type.asText()) == null) {
                errors.add("loadPattern.type '" + type.asText() + "' is not one of constant, ramp-up, spike, step");
            }
            JsonNode virtualUsers = loadPattern.get("virtualUsers");
            JsonNode requestsPerSecond = loadPattern.get("requestsPerSecond");
            if (!wholeCount(virtualUsers) && !wholeCount(requestsPerSecond)) {
                errors.add("loadPattern needs a positive whole virtualUsers or requestsPerSecond");
            } else {
                if (present(virtualUsers) && !wholeCount(virtualUsers)) {
                    errors.add("loadPattern.virtualUsers '" + virtualUsers.asText() + "' is not a positive whole number");
                }
                if (present(requestsPerSecond) && !wholeCount(requestsPerSecond)) {
                    errors.add("loadPattern.requestsPerSecond '" + requestsPerSecond.asText()
                            + "' is not a positive whole number");
                }
            }
        }

        JsonNode duration = candidate.get("duration");
        if (duration == null || !duration.isObject()) {
            errors.add("duration is missing");
        } else {
            if (!wholeCount(duration.get("value"))) {
                errors.add("duration.value must be a positive whole number");
            }
            JsonNode unit = duration.get("unit");
            if (!present(unit) || DurationUnit.fromValue(unit.asText()) == null) {
                errors.add("duration.unit must be seconds, minutes or hours");
            }
        }
        return new ValidationReport(errors, warnings);
    }

    private static void validateRequest(JsonNode request, String path, List<String> errors, List<String> warnings) {
        if (request == null || !request.isObject()) {
            errors.add(path + " must be an object");
            return;
        }
        JsonNode method = request.get("method");
        if (method == null || method.isNull() || method.asText().isBlank()) {
            errors.add(path + ".method is missing");
        } else if (HttpMethod.parse(method.asText()).isEmpty()) {
            errors.add(path + ".method '" + method.asText() + "' is not a valid HTTP method");
        }
        JsonNode url = request.get("url");
        if (url == null || url.isNull() || url.asText().isBlank()) {
            errors.add(path + ".url is missing");
        } else if (!url.asText().startsWith("/") && !url.asText().toLowerCase(Locale.ROOT).startsWith("http")) {
            warnings.add(path + ".url '" + url.asText() + "' is neither absolute nor a path");
        }
        if (request.hasNonNull("body") && request.hasNonNull("payload")) {
            warnings.add(path + " has both body and payload; body wins");
        }
    }

    private static boolean present(JsonNode node) {
        return node != null && !node.isNull();
    }

    /**
     * True for an integral value between 1 and {@link Integer#MAX_VALUE}, given as a number or as
     * numeric text. Fractions would be truncated when mapped onto the spec.
     */
    static boolean wholeCount(JsonNode node) {
        if (!present(node)) {
            return false;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return false;
            }
        } else {
            return false;
        }
        return value >= 1 && value <= Integer.MAX_VALUE && value == Math.rint(value);
    }

    @Override
    public LoadTestSpec validateAndCorrect(String response, ParseContext context, CorrectionRequester corrector) {
        int maxRounds = corrector == null ? 0 : properties.getCorrection().getMaxRemoteRounds();
        String current = response;
        for (int round = 0; ; round++) {
            List<String> errors = new ArrayList<>();
            LoadTestSpec spec = tryBuild(current, context, errors);
            if (spec != null) {
                if (round > 0) {
                    log.info("Backend response accepted after {} correction round(s)", round);
                }
                return spec;
            }
            if (round >= maxRounds) {
                log.warn("Backend response rejected, no correction rounds left: {}", errors);
                throw new SpecValidationException("Backend response failed validation", errors);
            }
            log.warn("Backend response rejected ({}), requesting correction {}/{}", errors, round + 1, maxRounds);
            current = corrector.requestCorrection(current, errors);
        }
    }

    /**
     * One decode, validate and local-correction pass.
     *
     * @return The spec, or {@code null} with {@code errors} filled in.
     */
    private LoadTestSpec tryBuild(String text, ParseContext context, List<String> errors) {
        JsonNode node;
        try {
            node = decode(text);
        } catch (SpecValidationException e) {
            errors.addAll(e.getErrors());
            return null;
        }

        ValidationReport report = validate(node);
        report.warnings().forEach(w -> log.debug("Response warning: {}", w));
        if (!report.isValid()) {
            if (report.errors().size() > properties.getCorrection().getMaxLocallyCorrectableErrors()) {
                errors.addAll(report.errors());
                return null;
            }
            ObjectNode corrected = correctLocally(((ObjectNode) node).deepCopy(), context);
            ValidationReport recheck = validate(corrected);
            if (!recheck.isValid()) {
                errors.addAll(recheck.errors());
                return null;
            }
            log.info("Fixed {} response error(s) from the parse context: {}", report.errors().size(), report.errors());
            node = corrected;
        }

        normalizePayloads(node);
        LoadTestSpec spec;
        try {
            spec = objectMapper.convertValue(node, LoadTestSpec.class);
        } catch (IllegalArgumentException e) {
            log.error("Validated response did not map onto a spec", e);
            errors.add("response does not match the specification structure: " + e.getMessage());
            return null;
        }
        if (!spec.isUsable()) {
            log.warn("Validated response mapped onto an unusable spec: {}", spec);
            errors.add("response does not yield a usable load test (requests, volume and duration are required)");
            return null;
        }
        enhance(spec, context);
        return spec;
    }

    /**
     * Fills missing or invalid fields from what the context already knows.
     */
    ObjectNode correctLocally(ObjectNode node, ParseContext context) {
        ExtractedComponents components = context.extractedComponents();
        InferredFields inferred = context.inferredFields();

        JsonNode requests = node.get("requests");
        if (requests == null || !requests.isArray() || requests.isEmpty()) {
            ArrayNode array = node.putArray("requests");
            ObjectNode request = array.addObject();
            request.put("method", contextualMethod(context).name());
            request.put("url", contextualUrl(components));
        } else {
            for (JsonNode entry : requests) {
                if (entry instanceof ObjectNode request) {
                    if (HttpMethod.parse(request.path("method").asText(null)).isEmpty()) {
                        request.put("method", contextualMethod(context).name());
                    }
                    if (request.path("url").asText("").isBlank()) {
                        request.put("url", contextualUrl(components));
                    }
                }
            }
        }

        JsonNode testType = node.get("testType");
        if (testType != null && !testType.isNull() && TestType.fromValue(testType.asText()) == null) {
            node.put("testType", inferred.testType() != null ? inferred.testType().value() : TestType.BASELINE.value());
        }

        ObjectNode loadPattern = node.get("loadPattern") instanceof ObjectNode existing ? existing : node.putObject("loadPattern");
        JsonNode type = loadPattern.get("type");
        if (type != null && !type.isNull() && LoadPatternType.fromValue(type.asText()) == null) {
            loadPattern.put("type", inferred.loadPattern() != null ? inferred.loadPattern().value() : LoadPatternType.CONSTANT.value());
        }
        for (String field : List.of("virtualUsers", "requestsPerSecond")) {
            if (present(loadPattern.get(field)) && !wholeCount(loadPattern.get(field))) {
                loadPattern.remove(field);
            }
        }
        if (!wholeCount(loadPattern.get("virtualUsers")) && !wholeCount(loadPattern.get("requestsPerSecond"))) {
            loadPattern.put("virtualUsers", components.counts().isEmpty() ? DEFAULT_VIRTUAL_USERS : components.counts().get(0));
        }

        ObjectNode duration = node.get("duration") instanceof ObjectNode existing ? existing : node.putObject("duration");
        TestDuration fallbackDuration = inferred.duration() != null ? inferred.duration() : TestDuration.seconds(30);
        JsonNode unit = duration.get("unit");
        boolean unknownUnit = present(unit) && DurationUnit.fromValue(unit.asText()) == null;
        if (!wholeCount(duration.get("value")) || unknownUnit) {
            duration.put("value", fallbackDuration.getValue());
            duration.put("unit", fallbackDuration.getUnit().value());
        }
        if (DurationUnit.fromValue(duration.path("unit").asText("")) == null) {
            duration.put("unit", DurationUnit.SECONDS.value());
        }
        return node;
    }

    private static HttpMethod contextualMethod(ParseContext context) {
        List<String> methods = context.extractedComponents().methods();
        if (!methods.isEmpty()) {
            return HttpMethod.parse(methods.get(0)).orElse(HttpMethod.GET);
        }
        return context.inferredFields().requestBody() != null ? HttpMethod.POST : HttpMethod.GET;
    }

    private static String contextualUrl(ExtractedComponents components) {
        return components.urls().isEmpty() ? DEFAULT_URL : components.urls().get(0);
    }

    /**
     * A payload object without a template, or whose template is itself an object, is a literal body.
     * A bare string payload is a template.
     */
    private static void normalizePayloads(JsonNode node) {
        JsonNode requests = node.get("requests");
        if (requests == null || !requests.isArray()) {
            return;
        }
        for (JsonNode entry : requests) {
            if (!(entry instanceof ObjectNode request) || !request.hasNonNull("payload")) {
                continue;
            }
            JsonNode payload = request.get("payload");
            if (payload.isTextual()) {
                ObjectNode wrapped = request.putObject("payload");
                wrapped.put("template", payload.asText());
            } else if (payload.isObject() && (!payload.has("template") || payload.get("template").isContainerNode())) {
                JsonNode literal = payload.has("template") ? payload.get("template") : payload;
                if (!request.hasNonNull("body")) {
                    request.set("body", literal);
                }
                request.remove("payload");
            }
        }
    }

    private void enhance(LoadTestSpec spec, ParseContext context) {
        if (spec.getId() == null || spec.getId().isBlank()) {
            spec.setId(generateId());
        }
        if (spec.getTestType() == null) {
            spec.setTestType(context.inferredFields().testType() != null ? context.inferredFields().testType() : TestType.BASELINE);
        }
        for (RequestSpec request : spec.getRequests()) {
            if (request.getHeaders() == null) {
                request.setHeaders(new LinkedHashMap<>());
            }
            if (request.getMethod() == null) {
                request.setMethod(contextualMethod(context));
            }
        }

        JsonNode literal = context.inferredFields().requestBody();
        RequestSpec primary = spec.primaryRequest();
        if (literal != null && primary != null && (primary.getMethod().carriesBody() || primary.hasPayload())) {
            primary.useLiteralBody(literal.deepCopy());
        }

        for (RequestSpec request : spec.getRequests()) {
            if (request.hasLiteralBody()) {
                request.setPayload(null);
            } else if (request.getPayload() != null && request.getPayload().getTemplate() != null) {
                completeVariables(request.getPayload());
            }
            if (request.getMethod().carriesBody() && request.hasPayload() && request.header("Content-Type") == null) {
                request.getHeaders().put("Content-Type", "application/json");
            }
        }

        LoadPattern loadPattern = spec.getLoadPattern();
        if (loadPattern.getType() == null) {
            loadPattern.setType(context.inferredFields().loadPattern() != null
                    ? context.inferredFields().loadPattern()
                    : patternFor(spec.getTestType()));
        }
        if (spec.getName() == null || spec.getName().isBlank()) {
            spec.setName(generateName(spec));
        }
        if (spec.getDescription() == null || spec.getDescription().isBlank()) {
            String original = context.originalInput() == null ? "" : context.originalInput().trim();
            spec.setDescription(original.isEmpty() ? spec.getName() : original);
        }
    }

    private static LoadPatternType patternFor(TestType testType) {
        return switch (testType) {
            case SPIKE -> LoadPatternType.SPIKE;
            case STRESS -> LoadPatternType.RAMP_UP;
            case BASELINE, ENDURANCE, VOLUME -> LoadPatternType.CONSTANT;
        };
    }

    /**
     * Declares every {@code {{name}}} placeholder of the template that has no variable yet, and gives
     * declared variables their default parameters.
     */
    static void completeVariables(PayloadSpec payload) {
        List<VariableDefinition> variables = payload.getVariables() == null
                ? new ArrayList<>() : new ArrayList<>(payload.getVariables());
        Matcher matcher = PLACEHOLDER.matcher(payload.getTemplate());
        while (matcher.find()) {
            String name = matcher.group(1);
            if (variables.stream().noneMatch(v -> name.equals(v.getName()))) {
                variables.add(new VariableDefinition(name, typeFor(name), new LinkedHashMap<>()));
            }
        }
        for (VariableDefinition variable : variables) {
            if (variable.getType() == null) {
                variable.setType(typeFor(variable.getName()));
            }
            if (variable.getParameters() == null) {
                variable.setParameters(new LinkedHashMap<>());
            }
            switch (variable.getType()) {
                case RANDOM_STRING -> variable.getParameters().putIfAbsent("length", 10);
                case RANDOM_ID -> {
                    variable.getParameters().putIfAbsent("min", 1000);
                    variable.getParameters().putIfAbsent("max", 999999);
                }
                case SEQUENCE, INCREMENTAL -> {
                    variable.getParameters().putIfAbsent("start", 1);
                    variable.getParameters().putIfAbsent("step", 1);
                }
                default -> {
                    // no defaults
                }
            }
        }
        payload.setVariables(variables);
    }

    static VariableType typeFor(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.contains("uuid")) {
            return VariableType.UUID;
        }
        if (lower.contains("id")) {
            return VariableType.RANDOM_ID;
        }
        if (lower.contains("time") || lower.contains("date")) {
            return VariableType.TIMESTAMP;
        }
        return VariableType.RANDOM_STRING;
    }

    static String generateId() {
        return "test_" + System.currentTimeMillis() + "_"
                + Long.toString(ThreadLocalRandom.current().nextLong(MIN_NINE_DIGIT_BASE36, Long.MAX_VALUE), 36).substring(0, 9);
    }

    private static String generateName(LoadTestSpec spec) {
        RequestSpec primary = spec.primaryRequest();
        String url = primary == null || primary.getUrl() == null ? "" : primary.getUrl();
        String path = url.contains("?") ? url.substring(0, url.indexOf('?')) : url;
        String endpoint = path.substring(path.lastIndexOf('/') + 1);
        return spec.getTestType().displayName() + " Test - "
                + (primary == null ? HttpMethod.GET : primary.getMethod()) + " "
                + (endpoint.isBlank() ? "API" : endpoint);
    }
}
