package com.loadspec.service.impl;

import com.loadspec.model.parse.IssueSeverity;
import com.loadspec.model.parse.SemanticIssue;
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
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;
import static org.assertj.core.api.Assertions.assertThat;

class SemanticValidatorImplTest {

    private final SemanticValidatorImpl validator = new SemanticValidatorImpl();

    private static LoadTestSpec spec(RequestSpec request, LoadPattern loadPattern, TestDuration duration) {
        LoadTestSpec spec = new LoadTestSpec();
        spec.setTestType(TestType.BASELINE);
        spec.setRequests(new ArrayList<>(List.of(request)));
        spec.setLoadPattern(loadPattern);
        spec.setDuration(duration);
        return spec;
    }

    private static List<String> rules(List<SemanticIssue> issues) {
        return issues.stream().map(SemanticIssue::rule).collect(Collectors.toList());
    }

    @Test
    void review_shouldFindNothingInReasonableSpec() {
        LoadTestSpec spec = spec(new RequestSpec(HttpMethod.GET, "https://shop.internal/api/users"),
                new LoadPattern(LoadPatternType.CONSTANT, 50), TestDuration.minutes(5));

        assertThat(validator.review(spec)).isEmpty();
    }

    @Test
    void review_shouldFlagPlaceholderAndMalformedUrls() {
        LoadTestSpec spec = spec(new RequestSpec(HttpMethod.GET, "/api/endpoint"),
                new LoadPattern(LoadPatternType.CONSTANT, 10), TestDuration.seconds(30));
        spec.getRequests().add(new RequestSpec(HttpMethod.GET, "api.example.com/users"));

        List<SemanticIssue> issues = validator.review(spec);

        assertThat(rules(issues)).containsExactly("placeholder-url", "url-format", "placeholder-url");
        assertThat(issues.get(0).severity()).isEqualTo(IssueSeverity.HIGH);
        assertThat(issues.get(1).field()).isEqualTo("requests[1].url");
        assertThat(issues.get(2).message()).isEqualTo("Request 2: URL appears to be a placeholder");
    }

    @Test
    void review_shouldFlagExtremeLoadAndDurations() {
        LoadPattern heavy = new LoadPattern(LoadPatternType.CONSTANT, 20000);
        heavy.setRequestsPerSecond(1500);

        List<SemanticIssue> shortRun = validator.review(spec(new RequestSpec(HttpMethod.GET, "/api/users"),
                heavy, TestDuration.seconds(5)));
        List<SemanticIssue> longRun = validator.review(spec(new RequestSpec(HttpMethod.GET, "/api/users"),
                new LoadPattern(LoadPatternType.CONSTANT, 10), new TestDuration(2, DurationUnit.HOURS)));

        assertThat(rules(shortRun)).containsExactly("high-virtual-users", "high-rps", "short-duration");
        assertThat(rules(longRun)).containsExactly("long-duration");
    }

    @Test
    void review_shouldFlagTestTypesThatDisagreeWithPattern() {
        LoadTestSpec spike = spec(new RequestSpec(HttpMethod.GET, "/api/users"),
                new LoadPattern(LoadPatternType.CONSTANT, 10), TestDuration.seconds(30));
        spike.setTestType(TestType.SPIKE);
        LoadTestSpec stress = spec(new RequestSpec(HttpMethod.GET, "/api/users"),
                new LoadPattern(LoadPatternType.STEP, 10), TestDuration.seconds(30));
        stress.setTestType(TestType.STRESS);
        LoadTestSpec rampWithoutTime = spec(new RequestSpec(HttpMethod.GET, "/api/users"),
                new LoadPattern(LoadPatternType.RAMP_UP, 10), TestDuration.seconds(30));

        assertThat(rules(validator.review(spike))).containsExactly("spike-pattern");
        assertThat(rules(validator.review(stress))).containsExactly("stress-pattern");
        assertThat(rules(validator.review(rampWithoutTime))).containsExactly("ramp-up-time");
    }

    @Test
    void review_shouldMatchTemplatePlaceholdersAgainstVariables() {
        // --- Arrange ---
        RequestSpec request = new RequestSpec(HttpMethod.POST, "/api/orders");
        request.getHeaders().put("Content-Type", "application/json");
        PayloadSpec payload = new PayloadSpec();
        payload.setTemplate("{\"user\":\"{{userId}}\",\"qty\":{{quantity}}}");
        payload.getVariables().add(new VariableDefinition("userId", VariableType.RANDOM_ID, new LinkedHashMap<>()));
        payload.getVariables().add(new VariableDefinition("sessionId", VariableType.UUID, new LinkedHashMap<>()));
        request.setPayload(payload);

        // --- Act ---
        List<SemanticIssue> issues = validator.review(spec(request,
                new LoadPattern(LoadPatternType.CONSTANT, 10), TestDuration.seconds(30)));

        // --- Assert ---
        assertThat(rules(issues)).containsExactly("undeclared-variables", "unused-variables");
        assertThat(issues.get(0).message()).isEqualTo("Request 1: variables quantity used in template but not defined");
        assertThat(issues.get(1).message()).isEqualTo("Request 1: variables sessionId defined but not used in template");
    }

    @Test
    void review_shouldFlagBrokenTemplateAndMissingPayload() {
        RequestSpec broken = new RequestSpec(HttpMethod.PUT, "/api/items/1");
        PayloadSpec payload = new PayloadSpec();
        payload.setTemplate("{\"name\": {{name}}");
        payload.getVariables().add(new VariableDefinition("name", VariableType.RANDOM_STRING, new LinkedHashMap<>()));
        broken.setPayload(payload);
        LoadTestSpec spec = spec(broken, new LoadPattern(LoadPatternType.CONSTANT, 10), TestDuration.seconds(30));
        spec.getRequests().add(new RequestSpec(HttpMethod.POST, "/api/items"));

        List<SemanticIssue> issues = validator.review(spec);

        assertThat(rules(issues)).containsExactly("payload-json", "missing-payload");
        assertThat(issues.get(1).message()).isEqualTo("Request 2: POST request has no payload");
    }
}
