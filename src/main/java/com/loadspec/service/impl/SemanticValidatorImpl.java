package com.loadspec.service.impl;

import com.loadspec.model.parse.IssueSeverity;
import com.loadspec.model.parse.SemanticIssue;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.PayloadSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestType;
import com.loadspec.model.spec.VariableDefinition;
import com.loadspec.service.api.SemanticValidator;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Flags content that passes structural validation but is unlikely to be intended: placeholder
 * endpoints, extreme load or duration, test types that disagree with their load pattern, and
 * payload templates whose placeholders and variables do not line up.
 */
@Service
@Slf4j
public class SemanticValidatorImpl implements SemanticValidator {

    static final int HIGH_VIRTUAL_USERS = 10000;
    static final int HIGH_REQUESTS_PER_SECOND = 1000;
    static final long SHORT_DURATION_SECONDS = 10;
    static final long LONG_DURATION_SECONDS = 3600;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");
    private static final String PLACEHOLDER_URL = "/api/endpoint";

    @Override
    public List<SemanticIssue> review(LoadTestSpec spec) {
        List<SemanticIssue> issues = new ArrayList<>();
        List<RequestSpec> requests = spec.getRequests() == null ? List.of() : spec.getRequests();
        for (int i = 0; i < requests.size(); i++) {
            reviewUrl(requests.get(i), i, issues);
            reviewPayload(requests.get(i), i, issues);
        }
        reviewLoad(spec.getLoadPattern(), issues);
        reviewDuration(spec, issues);
        reviewTestType(spec, issues);
        if (!issues.isEmpty()) {
            log.debug("Semantic review raised {} issue(s): {}", issues.size(),
                    issues.stream().map(SemanticIssue::rule).collect(Collectors.toList()));
        }
        return issues;
    }

    private static void reviewUrl(RequestSpec request, int index, List<SemanticIssue> issues) {
        String url = request.getUrl();
        if (url == null || url.isBlank()) {
            return;
        }
        String field = "requests[" + index + "].url";
        String label = "Request " + (index + 1);
        if (!isAbsoluteHttpUrl(url) && !(url.startsWith("/") && url.length() > 1)) {
            issues.add(new SemanticIssue("url-format", field, IssueSeverity.MEDIUM,
                    label + ": URL format may be invalid",
                    "Ensure the URL is complete with protocol (https://) or starts with /"));
        }
        if (url.toLowerCase(Locale.ROOT).contains("example.com") || url.equals(PLACEHOLDER_URL)) {
            issues.add(new SemanticIssue("placeholder-url", field, IssueSeverity.HIGH,
                    label + ": URL appears to be a placeholder",
                    "Replace " + url + " with your actual API endpoint URL"));
        }
    }

    private static boolean isAbsoluteHttpUrl(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return false;
        }
        try {
            return URI.create(url).getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void reviewPayload(RequestSpec request, int index, List<SemanticIssue> issues) {
        String label = "Request " + (index + 1);
        PayloadSpec payload = request.getPayload();
        if (payload != null && payload.getTemplate() != null && !request.hasLiteralBody()) {
            String field = "requests[" + index + "].payload";
            String template = payload.getTemplate();
            String contentType = request.header("Content-Type");
            boolean json = contentType == null || contentType.toLowerCase(Locale.ROOT).contains("json");
            if (json && JsonRepair.parseStrict(PLACEHOLDER.matcher(template).replaceAll("0")).isEmpty()) {
                issues.add(new SemanticIssue("payload-json", field + ".template", IssueSeverity.HIGH,
                        label + ": payload template is not valid JSON",
                        "Ensure the payload template is valid JSON with {{variable}} placeholders"));
            }

            Set<String> used = new LinkedHashSet<>();
            Matcher matcher = PLACEHOLDER.matcher(template);
            while (matcher.find()) {
                used.add(matcher.group(1));
            }
            Set<String> declared = payload.getVariables() == null ? Set.of() : payload.getVariables().stream()
                    .map(VariableDefinition::getName)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(LinkedHashSet::new));

            List<String> undeclared = used.stream().filter(v -> !declared.contains(v)).collect(Collectors.toList());
            if (!undeclared.isEmpty()) {
                issues.add(new SemanticIssue("undeclared-variables", field + ".variables", IssueSeverity.MEDIUM,
                        label + ": variables " + String.join(", ", undeclared) + " used in template but not defined",
                        "Define variable types for all template placeholders"));
            }
            List<String> unused = declared.stream().filter(v -> !used.contains(v)).collect(Collectors.toList());
            if (!unused.isEmpty()) {
                issues.add(new SemanticIssue("unused-variables", field + ".variables", IssueSeverity.LOW,
                        label + ": variables " + String.join(", ", unused) + " defined but not used in template",
                        "Remove unused variable definitions or add them to the template"));
            }
        }

        if (request.getMethod() != null && request.getMethod().carriesBody() && !request.hasPayload()) {
            issues.add(new SemanticIssue("missing-payload", "requests[" + index + "].payload", IssueSeverity.LOW,
                    label + ": " + request.getMethod() + " request has no payload",
                    "Consider adding a payload for this request"));
        }
    }

    private static void reviewLoad(LoadPattern loadPattern, List<SemanticIssue> issues) {
        if (loadPattern == null) {
            return;
        }
        if (loadPattern.getVirtualUsers() != null && loadPattern.getVirtualUsers() > HIGH_VIRTUAL_USERS) {
            issues.add(new SemanticIssue("high-virtual-users", "loadPattern.virtualUsers", IssueSeverity.MEDIUM,
                    "Very high number of virtual users (" + loadPattern.getVirtualUsers() + ") may cause resource issues",
                    "Consider starting with a smaller number of users and scaling up"));
        }
        if (loadPattern.getRequestsPerSecond() != null && loadPattern.getRequestsPerSecond() > HIGH_REQUESTS_PER_SECOND) {
            issues.add(new SemanticIssue("high-rps", "loadPattern.requestsPerSecond", IssueSeverity.MEDIUM,
                    "Very high RPS (" + loadPattern.getRequestsPerSecond() + ") may overwhelm the target system",
                    "Consider starting with a lower RPS and increasing gradually"));
        }
        if (loadPattern.getType() == LoadPatternType.RAMP_UP && loadPattern.getRampUpTime() == null) {
            issues.add(new SemanticIssue("ramp-up-time", "loadPattern.rampUpTime", IssueSeverity.MEDIUM,
                    "Ramp-up time not specified for ramp-up load pattern",
                    "Specify how long the ramp-up should take (e.g. \"2 minutes\")"));
        }
    }

    private static void reviewDuration(LoadTestSpec spec, List<SemanticIssue> issues) {
        if (spec.getDuration() == null || !spec.getDuration().isPositive()) {
            return;
        }
        long seconds = spec.getDuration().toSeconds();
        if (seconds < SHORT_DURATION_SECONDS) {
            issues.add(new SemanticIssue("short-duration", "duration", IssueSeverity.MEDIUM,
                    "Very short test duration (" + seconds + "s) may not provide meaningful results",
                    "Consider running the test for at least 30 seconds"));
        } else if (seconds > LONG_DURATION_SECONDS) {
            issues.add(new SemanticIssue("long-duration", "duration", IssueSeverity.MEDIUM,
                    "Very long test duration (" + seconds + "s) may consume significant resources",
                    "Consider starting with shorter tests and increasing duration gradually"));
        }
    }

    private static void reviewTestType(LoadTestSpec spec, List<SemanticIssue> issues) {
        LoadPatternType pattern = spec.getLoadPattern() == null ? null : spec.getLoadPattern().getType();
        if (spec.getTestType() == TestType.SPIKE && pattern != LoadPatternType.SPIKE) {
            issues.add(new SemanticIssue("spike-pattern", "testType", IssueSeverity.MEDIUM,
                    "Spike test does not use a spike load pattern",
                    "Change the load pattern type to \"spike\" or adjust the test type"));
        }
        if (spec.getTestType() == TestType.STRESS && pattern != LoadPatternType.RAMP_UP) {
            issues.add(new SemanticIssue("stress-pattern", "testType", IssueSeverity.LOW,
                    "Stress test does not ramp up load",
                    "Consider using a \"ramp-up\" load pattern for stress testing"));
        }
    }
}
