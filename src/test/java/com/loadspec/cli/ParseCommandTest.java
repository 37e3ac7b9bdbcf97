package com.loadspec.cli;

import com.loadspec.cli.ui.Spinner;
import com.loadspec.exception.ParserException;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.DetailedParseResult;
import com.loadspec.model.parse.InputFormat;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.parse.ParsingIssue;
import com.loadspec.model.spec.HttpMethod;
import com.loadspec.model.spec.LoadPattern;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.LoadTestSpec;
import com.loadspec.model.spec.RequestSpec;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import com.loadspec.service.api.CommandParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ParseCommandTest {

    private static final String INPUT = "GET https://api.example.com/users with 50 users for 5 minutes";

    private final CommandParser commandParser = mock(CommandParser.class);
    private final Spinner spinner = mock(Spinner.class);
    private final ParseCommand command = new ParseCommand(commandParser, spinner);

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void setUp() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        when(spinner.spin(anyString(), any())).thenAnswer(invocation -> {
            Supplier<?> task = invocation.getArgument(1, Supplier.class);
            return task.get();
        });
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    private String screen() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private static DetailedParseResult result(boolean usedFallback, List<String> recoveryPath) {
        LoadTestSpec spec = new LoadTestSpec();
        spec.setName("Baseline Test - GET users");
        spec.setTestType(TestType.BASELINE);
        spec.getRequests().add(new RequestSpec(HttpMethod.GET, "https://api.example.com/users"));
        spec.setLoadPattern(new LoadPattern(LoadPatternType.CONSTANT, 50));
        spec.setDuration(TestDuration.minutes(5));
        Assumption assumption = new Assumption("testType", "baseline", "No test type keyword found", List.of("stress", "spike"));
        ParseExplanation explanation = new ParseExplanation(List.of("method: GET"), List.of(assumption),
                List.of("testType resolved to baseline"), List.of());
        return new DetailedParseResult(spec, 0.72, InputFormat.NATURAL_LANGUAGE, List.of(), List.of("Add an auth header"),
                explanation, List.of("No authentication specified"), List.of(assumption),
                List.of("preprocess", "detect format"), usedFallback, recoveryPath);
    }

    @Test
    void parse_shouldPrintSpecAndConfidence() {
        // --- Arrange ---
        when(commandParser.parse(INPUT)).thenReturn(result(false, List.of()));

        // --- Act ---
        command.parse(INPUT.split(" "), false, false, false);

        // --- Assert ---
        String screen = screen();
        assertThat(screen).contains("\"name\"", "Baseline Test - GET users", "https://api.example.com/users");
        assertThat(screen).contains("Confidence: 0.72 (AI parser, natural_language input)");
        assertThat(screen).contains("No authentication specified", "Add an auth header");
        assertThat(screen).contains("testType = baseline", "alternatives: stress, spike");
        assertThat(screen).doesNotContain("Recovery:", "Processing steps");
        verify(commandParser, never()).parseWithFallbackOnly(anyString());
    }

    @Test
    void parse_shouldUseRuleBasedParserWhenAsked() {
        when(commandParser.parseWithFallbackOnly(INPUT)).thenReturn(result(true, List.of("fallback")));

        command.parse(INPUT.split(" "), true, false, true);

        String screen = screen();
        assertThat(screen).contains("rule-based parser", "Recovery: fallback");
        assertThat(screen).contains("Extracted:", "method: GET", "Processing steps:", "detect format");
        verify(commandParser, never()).parse(anyString());
    }

    @Test
    void parse_shouldPrintGuidanceWhenParsingFails() {
        when(commandParser.parse(anyString())).thenThrow(new ParserException("backend and fallback both failed"));

        command.parse(new String[]{"do", "something"}, false, false, false);

        assertThat(screen()).contains("Parsing failed: backend and fallback both failed", "--fallback-only");
    }

    @Test
    void diagnose_shouldListIssuesAndCorrections() {
        when(commandParser.diagnose("load test")).thenReturn(List.of(
                new ParsingIssue("missing_url", "No URL found", List.of("Add a full URL"), List.of("Use a relative path"))));
        when(commandParser.suggestCorrections("load test")).thenReturn(List.of("GET https://api.example.com/health"));

        command.diagnose(new String[]{"load", "test"});

        assertThat(screen()).contains("missing_url: No URL found", "Add a full URL", "> Use a relative path",
                "Suggested corrections:", "GET https://api.example.com/health");
    }

    @Test
    void diagnose_shouldReportCleanInput() {
        when(commandParser.diagnose(INPUT)).thenReturn(List.of());
        when(commandParser.suggestCorrections(INPUT)).thenReturn(List.of());

        command.diagnose(INPUT.split(" "));

        assertThat(screen()).contains("No parsing issues found.");
    }
}
