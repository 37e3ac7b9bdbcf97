package com.loadspec.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loadspec.cli.ui.JsonHighlighter;
import com.loadspec.cli.ui.Spinner;
import com.loadspec.dto.response.CommandResponse;
import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.DetailedParseResult;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.parse.ParsingIssue;
import com.loadspec.service.api.CommandParser;
import java.util.List;
import java.util.Locale;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands that turn operator text into a load-test specification and explain what the parser
 * understood.
 */
@ShellComponent
public class ParseCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_WHITE = "\u001B[37m";

    private final CommandParser commandParser;
    private final Spinner spinner;
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public ParseCommand(CommandParser commandParser, Spinner spinner) {
        this.commandParser = commandParser;
        this.spinner = spinner;
    }

    /**
     * Parses free-form text into a load-test specification and prints it as colorized JSON together
     * with the confidence score, warnings, assumptions and suggestions.
     *
     * @param text         The operator's description, e.g. {@code GET https://api.example.com/users with 50 users}.
     * @param fallbackOnly Skip the AI backend and use the rule-based parser.
     * @param verbose      Enable debug logging for the duration of the command.
     * @param explain      Also print what was extracted and how ambiguities were resolved.
     */
    @ShellMethod(key = "parse", value = "Parse a load test description into a specification.")
    public void parse(
            @ShellOption(arity = Integer.MAX_VALUE, help = "The load test description.") String[] text,
            @ShellOption(value = {"--fallback-only", "-f"}, help = "Use only the rule-based parser.", defaultValue = "false", arity = 0) boolean fallbackOnly,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose,
            @ShellOption(value = {"--explain", "-e"}, help = "Print the parse explanation.", defaultValue = "false", arity = 0) boolean explain
    ) {
        ch.qos.logback.classic.Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        ch.qos.logback.classic.Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(ch.qos.logback.classic.Level.DEBUG);
            System.out.println(ANSI_PURPLE + "-- Verbose mode enabled --" + ANSI_RESET);
        }

        try {
            String input = String.join(" ", text);
            DetailedParseResult result = spinner.spin("Parsing...", () -> fallbackOnly
                    ? commandParser.parseWithFallbackOnly(input)
                    : commandParser.parse(input));

            System.out.println(JsonHighlighter.highlight(jsonMapper.valueToTree(result.spec())));
            String source = result.usedFallback() ? "rule-based parser" : "AI parser";
            System.out.println(ANSI_CYAN + String.format(Locale.ROOT, "Confidence: %.2f (%s, %s input)",
                    result.confidence(), source, result.format().label()) + ANSI_RESET);
            if (!result.recoveryPath().isEmpty()) {
                System.out.println(ANSI_PURPLE + "Recovery: " + String.join(" -> ", result.recoveryPath()) + ANSI_RESET);
            }
            printList("Warnings", result.warnings(), ANSI_YELLOW);
            printAssumptions(result.assumptions());
            printList("Suggestions", result.suggestions(), ANSI_GREEN);
            if (explain) {
                printExplanation(result);
            }
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Parsing failed: " + e.getMessage(),
                    List.of("Describe the test as: <METHOD> <URL> with <N> users for <duration>",
                            "Run 'diagnose' with the same text to see what is missing",
                            "Retry with --fallback-only if the AI backend is down")).toAnsiString());
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
                System.out.println(ANSI_PURPLE + "-- Verbose mode disabled --" + ANSI_RESET);
            }
        }
    }

    /**
     * Lists what is missing or malformed in a description and how to fix it.
     *
     * @param text The load test description to inspect.
     */
    @ShellMethod(key = "diagnose", value = "Show parsing issues and suggested corrections for a description.")
    public void diagnose(@ShellOption(arity = Integer.MAX_VALUE, help = "The load test description.") String[] text) {
        String input = String.join(" ", text);
        try {
            List<ParsingIssue> issues = commandParser.diagnose(input);
            if (issues.isEmpty()) {
                System.out.println(new CommandResponse(true, "No parsing issues found.").toAnsiString());
            }
            for (ParsingIssue issue : issues) {
                System.out.println(new CommandResponse(false, issue.type() + ": " + issue.message(), issue.suggestions()).toAnsiString());
                issue.recoveryOptions().forEach(option -> System.out.println("  " + ANSI_CYAN + "> " + option + ANSI_RESET));
            }
            printList("Suggested corrections", commandParser.suggestCorrections(input), ANSI_GREEN);
        } catch (Exception e) {
            System.out.println(new CommandResponse(false, "Diagnosis failed: " + e.getMessage()).toAnsiString());
        }
    }

    private void printExplanation(DetailedParseResult result) {
        ParseExplanation explanation = result.explanation();
        printList("Extracted", explanation.extractedComponents(), ANSI_WHITE);
        printList("Ambiguity resolutions", explanation.ambiguityResolutions(), ANSI_YELLOW);
        printList("Processing steps", result.processingSteps(), ANSI_WHITE);
    }

    private void printAssumptions(List<Assumption> assumptions) {
        if (assumptions.isEmpty()) {
            return;
        }
        System.out.println("Assumptions:");
        for (Assumption assumption : assumptions) {
            String alternatives = assumption.alternatives().isEmpty() ? ""
                    : " (alternatives: " + String.join(", ", assumption.alternatives()) + ")";
            System.out.println("  " + ANSI_YELLOW + assumption.field() + " = " + assumption.assumedValue()
                    + ANSI_RESET + ": " + assumption.reason() + alternatives);
        }
    }

    private void printList(String title, List<String> lines, String color) {
        if (lines.isEmpty()) {
            return;
        }
        System.out.println(title + ":");
        lines.forEach(line -> System.out.println("  " + color + "- " + line + ANSI_RESET));
    }
}
