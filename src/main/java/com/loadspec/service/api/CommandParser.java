package com.loadspec.service.api;

import com.loadspec.model.parse.DetailedParseResult;
import com.loadspec.model.parse.ParsingIssue;
import java.util.List;

/**
 * Entry point of the parsing pipeline: free-form text in, usable load test specification out.
 */
public interface CommandParser {

    /**
     * Parses operator text, using the AI backend when it is available and degrading to the
     * deterministic parser otherwise. Always returns a usable spec.
     *
     * @param input Free-form text, may be empty.
     * @return The spec with confidence, assumptions, warnings and suggestions.
     */
    DetailedParseResult parse(String input);

    /**
     * Parses with the deterministic parser only, skipping the AI backend.
     */
    DetailedParseResult parseWithFallbackOnly(String input);

    /**
     * Reports what is missing or problematic in the input, with suggestions and recovery options.
     */
    List<ParsingIssue> diagnose(String input);

    /**
     * Proposes rewrites of the input that would parse with higher confidence.
     */
    List<String> suggestCorrections(String input);
}
