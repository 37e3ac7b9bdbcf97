package com.loadspec.service.api;

import com.loadspec.model.parse.FallbackParseResult;

/**
 * Deterministic regex and keyword parser that works without any AI backend.
 */
public interface FallbackParser {

    /**
     * Parses the input into a best-guess specification. Never throws; unparseable input yields a
     * minimal templated spec with assumptions and warnings.
     *
     * @param input Raw or sanitized operator text, may be {@code null}.
     * @return The result, confidence at most the fallback ceiling.
     */
    FallbackParseResult parse(String input);

    /**
     * Quick admissibility check: a URL, a method-like word or a number is present.
     */
    boolean canParse(String input);

    /**
     * Scores how much the input gives this parser to work with, without parsing it.
     */
    double confidenceScore(String input);
}
