package com.loadspec.service.api;

import com.loadspec.model.parse.StructuredData;
import java.util.List;

public interface InputPreprocessor {

    /**
     * Normalizes raw operator text: strips control characters, unifies line endings, collapses
     * runs of blanks and caps the length. Over-long input is truncated, never rejected.
     *
     * @param rawInput The text as typed or pasted, may be {@code null}.
     * @return The sanitized text, never {@code null}.
     */
    String sanitize(String rawInput);

    /**
     * Lifts literal candidates out of sanitized text. Never throws.
     *
     * @param input Sanitized text.
     * @return The extracted methods, URLs, headers and JSON blocks.
     */
    StructuredData extractStructuredData(String input);

    /**
     * Splits text holding several requests on common separators ("---", "Request 2:", "2.").
     *
     * @param input Sanitized text.
     * @return The request chunks; a single-element list when no separator is found.
     */
    List<String> separateRequests(String input);
}
