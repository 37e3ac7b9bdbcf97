package com.loadspec.service.api;

import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.ParsingHint;
import com.loadspec.model.parse.StructuredData;
import java.util.List;

public interface FormatDetector {

    /**
     * Scores the input against the known input shapes.
     *
     * @param input Sanitized text.
     * @param data  Literal candidates from the preprocessor.
     * @return The winning format, its score and every hint found.
     */
    FormatDetectionResult detectFormat(String input, StructuredData data);

    /**
     * Extracts text-level hints: methods, absolute URLs, header lines and user counts. Body hints
     * need brace matching and come from the preprocessor's JSON blocks instead.
     *
     * @param input Sanitized text.
     * @return Hints in discovery order.
     */
    List<ParsingHint> extractHints(String input);
}
