package com.loadspec.model.parse;

import java.util.List;

/**
 * Outcome of format classification.
 *
 * @param format     The winning format.
 * @param confidence The winning score in {@code [0, 1]}.
 * @param hints      Every hint extracted while scoring.
 */
public record FormatDetectionResult(InputFormat format, double confidence, List<ParsingHint> hints) {

    public FormatDetectionResult {
        hints = List.copyOf(hints);
    }
}
