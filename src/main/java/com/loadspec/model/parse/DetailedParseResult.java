package com.loadspec.model.parse;

import com.loadspec.model.spec.LoadTestSpec;
import java.util.List;

/**
 * The full outcome of one parse call: the spec plus everything a caller needs to judge and explain it.
 *
 * @param spec            The resulting specification, always usable.
 * @param confidence      Final confidence in {@code [0, 1]}.
 * @param format          The detected input format.
 * @param ambiguities     Ambiguities rendered as {@code "field: reason"}.
 * @param suggestions     Advisory suggestions; they never alter the spec.
 * @param explanation     Structured explanation of the result.
 * @param warnings        Caveats the operator should review.
 * @param assumptions     Fields that were synthesized.
 * @param processingSteps Ordered log of the stages that ran.
 * @param usedFallback    Whether the spec came from the deterministic parser.
 * @param recoveryPath    Recovery strategies tried, empty when none were needed.
 */
public record DetailedParseResult(LoadTestSpec spec,
                                  double confidence,
                                  InputFormat format,
                                  List<String> ambiguities,
                                  List<String> suggestions,
                                  ParseExplanation explanation,
                                  List<String> warnings,
                                  List<Assumption> assumptions,
                                  List<String> processingSteps,
                                  boolean usedFallback,
                                  List<String> recoveryPath) {

    public DetailedParseResult {
        ambiguities = List.copyOf(ambiguities);
        suggestions = List.copyOf(suggestions);
        warnings = List.copyOf(warnings);
        assumptions = List.copyOf(assumptions);
        processingSteps = List.copyOf(processingSteps);
        recoveryPath = List.copyOf(recoveryPath);
    }
}
