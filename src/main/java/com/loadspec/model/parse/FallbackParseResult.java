package com.loadspec.model.parse;

import com.loadspec.model.spec.LoadTestSpec;
import java.util.List;

/**
 * Output of the deterministic fallback parser.
 *
 * @param spec            The best-guess specification, always usable.
 * @param confidence      Running confidence, never above the fallback ceiling.
 * @param matchedPatterns Names of the rules that matched, in rule order.
 * @param assumptions     Fields that had to be assumed.
 * @param warnings        Human-readable caveats.
 */
public record FallbackParseResult(LoadTestSpec spec,
                                  double confidence,
                                  List<String> matchedPatterns,
                                  List<Assumption> assumptions,
                                  List<String> warnings) {

    public FallbackParseResult {
        matchedPatterns = List.copyOf(matchedPatterns);
        assumptions = List.copyOf(assumptions);
        warnings = List.copyOf(warnings);
    }
}
