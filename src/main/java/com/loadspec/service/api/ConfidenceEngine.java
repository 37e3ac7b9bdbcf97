package com.loadspec.service.api;

import com.loadspec.model.parse.Assumption;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ParseExplanation;
import com.loadspec.model.spec.LoadTestSpec;
import java.util.List;

public interface ConfidenceEngine {

    /**
     * Derives the final confidence of an AI-backed spec, never below the configured AI floor.
     *
     * @param spec    The validated spec.
     * @param context The context it was parsed from.
     * @return Confidence in {@code [floor, 1]}.
     */
    double calculateConfidence(LoadTestSpec spec, ParseContext context);

    List<Assumption> deriveAssumptions(LoadTestSpec spec, ParseContext context);

    List<String> generateWarnings(LoadTestSpec spec, ParseContext context, double confidence);

    /**
     * Advisory suggestions. They describe improvements and never modify the spec.
     */
    List<String> generateSuggestions(LoadTestSpec spec, ParseContext context);

    ParseExplanation explain(LoadTestSpec spec, ParseContext context);
}
