package com.loadspec.model.parse;

import java.util.List;

public record ParseExplanation(List<String> extractedComponents,
                               List<Assumption> assumptions,
                               List<String> ambiguityResolutions,
                               List<String> suggestions) {

    public ParseExplanation {
        extractedComponents = List.copyOf(extractedComponents);
        assumptions = List.copyOf(assumptions);
        ambiguityResolutions = List.copyOf(ambiguityResolutions);
        suggestions = List.copyOf(suggestions);
    }
}
