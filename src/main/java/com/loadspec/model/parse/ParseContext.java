package com.loadspec.model.parse;

import java.util.List;

/**
 * Everything known about one input as it moves through the pipeline.
 * <p>
 * Instances are immutable. Refinement steps return a copy through the {@code with*} methods so
 * each heuristic layer can be exercised on its own.
 *
 * @param originalInput       The raw operator text.
 * @param cleanedInput        Sanitized text with whitespace collapsed.
 * @param format              The detected input format.
 * @param hints               Hints produced by the format detector.
 * @param extractedComponents Aggregated literal signals.
 * @param inferredFields      Fields filled by inference.
 * @param ambiguities         Ordered ambiguity records.
 * @param confidence          Current confidence in {@code [0, 1]}.
 */
public record ParseContext(String originalInput,
                           String cleanedInput,
                           InputFormat format,
                           List<ParsingHint> hints,
                           ExtractedComponents extractedComponents,
                           InferredFields inferredFields,
                           List<Ambiguity> ambiguities,
                           double confidence) {

    public ParseContext {
        hints = List.copyOf(hints);
        ambiguities = List.copyOf(ambiguities);
    }

    public ParseContext withInferredFields(InferredFields fields, double newConfidence) {
        return new ParseContext(originalInput, cleanedInput, format, hints, extractedComponents,
                fields, ambiguities, newConfidence);
    }

    public ParseContext withAmbiguities(List<Ambiguity> newAmbiguities, double newConfidence) {
        return new ParseContext(originalInput, cleanedInput, format, hints, extractedComponents,
                inferredFields, newAmbiguities, newConfidence);
    }

    public boolean hasAmbiguity(String field) {
        return ambiguities.stream().anyMatch(a -> a.field().equals(field));
    }
}
