package com.loadspec.service.api;

import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.StructuredData;

/**
 * Builds and refines the {@link ParseContext}. {@link #inferMissingFields} and {@link #resolveAmbiguities}
 * are pure: they return a new context and leave their argument untouched.
 */
public interface ContextEnhancer {

    ParseContext buildContext(String originalInput, String sanitizedInput, StructuredData data, FormatDetectionResult detection);

    ParseContext inferMissingFields(ParseContext context);

    ParseContext resolveAmbiguities(ParseContext context);
}
