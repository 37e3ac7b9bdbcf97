package com.loadspec.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.model.parse.ParseContext;
import com.loadspec.model.parse.ValidationReport;
import com.loadspec.model.spec.LoadTestSpec;

public interface ResponseValidator {

    /**
     * Decodes backend text into JSON, stripping code fences and applying one round of mechanical repair.
     *
     * @param response Raw backend text.
     * @return The decoded JSON object.
     * @throws com.loadspec.exception.SpecValidationException if the text is not JSON even after repair.
     */
    JsonNode decode(String response);

    /**
     * Checks the decoded response against the structure of a {@link LoadTestSpec}.
     *
     * @param candidate Decoded response.
     * @return Errors and warnings found.
     */
    ValidationReport validate(JsonNode candidate);

    /**
     * Decodes, validates and corrects a backend response into a usable spec. Small gaps are filled
     * from the context; larger ones trigger a bounded number of corrective round-trips.
     *
     * @param response  Raw backend text.
     * @param context   The parse context the response answers.
     * @param corrector Used for corrective round-trips, may be {@code null} to disable them.
     * @return A spec satisfying all structural invariants.
     * @throws com.loadspec.exception.SpecValidationException when every correction path is exhausted.
     */
    LoadTestSpec validateAndCorrect(String response, ParseContext context, CorrectionRequester corrector);
}
