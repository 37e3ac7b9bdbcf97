package com.loadspec.model.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.loadspec.model.spec.LoadPatternType;
import com.loadspec.model.spec.TestDuration;
import com.loadspec.model.spec.TestType;
import java.util.Set;

/**
 * Fields the context enhancer filled in. {@code defaulted} names the fields ("testType", "duration",
 * "loadPattern") that fell through to a fixed default instead of being matched or inferred.
 *
 * @param testType    Inferred test type.
 * @param duration    Inferred duration.
 * @param loadPattern Inferred load pattern type.
 * @param requestBody A literal JSON body from the input, or {@code null}.
 * @param defaulted   Names of defaulted fields.
 */
public record InferredFields(TestType testType,
                             TestDuration duration,
                             LoadPatternType loadPattern,
                             JsonNode requestBody,
                             Set<String> defaulted) {

    public static final String TEST_TYPE = "testType";
    public static final String DURATION = "duration";
    public static final String LOAD_PATTERN = "loadPattern";

    public InferredFields {
        defaulted = Set.copyOf(defaulted);
    }

    public static InferredFields none() {
        return new InferredFields(null, null, null, null, Set.of());
    }

    public boolean isDefaulted(String field) {
        return defaulted.contains(field);
    }
}
