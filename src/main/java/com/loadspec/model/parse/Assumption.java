package com.loadspec.model.parse;

import java.util.List;

/**
 * A spec field whose value was synthesized rather than read from the input.
 *
 * @param field        The field name.
 * @param assumedValue The value that was used.
 * @param reason       Why it had to be assumed.
 * @param alternatives Other plausible values.
 */
public record Assumption(String field, String assumedValue, String reason, List<String> alternatives) {

    public Assumption {
        alternatives = List.copyOf(alternatives);
    }
}
