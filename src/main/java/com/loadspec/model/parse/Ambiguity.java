package com.loadspec.model.parse;

import java.util.List;

/**
 * A field with zero or several plausible values.
 *
 * @param field          The spec field concerned, e.g. "url".
 * @param possibleValues The candidates, in preference order.
 * @param reason         Why the field is ambiguous.
 */
public record Ambiguity(String field, List<String> possibleValues, String reason) {

    public Ambiguity {
        possibleValues = List.copyOf(possibleValues);
    }

    /**
     * Method and URL ambiguities decide which endpoint is hit and weigh heavier.
     *
     * @return {@code true} for the "method" and "url" fields.
     */
    public boolean isCritical() {
        return "method".equals(field) || "url".equals(field);
    }

    public String describe() {
        return field + ": " + reason;
    }
}
