package com.loadspec.model.parse;

import java.util.List;

/**
 * Structural validation result for a decoded backend response.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
