package com.loadspec.model.parse;

/**
 * Something about a structurally valid spec that is probably not what the user wants.
 *
 * @param rule       Name of the rule that raised it.
 * @param field      Path of the offending field, e.g. {@code requests[0].url}.
 * @param severity   How likely the spec is to mislead.
 * @param message    Human-readable description.
 * @param suggestion How to address it.
 */
public record SemanticIssue(String rule, String field, IssueSeverity severity, String message, String suggestion) {
}
