package com.loadspec.model.parse;

import java.util.List;

/**
 * A diagnosed problem with an input, with advice on how to fix it.
 *
 * @param type            One of {@code missing_url}, {@code missing_method}, {@code missing_load_config},
 *                        {@code format_error} or {@code ai_service_error}.
 * @param message         Human-readable description.
 * @param suggestions     How to rephrase the input.
 * @param recoveryOptions What the tool can do about it.
 */
public record ParsingIssue(String type, String message, List<String> suggestions, List<String> recoveryOptions) {

    public ParsingIssue {
        suggestions = List.copyOf(suggestions);
        recoveryOptions = List.copyOf(recoveryOptions);
    }
}
