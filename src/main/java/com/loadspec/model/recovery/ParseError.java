package com.loadspec.model.recovery;

import java.util.List;

/**
 * A classified pipeline failure.
 *
 * @param level            The originating stage.
 * @param type             Fine-grained type, e.g. {@code rate_limit} or {@code missing_required_field}.
 * @param message          The underlying failure message.
 * @param suggestions      Advice for the operator.
 * @param recoveryStrategy The primary strategy selected for this failure.
 */
public record ParseError(ErrorLevel level,
                         String type,
                         String message,
                         List<String> suggestions,
                         RecoveryStrategy recoveryStrategy) {

    public ParseError {
        suggestions = List.copyOf(suggestions);
    }
}
