package com.loadspec.exception;

import java.util.List;
import lombok.Getter;

/**
 * Raised when a backend response cannot be turned into a valid specification, even after
 * local repair and the allowed corrective round-trips.
 */
@Getter
public class SpecValidationException extends ParserException {

    private final List<String> errors;

    public SpecValidationException(String message, List<String> errors) {
        super(message + (errors.isEmpty() ? "" : ": " + String.join(", ", errors)));
        this.errors = List.copyOf(errors);
    }

    public SpecValidationException(String message, List<String> errors, Throwable cause) {
        super(message + (errors.isEmpty() ? "" : ": " + String.join(", ", errors)), cause);
        this.errors = List.copyOf(errors);
    }
}
