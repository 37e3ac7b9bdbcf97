package com.loadspec.exception;

import com.loadspec.model.recovery.ParseError;
import lombok.Getter;

/**
 * Carries a classified {@link ParseError} out of a pipeline stage.
 */
@Getter
public class ParseFailureException extends ParserException {

    private final ParseError parseError;

    public ParseFailureException(ParseError parseError, Throwable cause) {
        super(parseError.message(), cause);
        this.parseError = parseError;
    }
}
