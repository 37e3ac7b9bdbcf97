package com.loadspec.exception;

/**
 * Root unchecked exception for failures inside the load-spec parsing pipeline.
 * <p>
 * Stage implementations wrap library exceptions (JSON decoding, HTTP transport) in a subclass of
 * this type so callers only ever handle one hierarchy.
 */
public class ParserException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public ParserException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying exception, may be {@code null}.
     */
    public ParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
