package com.loadspec.exception;

/**
 * Thrown at startup when configuration values are individually valid but inconsistent,
 * or when a selected backend lacks what it needs.
 */
public class InvalidConfigurationException extends ParserException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
