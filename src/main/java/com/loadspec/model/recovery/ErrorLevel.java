package com.loadspec.model.recovery;

/**
 * The pipeline stage a failure originated from.
 */
public enum ErrorLevel {
    INPUT, AI, VALIDATION, FALLBACK
}
