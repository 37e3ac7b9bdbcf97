package com.loadspec.model.parse;

/**
 * Character offsets {@code [start, end)} of a match within the sanitized input.
 */
public record SourceSpan(int start, int end) {
}
