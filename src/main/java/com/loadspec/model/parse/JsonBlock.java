package com.loadspec.model.parse;

/**
 * A brace-matched top-level JSON candidate found in the input.
 *
 * @param text  The block text. When {@code valid} is true this is parseable JSON, possibly after
 *              mechanical repair; otherwise the raw substring that merely looks like JSON.
 * @param valid Whether {@code text} parses.
 * @param span  Location of the raw block in the sanitized input.
 */
public record JsonBlock(String text, boolean valid, SourceSpan span) {
}
