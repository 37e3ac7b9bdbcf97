package com.loadspec.model.parse;

/**
 * A single typed signal found in the input, e.g. an HTTP verb or a user count.
 *
 * @param kind       What the hint describes.
 * @param value      The matched text (for headers {@code "Name: value"}, for counts the digits).
 * @param confidence How much the detector trusts the match, in {@code [0, 1]}.
 * @param span       Where in the input the match was found.
 */
public record ParsingHint(HintKind kind, String value, double confidence, SourceSpan span) {
}
