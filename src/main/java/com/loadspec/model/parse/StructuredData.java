package com.loadspec.model.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal candidates lifted out of the input before any interpretation. Immutable.
 *
 * @param methods    Upper-cased HTTP verbs in order of first appearance.
 * @param urls       Absolute and root-relative URLs, de-duplicated.
 * @param headers    Header name to value, names in Title-Case.
 * @param jsonBlocks Top-level JSON candidates in input order.
 */
public record StructuredData(List<String> methods,
                             List<String> urls,
                             Map<String, String> headers,
                             List<JsonBlock> jsonBlocks) {

    public StructuredData {
        methods = List.copyOf(methods);
        urls = List.copyOf(urls);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        jsonBlocks = List.copyOf(jsonBlocks);
    }

    public static StructuredData empty() {
        return new StructuredData(List.of(), List.of(), Map.of(), List.of());
    }
}
