package com.loadspec.model.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation of {@link StructuredData} and {@link ParsingHint}s that the rest of the pipeline reasons over.
 *
 * @param methods    Distinct HTTP verbs.
 * @param urls       Distinct URLs.
 * @param headers    Merged headers.
 * @param bodies     Raw body candidates (JSON blocks and body hints).
 * @param counts     Numbers attached to user/concurrency words.
 * @param jsonBlocks JSON candidates from the preprocessor.
 */
public record ExtractedComponents(List<String> methods,
                                  List<String> urls,
                                  Map<String, String> headers,
                                  List<String> bodies,
                                  List<Integer> counts,
                                  List<JsonBlock> jsonBlocks) {

    public ExtractedComponents {
        methods = List.copyOf(methods);
        urls = List.copyOf(urls);
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        bodies = List.copyOf(bodies);
        counts = List.copyOf(counts);
        jsonBlocks = List.copyOf(jsonBlocks);
    }

    public boolean hasHeader(String name) {
        return headers.keySet().stream().anyMatch(k -> k.equalsIgnoreCase(name));
    }
}
