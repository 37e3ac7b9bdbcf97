package com.loadspec.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Optional;

/**
 * Mechanical fixes for almost-JSON text: trailing and doubled commas, bare keys, single quotes and
 * raw control characters. Bare keys, single quotes and control characters are left to the lenient
 * parser; comma repair only touches text outside string literals. Shared by the preprocessor and
 * the response validator.
 */
final class JsonRepair {

    private static final ObjectMapper STRICT = new ObjectMapper();

    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .build();

    private JsonRepair() {
    }

    /**
     * Parses text as a JSON object or array without any repair.
     */
    static Optional<JsonNode> parseStrict(String text) {
        try {
            JsonNode node = STRICT.readTree(text);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Reparses leniently, first as given and then after comma repair.
     *
     * @param text Almost-JSON text.
     * @return The parsed container node, or empty when the text is beyond repair.
     */
    static Optional<JsonNode> parseRepaired(String text) {
        Optional<JsonNode> asGiven = parseLenient(text);
        if (asGiven.isPresent()) {
            return asGiven;
        }
        String repaired = repair(text);
        return repaired.equals(text) ? Optional.empty() : parseLenient(repaired);
    }

    private static Optional<JsonNode> parseLenient(String text) {
        try {
            JsonNode node = LENIENT.readTree(text);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Drops commas that are followed by another comma or a closing bracket. String literals, in
     * either quote style, pass through untouched.
     */
    static String repair(String text) {
        StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == ',') {
                char next = nextSignificant(text, i + 1);
                if (next == ',' || next == '}' || next == ']') {
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static char nextSignificant(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return text.charAt(i);
            }
        }
        return 0;
    }

    /**
     * Rough shape test for text that failed to parse: it has quotes and key or element separators.
     */
    static boolean looksLikeJson(String text) {
        String trimmed = text.trim();
        boolean bracketed = (trimmed.startsWith("{") || trimmed.startsWith("["));
        boolean quoted = trimmed.contains("\"") || trimmed.contains("'");
        return bracketed && quoted && (trimmed.contains(":") || trimmed.contains(","));
    }

    static String toJson(JsonNode node) {
        try {
            return STRICT.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return node.toString();
        }
    }
}
