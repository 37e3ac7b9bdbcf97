package com.loadspec.cli.ui;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a JSON tree as indented, ANSI-colored text for the shell.
 * <p>
 * Keys are cyan, strings green, numbers yellow, booleans purple and nulls red.
 */
public final class JsonHighlighter {

    private static final String RESET = "\u001B[0m";
    private static final String KEY = "\u001B[36m";
    private static final String STRING = "\u001B[32m";
    private static final String NUMBER = "\u001B[33m";
    private static final String BOOLEAN = "\u001B[35m";
    private static final String NULL = "\u001B[31m";
    private static final String PUNCTUATION = "\u001B[37m";
    private static final String INDENT = "  ";

    private JsonHighlighter() {
    }

    public static String highlight(JsonNode node) {
        return render(node, 0);
    }

    private static String render(JsonNode node, int depth) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL + "null" + RESET;
        }
        if (node.isObject()) {
            List<String> members = new ArrayList<>();
            for (Map.Entry<String, JsonNode> member : node.properties()) {
                members.add(KEY + quote(member.getKey()) + RESET + ": " + render(member.getValue(), depth + 1));
            }
            return container("{", "}", members, depth);
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>();
            node.forEach(item -> items.add(render(item, depth + 1)));
            return container("[", "]", items, depth);
        }
        if (node.isTextual()) {
            return STRING + quote(node.asText()) + RESET;
        }
        if (node.isNumber()) {
            return NUMBER + node.asText() + RESET;
        }
        if (node.isBoolean()) {
            return BOOLEAN + node.asBoolean() + RESET;
        }
        return node.toString();
    }

    private static String container(String open, String close, List<String> entries, int depth) {
        if (entries.isEmpty()) {
            return PUNCTUATION + open + close + RESET;
        }
        String inner = INDENT.repeat(depth + 1);
        StringBuilder out = new StringBuilder(PUNCTUATION).append(open).append(RESET).append('\n');
        for (int i = 0; i < entries.size(); i++) {
            out.append(inner).append(entries.get(i)).append(i < entries.size() - 1 ? ",\n" : "\n");
        }
        return out.append(INDENT.repeat(depth)).append(PUNCTUATION).append(close).append(RESET).toString();
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
