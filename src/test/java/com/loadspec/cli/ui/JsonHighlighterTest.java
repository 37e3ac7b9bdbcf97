package com.loadspec.cli.ui;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.assertThat;

class JsonHighlighterTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static String plain(String ansi) {
        return ansi.replaceAll("\u001B\\[\\d+m", "");
    }

    @Test
    void highlight_shouldIndentNestedValues() throws Exception {
        String rendered = JsonHighlighter.highlight(objectMapper.readTree(
                "{\"name\":\"Spike \\\"A\\\"\",\"users\":50,\"tags\":[true,null],\"headers\":{}}"));

        assertThat(plain(rendered)).isEqualTo("{\n"
                + "  \"name\": \"Spike \\\"A\\\"\",\n"
                + "  \"users\": 50,\n"
                + "  \"tags\": [\n"
                + "    true,\n"
                + "    null\n"
                + "  ],\n"
                + "  \"headers\": {}\n"
                + "}");
    }

    @Test
    void highlight_shouldColorScalarsByType() throws Exception {
        String rendered = JsonHighlighter.highlight(objectMapper.readTree("{\"n\":1,\"s\":\"x\"}"));

        assertThat(rendered).contains("\u001B[33m1\u001B[0m", "\u001B[32m\"x\"\u001B[0m", "\u001B[36m\"n\"\u001B[0m");
        assertThat(JsonHighlighter.highlight(null)).isEqualTo("\u001B[31mnull\u001B[0m");
    }
}
