package com.loadspec.service.impl;

import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.JsonBlock;
import com.loadspec.model.parse.StructuredData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;

class InputPreprocessorImplTest {

    private InputPreprocessorImpl preprocessor;

    @BeforeEach
    void setUp() {
        ParserProperties properties = new ParserProperties();
        properties.getPreprocessing().setMaxInputLength(200);
        preprocessor = new InputPreprocessorImpl(properties);
    }

    @Test
    void sanitize_shouldCollapseWhitespaceAndStripControlCharacters() {
        String cleaned = preprocessor.sanitize("  GET\t\t https://api.example.com/users\u0007 \r\n\r\n\r\n\r\nwith 10 users  ");

        assertThat(cleaned).isEqualTo("GET https://api.example.com/users\n\nwith 10 users");
    }

    @Test
    void sanitize_shouldTruncateOverlongInputInsteadOfRejectingIt() {
        String cleaned = preprocessor.sanitize("GET /api/users " + "x".repeat(500));

        assertThat(cleaned).hasSize(200).startsWith("GET /api/users");
    }

    @Test
    void sanitize_shouldReturnEmptyStringForNullInput() {
        assertThat(preprocessor.sanitize(null)).isEmpty();
    }

    @Test
    void extractStructuredData_shouldFindMethodUrlHeaderAndBody() {
        String input = "POST https://api.example.com/orders\n"
                + "Content-Type: application/json\n"
                + "{\"sku\":\"A1\",\"qty\":2}";

        StructuredData data = preprocessor.extractStructuredData(input);

        assertThat(data.methods()).containsExactly("POST");
        assertThat(data.urls()).containsExactly("https://api.example.com/orders");
        assertThat(data.headers()).containsEntry("Content-Type", "application/json");
        assertThat(data.jsonBlocks()).hasSize(1);
        assertThat(data.jsonBlocks().get(0).valid()).isTrue();
    }

    @Test
    void extractStructuredData_shouldNotTreatBodyKeysOrPathSegmentsAsMethods() {
        String input = "PUT /api/delete-user {\"options\":\"get\",\"patch\":true}";

        StructuredData data = preprocessor.extractStructuredData(input);

        assertThat(data.methods()).containsExactly("PUT");
        assertThat(data.urls()).containsExactly("/api/delete-user");
    }

    @Test
    void extractStructuredData_shouldKeepMalformedJsonBlockAndStillFindMethodAndUrl() {
        String input = "GET https://api.example.com/users {\"name\" \"x\", \"age\": 3}";

        StructuredData data = preprocessor.extractStructuredData(input);

        assertThat(data.methods()).containsExactly("GET");
        assertThat(data.urls()).containsExactly("https://api.example.com/users");
        assertThat(data.jsonBlocks()).extracting(JsonBlock::valid).containsExactly(false);
    }

    @Test
    void extractStructuredData_shouldRepairTrailingCommas() {
        StructuredData data = preprocessor.extractStructuredData("POST /api/items {\"name\":\"a\",}");

        assertThat(data.jsonBlocks()).hasSize(1);
        assertThat(data.jsonBlocks().get(0).valid()).isTrue();
        assertThat(data.jsonBlocks().get(0).text()).isEqualTo("{\"name\":\"a\"}");
    }

    @Test
    void extractStructuredData_shouldKeepNestedJsonWhole() {
        String body = "{\"requestId\":\"r-1\",\"payload\":[{\"externalId\":\"X\"}]}";

        StructuredData data = preprocessor.extractStructuredData("POST /api/sync with body " + body);

        assertThat(data.jsonBlocks()).extracting(JsonBlock::text).containsExactly(body);
    }

    @Test
    void separateRequests_shouldSplitOnDashSeparators() {
        List<String> requests = preprocessor.separateRequests("GET /api/users\n---\nPOST /api/orders");

        assertThat(requests).containsExactly("GET /api/users", "POST /api/orders");
    }

    @Test
    void separateRequests_shouldReturnWholeInputWhenThereIsNoSeparator() {
        assertThat(preprocessor.separateRequests("GET /api/users")).containsExactly("GET /api/users");
    }

    @Test
    void findMatchingBracket_shouldIgnoreBracesInsideStrings() {
        String text = "{\"a\":\"}\",\"b\":{}}";

        assertThat(InputPreprocessorImpl.findMatchingBracket(text, 0)).isEqualTo(text.length() - 1);
        assertThat(InputPreprocessorImpl.findMatchingBracket("{\"a\":1", 0)).isEqualTo(-1);
    }

    @Test
    void trimUrl_shouldDropTrailingPunctuation() {
        assertThat(InputPreprocessorImpl.trimUrl("https://api.example.com/users).")).isEqualTo("https://api.example.com/users");
        assertThat(InputPreprocessorImpl.trimUrl("/api/users/{id}")).isEqualTo("/api/users/{id}");
    }

    @Test
    void normalizeHeaderName_shouldTitleCaseSegments() {
        assertThat(InputPreprocessorImpl.normalizeHeaderName("content-type")).isEqualTo("Content-Type");
        assertThat(InputPreprocessorImpl.normalizeHeaderName("X-API-KEY")).isEqualTo("X-Api-Key");
    }
}
