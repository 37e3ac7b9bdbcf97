package com.loadspec.service.impl;

import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.HintKind;
import com.loadspec.model.parse.InputFormat;
import com.loadspec.model.parse.ParsingHint;
import org.junit.jupiter.api.Test;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FormatDetectorImplTest {

    private final InputPreprocessorImpl preprocessor = new InputPreprocessorImpl(new ParserProperties());
    private final FormatDetectorImpl detector = new FormatDetectorImpl();

    private FormatDetectionResult detect(String input) {
        return detector.detectFormat(input, preprocessor.extractStructuredData(input));
    }

    @Test
    void detectFormat_shouldRecognizeCurlCommands() {
        FormatDetectionResult result = detect("curl -X POST https://api.example.com/orders -H 'Content-Type: application/json'");

        assertThat(result.format()).isEqualTo(InputFormat.CURL_COMMAND);
        assertThat(result.confidence()).isEqualTo(0.95);
    }

    @Test
    void detectFormat_shouldRecognizeRawHttpMessages() {
        FormatDetectionResult result = detect("GET /api/users HTTP/1.1\nHost: api.example.com\nUser-Agent: k6");

        assertThat(result.format()).isEqualTo(InputFormat.HTTP_RAW);
    }

    @Test
    void detectFormat_shouldRecognizeConcatenatedRequests() {
        FormatDetectionResult result = detect("GET https://api.example.com/users\nPOST https://api.example.com/orders");

        assertThat(result.format()).isEqualTo(InputFormat.CONCATENATED_REQUESTS);
    }

    @Test
    void detectFormat_shouldDefaultToNaturalLanguage() {
        FormatDetectionResult result = detect("please create a load test for the checkout flow");

        assertThat(result.format()).isEqualTo(InputFormat.NATURAL_LANGUAGE);
        assertThat(result.confidence()).isBetween(0.0, 1.0);
    }

    @Test
    void detectFormat_shouldAddBodyHintsWithConfidenceByValidity() {
        FormatDetectionResult valid = detect("POST /api/items {\"name\":\"a\"}");
        FormatDetectionResult broken = detect("POST /api/items {\"name\" \"a\", \"b\": 1}");

        assertThat(valid.hints()).filteredOn(h -> h.kind() == HintKind.BODY)
                .extracting(ParsingHint::confidence).containsExactly(0.9);
        assertThat(broken.hints()).filteredOn(h -> h.kind() == HintKind.BODY)
                .extracting(ParsingHint::confidence).containsExactly(0.5);
    }

    @Test
    void extractHints_shouldFindMethodsUrlsAndUserCounts() {
        List<ParsingHint> hints = detector.extractHints("GET https://api.example.com/users with 50 users");

        assertThat(hints).extracting(ParsingHint::kind).contains(HintKind.METHOD, HintKind.URL, HintKind.COUNT);
        assertThat(hints).filteredOn(h -> h.kind() == HintKind.COUNT)
                .extracting(ParsingHint::value).containsExactly("50");
    }

    @Test
    void complexity_shouldStayWithinBounds() {
        assertThat(FormatDetectorImpl.complexity("", List.of())).isEqualTo(0.7);
        assertThat(FormatDetectorImpl.complexity("x".repeat(5000), detector.extractHints(
                "GET POST PUT DELETE PATCH https://a.example.com https://b.example.com"))).isCloseTo(1.0, within(1e-9));
    }
}
