package com.loadspec.service.backend;

import com.loadspec.config.HttpClientFactory;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.AiErrorType;
import com.loadspec.exception.AiServiceException;
import com.loadspec.model.backend.CompletionRequest;
import com.loadspec.model.backend.CompletionResponse;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import java.io.IOException;
import java.time.Duration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaBackendTest {

    private static final String TAGS = "{\"models\":[{\"name\":\"llama3.2:1b\"}]}";
    private static final String GENERATED = "{\"model\":\"llama3.2:1b\",\"response\":\"{\\\"ok\\\":true}\",\"done\":true,"
            + "\"prompt_eval_count\":12,\"eval_count\":7}";

    private MockWebServer mockOllama;
    private ParserProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        mockOllama = new MockWebServer();
        mockOllama.start();
        properties = new ParserProperties();
        ParserProperties.Backend backend = properties.getBackend();
        backend.setModel("llama3.2:1b");
        backend.setMaxRetries(2);
        backend.setRetryBaseDelayMs(1);
        backend.setRetryMaxDelayMs(5);
        backend.setJitter(false);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockOllama.shutdown();
    }

    private OllamaBackend backend() {
        return backendAt(String.format("http://localhost:%s", mockOllama.getPort()));
    }

    private OllamaBackend backendAt(String baseUrl) {
        WebClient client = new HttpClientFactory(WebClient.builder()).create(baseUrl, Duration.ofSeconds(5));
        return new OllamaBackend(properties.getBackend(), properties.getPool(), client);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).addHeader("Content-Type", "application/json");
    }

    @Test
    void generateCompletion_shouldSendJsonModeRequestAndReadResponse() throws Exception {
        // --- Arrange ---
        mockOllama.enqueue(json(TAGS));
        mockOllama.enqueue(json(GENERATED));
        OllamaBackend ollama = backend();
        ollama.initialize();

        // --- Act ---
        CompletionResponse response = ollama.generateCompletion(CompletionRequest.json("be precise", "GET /api/users"));

        // --- Assert ---
        assertThat(response.text()).isEqualTo("{\"ok\":true}");
        assertThat(response.model()).isEqualTo("llama3.2:1b");
        assertThat(response.usage().totalTokens()).isEqualTo(19);
        assertThat(response.metadata().provider()).isEqualTo("ollama");

        assertThat(mockOllama.takeRequest().getPath()).isEqualTo("/api/tags");
        RecordedRequest generate = mockOllama.takeRequest();
        String body = generate.getBody().readUtf8();
        assertThat(generate.getPath()).isEqualTo("/api/generate");
        assertThat(body).contains("\"format\":\"json\"", "\"system\":\"be precise\"", "\"stream\":false", "\"num_predict\":2000");
    }

    @Test
    void initialize_shouldPullMissingModel() throws Exception {
        mockOllama.enqueue(json("{\"models\":[{\"name\":\"mistral:latest\"}]}"));
        mockOllama.enqueue(json("{\"status\":\"success\"}"));
        OllamaBackend ollama = backend();

        ollama.initialize();

        assertThat(ollama.isReady()).isTrue();
        mockOllama.takeRequest();
        RecordedRequest pull = mockOllama.takeRequest();
        assertThat(pull.getPath()).isEqualTo("/api/pull");
        assertThat(pull.getBody().readUtf8()).contains("\"name\":\"llama3.2:1b\"");
    }

    @Test
    void initialize_shouldRefuseMissingModelWhenAutoPullIsOff() {
        properties.getBackend().setAutoPullModel(false);
        mockOllama.enqueue(json("{\"models\":[]}"));
        OllamaBackend ollama = backend();

        assertThatThrownBy(ollama::initialize)
                .isInstanceOf(AiServiceException.class)
                .satisfies(e -> assertThat(((AiServiceException) e).getType()).isEqualTo(AiErrorType.MODEL_UNAVAILABLE));
        assertThat(ollama.isReady()).isFalse();
        assertThat(ollama.errorStatistics().counts()).containsEntry(AiErrorType.MODEL_UNAVAILABLE, 1L);
    }

    @Test
    void initialize_shouldReportConnectionFailureWhenServerIsDown() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String baseUrl = String.format("http://localhost:%s", stopped.getPort());
        stopped.shutdown();
        OllamaBackend ollama = backendAt(baseUrl);

        assertThatThrownBy(ollama::initialize)
                .isInstanceOf(AiServiceException.class)
                .satisfies(e -> assertThat(((AiServiceException) e).getType()).isEqualTo(AiErrorType.CONNECTION_FAILED));
        assertThat(ollama.healthCheck()).isFalse();
    }

    @Test
    void generateCompletion_shouldRetryServerErrors() {
        mockOllama.enqueue(json(TAGS));
        mockOllama.enqueue(new MockResponse().setResponseCode(503));
        mockOllama.enqueue(json(GENERATED));
        OllamaBackend ollama = backend();
        ollama.initialize();

        CompletionResponse response = ollama.generateCompletion(CompletionRequest.text("hello"));

        assertThat(response.text()).isEqualTo("{\"ok\":true}");
        assertThat(mockOllama.getRequestCount()).isEqualTo(3);
        assertThat(ollama.errorStatistics().counts()).containsEntry(AiErrorType.SERVICE_UNAVAILABLE, 1L);
        assertThat(ollama.pool().activeConnections()).isZero();
    }

    @Test
    void generateCompletion_shouldNotRetryUnusableResponse() {
        mockOllama.enqueue(json(TAGS));
        mockOllama.enqueue(json("{\"model\":\"llama3.2:1b\",\"response\":{\"nested\":1},\"done\":true}"));
        OllamaBackend ollama = backend();
        ollama.initialize();

        assertThatThrownBy(() -> ollama.generateCompletion(CompletionRequest.text("hello")))
                .isInstanceOf(AiServiceException.class)
                .satisfies(e -> assertThat(((AiServiceException) e).getType()).isEqualTo(AiErrorType.INVALID_RESPONSE));
        assertThat(mockOllama.getRequestCount()).isEqualTo(2);
    }

    @Test
    void generateCompletion_shouldRequireInitialization() {
        OllamaBackend ollama = backend();

        assertThatThrownBy(() -> ollama.generateCompletion(CompletionRequest.text("hello")))
                .isInstanceOf(AiServiceException.class)
                .hasMessageContaining("not initialized");
        assertThat(mockOllama.getRequestCount()).isZero();
    }

    @Test
    void serviceHealth_shouldReflectInitialization() {
        mockOllama.enqueue(json(TAGS));
        OllamaBackend ollama = backend();
        ollama.initialize();

        assertThat(ollama.serviceHealth().healthy()).isTrue();
        assertThat(ollama.serviceHealth().lastCheck()).isNotNull();
        assertThat(ollama.serviceHealth().activeConnections()).isZero();
    }

    @Test
    void healthCheck_shouldRecordOutcomeInServiceHealth() {
        mockOllama.enqueue(json(TAGS));
        mockOllama.enqueue(new MockResponse().setResponseCode(500));
        OllamaBackend ollama = backend();
        assertThat(ollama.serviceHealth().lastCheck()).isNull();

        assertThat(ollama.healthCheck()).isTrue();
        assertThat(ollama.serviceHealth().healthy()).isTrue();
        assertThat(ollama.serviceHealth().lastCheck()).isNotNull();

        assertThat(ollama.healthCheck()).isFalse();
        assertThat(ollama.serviceHealth().healthy()).isFalse();
    }
}
