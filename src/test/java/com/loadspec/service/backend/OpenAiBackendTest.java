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

class OpenAiBackendTest {

    private static final String CHAT_RESPONSE = "{\"model\":\"gpt-3.5-turbo-0125\",\"choices\":[{\"message\":"
            + "{\"role\":\"assistant\",\"content\":\"{\\\"testType\\\":\\\"baseline\\\"}\"},\"finish_reason\":\"stop\"}],"
            + "\"usage\":{\"prompt_tokens\":40,\"completion_tokens\":9}}";

    private MockWebServer mockOpenAi;
    private ParserProperties properties;
    private OpenAiBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        mockOpenAi = new MockWebServer();
        mockOpenAi.start();
        properties = new ParserProperties();
        properties.getBackend().setApiKey("test-key");
        properties.getBackend().setMaxRetries(2);
        properties.getBackend().setRetryBaseDelayMs(1);
        properties.getBackend().setRetryMaxDelayMs(5);
        properties.getBackend().setJitter(false);
        backend = create();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockOpenAi.shutdown();
    }

    private OpenAiBackend create() {
        String baseUrl = String.format("http://localhost:%s/v1", mockOpenAi.getPort());
        WebClient client = new HttpClientFactory(WebClient.builder()).create(baseUrl, Duration.ofSeconds(5));
        return new OpenAiBackend(properties.getBackend(), client);
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).addHeader("Content-Type", "application/json");
    }

    @Test
    void generateCompletion_shouldSendChatRequestWithJsonMode() throws Exception {
        // --- Arrange ---
        mockOpenAi.enqueue(json("{\"data\":[]}"));
        mockOpenAi.enqueue(json(CHAT_RESPONSE));
        backend.initialize();

        // --- Act ---
        CompletionResponse response = backend.generateCompletion(CompletionRequest.json("You parse load tests.", "GET /api/users"));

        // --- Assert ---
        assertThat(response.text()).isEqualTo("{\"testType\":\"baseline\"}");
        assertThat(response.model()).isEqualTo("gpt-3.5-turbo-0125");
        assertThat(response.usage().totalTokens()).isEqualTo(49);

        RecordedRequest models = mockOpenAi.takeRequest();
        assertThat(models.getPath()).isEqualTo("/v1/models");
        RecordedRequest chat = mockOpenAi.takeRequest();
        String body = chat.getBody().readUtf8();
        assertThat(chat.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(chat.getHeader("Authorization")).isEqualTo("Bearer test-key");
        assertThat(body).contains("\"model\":\"gpt-3.5-turbo\"");
        assertThat(body).contains("\"role\":\"system\",\"content\":\"You parse load tests.\"");
        assertThat(body).contains("\"role\":\"user\",\"content\":\"GET /api/users\"");
        assertThat(body).contains("\"response_format\":{\"type\":\"json_object\"}");
    }

    @Test
    void initialize_shouldRejectMissingApiKeyWithoutCallingApi() {
        properties.getBackend().setApiKey("");
        OpenAiBackend unauthenticated = create();

        assertThatThrownBy(unauthenticated::initialize)
                .isInstanceOf(AiServiceException.class)
                .satisfies(e -> assertThat(((AiServiceException) e).isCritical()).isTrue());
        assertThat(mockOpenAi.getRequestCount()).isZero();
    }

    @Test
    void generateCompletion_shouldRetryRateLimitedCalls() {
        mockOpenAi.enqueue(json("{\"data\":[]}"));
        mockOpenAi.enqueue(new MockResponse().setResponseCode(429));
        mockOpenAi.enqueue(json(CHAT_RESPONSE));
        backend.initialize();

        CompletionResponse response = backend.generateCompletion(CompletionRequest.text("hello"));

        assertThat(response.text()).isEqualTo("{\"testType\":\"baseline\"}");
        assertThat(backend.errorStatistics().counts()).containsEntry(AiErrorType.RATE_LIMITED, 1L);
    }

    @Test
    void generateCompletion_shouldNotRetryRejectedCredentials() {
        mockOpenAi.enqueue(json("{\"data\":[]}"));
        mockOpenAi.enqueue(new MockResponse().setResponseCode(401));
        backend.initialize();

        assertThatThrownBy(() -> backend.generateCompletion(CompletionRequest.text("hello")))
                .isInstanceOf(AiServiceException.class)
                .satisfies(e -> {
                    AiServiceException ai = (AiServiceException) e;
                    assertThat(ai.getType()).isEqualTo(AiErrorType.AUTHENTICATION_FAILED);
                    assertThat(ai.getStatusCode()).isEqualTo(401);
                });
        assertThat(backend.errorStatistics().total()).isEqualTo(1);
        assertThat(mockOpenAi.getRequestCount()).isEqualTo(2);
    }
}
