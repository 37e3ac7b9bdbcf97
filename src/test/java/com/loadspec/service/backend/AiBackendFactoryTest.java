package com.loadspec.service.backend;

import com.loadspec.config.HttpClientFactory;
import com.loadspec.config.ParserProperties;
import com.loadspec.exception.InvalidConfigurationException;
import com.loadspec.service.api.AiBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AiBackendFactoryTest {

    private ParserProperties properties;
    private AiBackendFactory factory;

    @BeforeEach
    void setUp() {
        properties = new ParserProperties();
        factory = new AiBackendFactory(properties, new HttpClientFactory(WebClient.builder()));
    }

    @Test
    void create_shouldBuildOllamaByDefault() {
        AiBackend backend = factory.create();

        assertThat(backend).isInstanceOf(OllamaBackend.class);
        assertThat(backend.name()).isEqualTo("ollama");
        assertThat(backend.isReady()).isFalse();
    }

    @Test
    void create_shouldBuildHostedProvidersWhenKeyIsPresent() {
        properties.getBackend().setApiKey("secret");

        properties.getBackend().setProvider("openai");
        assertThat(factory.create()).isInstanceOf(OpenAiBackend.class);

        properties.getBackend().setProvider("claude");
        assertThat(factory.create()).isInstanceOf(ClaudeBackend.class);
    }

    @Test
    void create_shouldRequireApiKeyForHostedProviders() {
        properties.getBackend().setProvider("claude");
        properties.getBackend().setApiKey("  ");

        assertThatThrownBy(factory::create)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("LOADSPEC_API_KEY");
    }

    @Test
    void create_shouldListSupportedProvidersForUnknownOne() {
        properties.getBackend().setProvider("gemini");

        assertThatThrownBy(factory::create)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Unsupported AI provider 'gemini'. Supported providers: ollama, openai, claude");
    }
}
