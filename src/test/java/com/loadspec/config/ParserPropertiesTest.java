package com.loadspec.config;

import com.loadspec.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration
    @EnableConfigurationProperties(ParserProperties.class)
    static class PropertiesConfig {
    }

    @Test
    void validate_shouldAcceptDefaults() {
        assertThatCode(() -> new ParserProperties().validate()).doesNotThrowAnyException();
    }

    @Test
    void validate_shouldReportEveryBrokenRelationship() {
        ParserProperties properties = new ParserProperties();
        properties.getBackend().setRetryBaseDelayMs(5000);
        properties.getBackend().setRetryMaxDelayMs(100);
        properties.getConfidence().setFallbackFloor(0.9);
        properties.getBackend().setProvider("openai");

        assertThatThrownBy(properties::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageStartingWith("Invalid load-spec configuration: ")
                .hasMessageContaining("retry-base-delay-ms (5000)")
                .hasMessageContaining("fallback-floor (0.9)")
                .hasMessageContaining("set LOADSPEC_API_KEY");
    }

    @Test
    void binding_shouldReadRelaxedPropertyNames() {
        contextRunner
                .withPropertyValues("loadspec.backend.provider=claude",
                        "loadspec.backend.api-key=sk-ant-test",
                        "loadspec.backend.max-retries=5",
                        "loadspec.recovery.enable-fallback=false",
                        "loadspec.correction.max-remote-rounds=4")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    ParserProperties properties = context.getBean(ParserProperties.class);
                    assertThat(properties.getBackend().getProvider()).isEqualTo("claude");
                    assertThat(properties.getBackend().getMaxRetries()).isEqualTo(5);
                    assertThat(properties.getRecovery().isEnableFallback()).isFalse();
                    assertThat(properties.getCorrection().getMaxRemoteRounds()).isEqualTo(4);
                    assertThat(properties.getPool().getMaxConnections()).isEqualTo(5);
                });
    }

    @Test
    void binding_shouldRejectOutOfRangeValues() {
        contextRunner
                .withPropertyValues("loadspec.backend.temperature=3.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void binding_shouldRejectUnknownProvider() {
        contextRunner
                .withPropertyValues("loadspec.backend.provider=gemini", "loadspec.backend.api-key=x")
                .run(context -> assertThat(context).hasFailed());
    }
}
