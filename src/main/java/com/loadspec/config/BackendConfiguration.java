package com.loadspec.config;

import com.loadspec.service.api.AiBackend;
import com.loadspec.service.backend.AiBackendFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackendConfiguration {

    /**
     * The adapter is created eagerly but initialized lazily, on the first parse that needs it,
     * so the shell starts even when the model server is down.
     */
    @Bean
    public AiBackend aiBackend(AiBackendFactory factory) {
        return factory.create();
    }
}
