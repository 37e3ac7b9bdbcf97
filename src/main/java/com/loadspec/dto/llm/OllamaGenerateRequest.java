package com.loadspec.dto.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of Ollama's {@code /api/generate}. Streaming is always off so the whole
 * completion arrives as one JSON document.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OllamaGenerateRequest {

    private String model;

    private String prompt;

    private String system;

    private boolean stream = false;

    /**
     * "json" to constrain the output to JSON; {@code null} for free text.
     */
    private String format;

    /**
     * Sampling options: temperature, top_p, top_k, num_predict.
     */
    private Map<String, Object> options = new LinkedHashMap<>();
}
