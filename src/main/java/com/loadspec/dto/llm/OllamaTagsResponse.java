package com.loadspec.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Answer of Ollama's {@code /api/tags}: the locally installed models.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaTagsResponse {
    private List<Model> models = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Model {
        private String name;
    }
}
