package com.loadspec.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OllamaPullRequest {
    private String name;
    private boolean stream;
}
