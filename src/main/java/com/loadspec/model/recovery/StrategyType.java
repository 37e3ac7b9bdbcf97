package com.loadspec.model.recovery;

public enum StrategyType {
    RETRY("retry"),
    ENHANCE_PROMPT("enhance_prompt"),
    FALLBACK("fallback"),
    USER_INPUT("user_input");

    private final String label;

    StrategyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
