package com.loadspec.model.parse;

/**
 * The recognized shapes of operator input. Format-specific behaviour is selected with an
 * exhaustive {@code switch} over these constants.
 */
public enum InputFormat {
    NATURAL_LANGUAGE("natural_language"),
    MIXED_STRUCTURED("mixed_structured"),
    CURL_COMMAND("curl_command"),
    HTTP_RAW("http_raw"),
    JSON_WITH_TEXT("json_with_text"),
    CONCATENATED_REQUESTS("concatenated_requests");

    private final String label;

    InputFormat(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
