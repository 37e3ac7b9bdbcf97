package com.loadspec.dto.response;

import java.util.List;

/**
 * Outcome of a shell command, printed in green on success and red on failure.
 *
 * @param success     Whether the command did what was asked.
 * @param message     Headline shown to the operator.
 * @param suggestions Follow-up hints printed under the headline, may be empty.
 */
public record CommandResponse(boolean success, String message, List<String> suggestions) {

    public CommandResponse(boolean success, String message) {
        this(success, message, List.of());
    }

    public CommandResponse {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m";
        StringBuilder sb = new StringBuilder(color).append(message).append("\u001B[0m");
        suggestions.forEach(s -> sb.append("\n  \u001B[33m- ").append(s).append("\u001B[0m"));
        return sb.toString();
    }
}
