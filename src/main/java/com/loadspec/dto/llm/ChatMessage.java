package com.loadspec.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One turn of a chat-style completion, shared by the hosted providers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    /**
     * "system", "user" or "assistant". Claude only accepts "user" and "assistant" here.
     */
    private String role;

    private String content;
}
