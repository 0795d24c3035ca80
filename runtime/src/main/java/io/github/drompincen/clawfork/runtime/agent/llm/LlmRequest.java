package io.github.drompincen.clawfork.runtime.agent.llm;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;

import java.util.List;

/**
 * @param allowedTools tool names the model may request; null means every
 *                     registered tool, empty means none
 */
public record LlmRequest(
        String skillName,
        List<ChatMessage> messages,
        List<String> allowedTools
) {
    public LlmRequest {
        messages = messages != null ? List.copyOf(messages) : List.of();
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : null;
    }
}
