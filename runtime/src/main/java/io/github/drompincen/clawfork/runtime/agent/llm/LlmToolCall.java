package io.github.drompincen.clawfork.runtime.agent.llm;

import java.util.Map;

public record LlmToolCall(
        String toolName,
        Map<String, Object> arguments
) {
    public LlmToolCall {
        arguments = arguments != null ? arguments : Map.of();
    }
}
