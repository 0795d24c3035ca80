package io.github.drompincen.clawfork.runtime.agent.llm;

import java.util.List;

public record LlmResponse(
        String content,
        List<LlmToolCall> toolCalls,
        String finishReason,
        TokenUsage usage
) {
    public static final String FINISH_END_TURN = "end_turn";
    public static final String FINISH_TOOL_USE = "tool_use";

    public LlmResponse {
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        usage = usage != null ? usage : TokenUsage.EMPTY;
    }

    public static LlmResponse endTurn(String content, int totalTokens) {
        return new LlmResponse(content, List.of(), FINISH_END_TURN, TokenUsage.ofTotal(totalTokens));
    }

    public static LlmResponse toolUse(String content, List<LlmToolCall> toolCalls, int totalTokens) {
        return new LlmResponse(content, toolCalls, FINISH_TOOL_USE, TokenUsage.ofTotal(totalTokens));
    }

    /** No further tool round-trip is needed. */
    public boolean isFinal() {
        return FINISH_END_TURN.equals(finishReason) || toolCalls.isEmpty();
    }
}
