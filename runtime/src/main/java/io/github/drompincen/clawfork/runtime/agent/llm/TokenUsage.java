package io.github.drompincen.clawfork.runtime.agent.llm;

public record TokenUsage(
        int promptTokens,
        int completionTokens,
        int totalTokens
) {
    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    public static TokenUsage ofTotal(int totalTokens) {
        return new TokenUsage(0, 0, totalTokens);
    }
}
