package io.github.drompincen.clawfork.protocol.api;

import java.time.Duration;

/**
 * Budget for one subagent. A zero token or tool-call limit means unlimited;
 * the timeout is always required.
 */
public record ResourceLimits(
        int maxTokens,
        int maxToolCalls,
        Duration timeout
) {
    public static final int DEFAULT_MAX_TOKENS = 100_000;
    public static final int DEFAULT_MAX_TOOL_CALLS = 50;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public static ResourceLimits defaults() {
        return new ResourceLimits(DEFAULT_MAX_TOKENS, DEFAULT_MAX_TOOL_CALLS, DEFAULT_TIMEOUT);
    }

    /**
     * Inclusive check: usage exactly at a limit is still within it.
     */
    public boolean isWithinLimits(int tokensUsed, int toolCallsMade, Duration elapsed) {
        if (maxTokens > 0 && tokensUsed > maxTokens) return false;
        if (maxToolCalls > 0 && toolCallsMade > maxToolCalls) return false;
        return !isTimeExceeded(elapsed);
    }

    public boolean isTimeExceeded(Duration elapsed) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative()
                && elapsed != null && elapsed.compareTo(timeout) > 0;
    }

    public void validate() {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxTokens < 0) {
            throw new IllegalArgumentException("max tokens must be non-negative");
        }
        if (maxToolCalls < 0) {
            throw new IllegalArgumentException("max tool calls must be non-negative");
        }
    }
}
