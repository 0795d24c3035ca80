package io.github.drompincen.clawfork.protocol.api;

import java.time.Duration;

/** One LLM round-trip of a subagent run. Step numbers start at 1. */
public record SubagentStepResult(
        int stepNumber,
        String action,
        String result,
        int tokensUsed,
        Duration duration
) {}
