package io.github.drompincen.clawfork.runtime.tools;

import io.github.drompincen.clawfork.runtime.agent.CancellationToken;

public record ToolContext(
        String toolName,
        CancellationToken cancellation
) {}
