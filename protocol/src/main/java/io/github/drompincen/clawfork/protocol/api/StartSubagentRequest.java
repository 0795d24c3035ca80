package io.github.drompincen.clawfork.protocol.api;

import java.util.List;
import java.util.Map;

/**
 * Request body for forking and starting a subagent over the gateway. Budget
 * fields left null fall back to the configured defaults.
 */
public record StartSubagentRequest(
        String parentContextId,
        String skillName,
        List<ChatMessage> history,
        List<String> allowedTools,
        Integer maxTokens,
        Integer maxToolCalls,
        Long timeoutSeconds,
        Map<String, Object> metadata
) {}
