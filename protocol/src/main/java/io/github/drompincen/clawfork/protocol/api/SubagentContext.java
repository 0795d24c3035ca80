package io.github.drompincen.clawfork.protocol.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Isolated execution context handed to exactly one subagent run.
 * <p>
 * {@code allowedTools} keeps the distinction between {@code null} (every tool
 * is allowed) and an empty list (no tool is allowed). All collections are
 * copied on construction and exposed read-only.
 */
public record SubagentContext(
        String id,
        String parentContextId,
        String skillName,
        List<String> allowedTools,
        ResourceLimits resourceLimits,
        List<ChatMessage> conversationHistory,
        Instant createdAt,
        Map<String, Object> metadata
) {
    public SubagentContext {
        allowedTools = allowedTools != null ? List.copyOf(allowedTools) : null;
        conversationHistory = conversationHistory != null ? List.copyOf(conversationHistory) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public boolean isToolAllowed(String toolName) {
        if (allowedTools == null) return true;
        if (allowedTools.isEmpty()) return false;
        return allowedTools.contains(toolName);
    }

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("subagent context ID is required");
        }
        if (parentContextId == null || parentContextId.isBlank()) {
            throw new IllegalArgumentException("parent context ID is required");
        }
        if (skillName == null || skillName.isBlank()) {
            throw new IllegalArgumentException("skill name is required");
        }
        if (resourceLimits == null) {
            throw new IllegalArgumentException("resource limits are required");
        }
        resourceLimits.validate();
    }
}
