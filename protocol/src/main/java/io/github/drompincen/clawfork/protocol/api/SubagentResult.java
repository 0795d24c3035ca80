package io.github.drompincen.clawfork.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubagentResult(
        String subagentId,
        SubagentStatus status,
        String output,
        String errorMessage,
        int tokensUsed,
        int toolCallsMade,
        Duration executionTime,
        Instant completedAt,
        List<SubagentStepResult> stepResults,
        Map<String, Object> metadata
) {
    public SubagentResult {
        stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public static SubagentResult running(String subagentId) {
        return new SubagentResult(subagentId, SubagentStatus.RUNNING, null, null,
                0, 0, null, null, List.of(), Map.of());
    }

    public static SubagentResult failed(String subagentId, String errorMessage) {
        return failed(subagentId, errorMessage, Instant.now());
    }

    public static SubagentResult failed(String subagentId, String errorMessage, Instant completedAt) {
        return new SubagentResult(subagentId, SubagentStatus.ERROR, null, errorMessage,
                0, 0, null, completedAt, List.of(), Map.of());
    }

    public SubagentResult withStatus(SubagentStatus newStatus, String newErrorMessage) {
        return withStatus(newStatus, newErrorMessage, Instant.now());
    }

    /** {@code at} becomes the completion time only when moving to a terminal status without one. */
    public SubagentResult withStatus(SubagentStatus newStatus, String newErrorMessage, Instant at) {
        return new SubagentResult(subagentId, newStatus, output, newErrorMessage,
                tokensUsed, toolCallsMade, executionTime,
                newStatus.isTerminal() && completedAt == null ? at : completedAt,
                stepResults, metadata);
    }

    public void validate() {
        if (subagentId == null || subagentId.isBlank()) {
            throw new IllegalArgumentException("subagent ID is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("invalid subagent status");
        }
        if (status == SubagentStatus.ERROR && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("error message required when status is error");
        }
    }
}
