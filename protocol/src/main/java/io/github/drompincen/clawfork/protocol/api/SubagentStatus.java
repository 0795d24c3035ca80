package io.github.drompincen.clawfork.protocol.api;

/**
 * Execution status of a subagent. PENDING moves to RUNNING, RUNNING moves to
 * exactly one terminal status, and nothing leaves a terminal status.
 */
public enum SubagentStatus {
    PENDING,
    RUNNING,
    COMPLETE,
    ERROR,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == TIMEOUT || this == CANCELLED;
    }

    public boolean canTransitionTo(SubagentStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }
}
