package io.github.drompincen.clawfork.runtime.agent;

public class SubagentConflictException extends SubagentException {

    public SubagentConflictException(String subagentId) {
        super("subagent " + subagentId + " is already running");
    }
}
