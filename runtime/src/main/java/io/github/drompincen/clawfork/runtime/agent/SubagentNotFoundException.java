package io.github.drompincen.clawfork.runtime.agent;

public class SubagentNotFoundException extends SubagentException {

    private final String subagentId;

    public SubagentNotFoundException(String subagentId) {
        super("subagent " + subagentId + " not found");
        this.subagentId = subagentId;
    }

    public String getSubagentId() {
        return subagentId;
    }
}
