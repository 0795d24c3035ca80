package io.github.drompincen.clawfork.runtime.lifecycle;

import io.github.drompincen.clawfork.runtime.agent.SubagentException;

import java.util.List;

public class SubagentShutdownTimeoutException extends SubagentException {

    private final List<String> stillRunning;

    public SubagentShutdownTimeoutException(String message, List<String> stillRunning) {
        super(message);
        this.stillRunning = List.copyOf(stillRunning);
    }

    public SubagentShutdownTimeoutException(String message, List<String> stillRunning, Throwable cause) {
        super(message, cause);
        this.stillRunning = List.copyOf(stillRunning);
    }

    public List<String> getStillRunning() {
        return stillRunning;
    }
}
