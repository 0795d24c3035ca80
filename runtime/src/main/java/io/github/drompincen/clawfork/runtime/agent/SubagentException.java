package io.github.drompincen.clawfork.runtime.agent;

/**
 * Base type for misuse of the subagent API. Business failures of a running
 * subagent are reported in its result instead.
 */
public class SubagentException extends RuntimeException {

    public SubagentException(String message) {
        super(message);
    }

    public SubagentException(String message, Throwable cause) {
        super(message, cause);
    }
}
