package io.github.drompincen.clawfork.runtime.agent;

/** Start was refused because no execution slot is available. */
public class SubagentCapacityException extends SubagentException {

    public SubagentCapacityException(String message) {
        super(message);
    }

    public SubagentCapacityException(String message, Throwable cause) {
        super(message, cause);
    }
}
