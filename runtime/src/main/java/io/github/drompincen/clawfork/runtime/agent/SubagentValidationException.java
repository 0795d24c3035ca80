package io.github.drompincen.clawfork.runtime.agent;

public class SubagentValidationException extends SubagentException {

    public SubagentValidationException(String message) {
        super(message);
    }

    public SubagentValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
