package io.github.drompincen.clawfork.runtime.tools;

import io.github.drompincen.clawfork.runtime.agent.CancellationToken;

import java.util.Map;

public interface ToolExecutor {

    /**
     * Runs the named tool and returns its textual output.
     *
     * @throws ToolExecutionException when the tool is unknown or fails
     */
    String execute(CancellationToken cancellation, String toolName, Map<String, Object> args);
}
