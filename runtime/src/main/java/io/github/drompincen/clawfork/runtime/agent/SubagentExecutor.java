package io.github.drompincen.clawfork.runtime.agent;

import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;

/**
 * Runs one subagent to completion. Implementations report every business
 * failure as a terminal {@link SubagentResult} and check the token between
 * steps; a thrown exception is treated by callers as an ERROR result.
 */
public interface SubagentExecutor {

    SubagentResult execute(SubagentContext context, CancellationToken cancellation);
}
