package io.github.drompincen.clawfork.runtime.agent.llm;

import io.github.drompincen.clawfork.runtime.agent.CancellationToken;

public interface LlmService {

    /**
     * Sends the conversation to the model and returns its reply.
     *
     * @throws LlmException when the provider call fails
     */
    LlmResponse chat(LlmRequest request, CancellationToken cancellation);

    /**
     * Returns true if this LLM service has a working provider configured.
     */
    default boolean isAvailable() { return true; }
}
