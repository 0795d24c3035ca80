package io.github.drompincen.clawfork.runtime.agent;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.protocol.api.ResourceLimits;
import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;
import io.github.drompincen.clawfork.protocol.api.SubagentStatus;
import io.github.drompincen.clawfork.protocol.api.SubagentStepResult;
import io.github.drompincen.clawfork.runtime.agent.llm.LlmRequest;
import io.github.drompincen.clawfork.runtime.agent.llm.LlmResponse;
import io.github.drompincen.clawfork.runtime.agent.llm.LlmService;
import io.github.drompincen.clawfork.runtime.agent.llm.LlmToolCall;
import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import io.github.drompincen.clawfork.runtime.tools.ToolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Autonomous step loop: call the LLM, run the tools it asks for, feed the
 * outputs back, repeat until it stops asking for tools or a budget runs out.
 * <p>
 * The tool-call budget is checked before each tool runs, so it is never
 * exceeded. The token budget can only be checked after a response arrives,
 * because the cost of a call is not known in advance.
 */
@Component
public class DefaultSubagentExecutor implements SubagentExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultSubagentExecutor.class);
    public static final int DEFAULT_MAX_ITERATIONS = 50;

    private final LlmService llmService;
    private final ToolExecutor toolExecutor;
    private final int maxIterations;
    private final Clock clock;

    public DefaultSubagentExecutor(LlmService llmService, ToolExecutor toolExecutor) {
        this(llmService, toolExecutor, DEFAULT_MAX_ITERATIONS);
    }

    @Autowired
    public DefaultSubagentExecutor(LlmService llmService, ToolExecutor toolExecutor,
                                   SubagentProperties properties) {
        this(llmService, toolExecutor, properties.getMaxIterations());
    }

    public DefaultSubagentExecutor(LlmService llmService, ToolExecutor toolExecutor, int maxIterations) {
        this(llmService, toolExecutor, maxIterations, Clock.systemUTC());
    }

    public DefaultSubagentExecutor(LlmService llmService, ToolExecutor toolExecutor, int maxIterations,
                                   Clock clock) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("max iterations must be positive");
        }
        this.llmService = llmService;
        this.toolExecutor = toolExecutor;
        this.maxIterations = maxIterations;
        this.clock = clock;
    }

    @Override
    public SubagentResult execute(SubagentContext context, CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.create();
        ResourceLimits limits = context.resourceLimits();
        Run run = new Run(context, clock);
        List<ChatMessage> conversation = new ArrayList<>(context.conversationHistory());

        for (int i = 0; i < maxIterations; i++) {
            run.iterations = i + 1;

            if (token.isCancellationRequested()) {
                return run.finish(SubagentStatus.CANCELLED, "execution cancelled");
            }
            if (token.isDeadlineExceeded()) {
                return run.finish(SubagentStatus.TIMEOUT, "execution deadline exceeded");
            }
            if (!limits.isWithinLimits(run.tokensUsed, run.toolCallsMade, run.elapsed())) {
                return run.finish(SubagentStatus.TIMEOUT, "resource limits exceeded");
            }

            long stepStart = System.nanoTime();
            LlmResponse response;
            try {
                response = llmService.chat(
                        new LlmRequest(context.skillName(), conversation, context.allowedTools()), token);
            } catch (RuntimeException e) {
                log.warn("[{}] LLM call failed at step {}: {}", context.id(), run.steps.size() + 1, e.getMessage());
                return run.finish(SubagentStatus.ERROR, "LLM error: " + describe(e));
            }
            if (response == null) {
                return run.finish(SubagentStatus.ERROR, "LLM error: empty response");
            }

            int stepTokens = response.usage().totalTokens();
            run.tokensUsed += stepTokens;
            if (limits.maxTokens() > 0 && run.tokensUsed > limits.maxTokens()) {
                return run.finish(SubagentStatus.ERROR,
                        "token limit exceeded: " + run.tokensUsed + " > " + limits.maxTokens());
            }

            conversation.add(ChatMessage.assistant(response.content()));
            run.steps.add(new SubagentStepResult(
                    run.steps.size() + 1,
                    "LLM call (finish: " + response.finishReason() + ", tools: " + response.toolCalls().size() + ")",
                    response.content(),
                    stepTokens,
                    Duration.ofNanos(System.nanoTime() - stepStart)));
            log.debug("[{}] Step {}: finish={}, tools={}, tokens={}", context.id(), run.steps.size(),
                    response.finishReason(), response.toolCalls().size(), stepTokens);

            if (response.isFinal()) {
                run.output = response.content();
                return run.finish(SubagentStatus.COMPLETE, null);
            }

            for (LlmToolCall call : response.toolCalls()) {
                if (limits.maxToolCalls() > 0 && run.toolCallsMade >= limits.maxToolCalls()) {
                    return run.finish(SubagentStatus.ERROR,
                            "tool call limit exceeded: " + run.toolCallsMade + " >= " + limits.maxToolCalls());
                }
                if (!context.isToolAllowed(call.toolName())) {
                    return run.finish(SubagentStatus.ERROR,
                            "tool '" + call.toolName() + "' not allowed (allowed: " + context.allowedTools() + ")");
                }

                String output;
                try {
                    output = toolExecutor.execute(token, call.toolName(), call.arguments());
                } catch (RuntimeException e) {
                    log.warn("[{}] Tool {} failed: {}", context.id(), call.toolName(), e.getMessage());
                    return run.finish(SubagentStatus.ERROR, "tool execution error: " + describe(e));
                }

                run.toolCallsMade++;
                conversation.add(ChatMessage.user("Tool result from " + call.toolName() + ": " + output));
            }

            Duration elapsed = run.elapsed();
            if (!limits.isWithinLimits(run.tokensUsed, run.toolCallsMade, elapsed)) {
                // elapsed-time expiry reads as TIMEOUT wherever it is detected
                return limits.isTimeExceeded(elapsed)
                        ? run.finish(SubagentStatus.TIMEOUT, "resource limits exceeded after tool calls")
                        : run.finish(SubagentStatus.ERROR, "resource limits exceeded after tool calls");
            }
        }

        return run.finish(SubagentStatus.ERROR, "max iterations (" + maxIterations + ") reached");
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Mutable counters of one execution; confined to the executing thread. */
    private static final class Run {

        private final SubagentContext context;
        private final Clock clock;
        private final long startNanos = System.nanoTime();
        private final List<SubagentStepResult> steps = new ArrayList<>();
        private int tokensUsed;
        private int toolCallsMade;
        private int iterations;
        private String output;

        Run(SubagentContext context, Clock clock) {
            this.context = context;
            this.clock = clock;
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        SubagentResult finish(SubagentStatus status, String errorMessage) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("skillName", context.skillName());
            metadata.put("parentContextId", context.parentContextId());
            metadata.put("iterations", iterations);

            SubagentResult result = new SubagentResult(
                    context.id(), status, output, errorMessage,
                    tokensUsed, toolCallsMade, elapsed(), clock.instant(),
                    steps, metadata);
            if (status == SubagentStatus.COMPLETE) {
                log.info("[{}] Completed in {} step(s), {} tokens, {} tool call(s)",
                        context.id(), steps.size(), tokensUsed, toolCallsMade);
            } else {
                log.info("[{}] Finished {}: {}", context.id(), status, errorMessage);
            }
            return result;
        }
    }
}
