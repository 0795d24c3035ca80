package io.github.drompincen.clawfork.runtime.fork;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.protocol.api.ResourceLimits;
import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.runtime.agent.SubagentValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds the isolated context a subagent runs in. The parent's history and
 * allowlist are copied, so neither side can observe later changes made by
 * the other. Forking registers nothing; the caller decides whether to start
 * the returned context.
 */
@Component
public class ContextForker {

    private static final Logger log = LoggerFactory.getLogger(ContextForker.class);
    static final String ID_PREFIX = "subagent-";

    private final Clock clock;

    public ContextForker() {
        this(Clock.systemUTC());
    }

    public ContextForker(Clock clock) {
        this.clock = clock;
    }

    public SubagentContext fork(String parentContextId,
                                List<ChatMessage> parentHistory,
                                String skillName,
                                List<String> allowedTools,
                                ResourceLimits resourceLimits) {
        return fork(parentContextId, parentHistory, skillName, allowedTools, resourceLimits, Map.of());
    }

    public SubagentContext fork(String parentContextId,
                                List<ChatMessage> parentHistory,
                                String skillName,
                                List<String> allowedTools,
                                ResourceLimits resourceLimits,
                                Map<String, Object> metadata) {
        if (parentContextId == null || parentContextId.isBlank()) {
            throw new SubagentValidationException("parent context ID is required");
        }
        if (skillName == null || skillName.isBlank()) {
            throw new SubagentValidationException("skill name is required");
        }
        if (resourceLimits == null) {
            throw new SubagentValidationException("resource limits are required");
        }
        try {
            resourceLimits.validate();
        } catch (IllegalArgumentException e) {
            throw new SubagentValidationException("invalid resource limits: " + e.getMessage(), e);
        }

        List<ChatMessage> history = new ArrayList<>();
        if (parentHistory != null) {
            for (ChatMessage msg : parentHistory) {
                if (msg == null) {
                    throw new SubagentValidationException("parent history contains a null message");
                }
                if (msg.role() == null || msg.role().isBlank()) {
                    throw new SubagentValidationException("parent history contains a message without a role");
                }
                history.add(new ChatMessage(msg.role(), msg.content()));
            }
        }

        List<String> tools = null;
        if (allowedTools != null) {
            if (allowedTools.stream().anyMatch(Objects::isNull)) {
                throw new SubagentValidationException("allowed tools contains a null name");
            }
            tools = new ArrayList<>(allowedTools);
        }

        SubagentContext context = new SubagentContext(
                ID_PREFIX + UUID.randomUUID(),
                parentContextId,
                skillName,
                tools,
                resourceLimits,
                history,
                clock.instant(),
                metadata);

        log.debug("Forked {} from {} for skill {} ({} messages, tools={})",
                context.id(), parentContextId, skillName, history.size(),
                tools == null ? "all" : tools);
        return context;
    }
}
