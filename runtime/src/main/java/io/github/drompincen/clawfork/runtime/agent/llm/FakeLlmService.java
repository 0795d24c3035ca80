package io.github.drompincen.clawfork.runtime.agent.llm;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Fake LLM service for running without an API key.
 * Asks for {@code current_time} once when the latest request mentions the
 * time and the tool is allowed, then answers with a canned summary.
 *
 * Activate with: CLAWFORK_LLM_PROVIDER=fake (the default)
 */
@Service
@ConditionalOnProperty(name = "clawfork.llm.provider", havingValue = "fake", matchIfMissing = true)
public class FakeLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmService.class);
    static final String TIME_TOOL = "current_time";
    private static final String TOOL_RESULT_PREFIX = "Tool result from ";

    @Override
    public LlmResponse chat(LlmRequest request, CancellationToken cancellation) {
        List<ChatMessage> messages = request.messages();
        String lastUser = lastUserMessage(messages);
        int promptTokens = estimateTokens(messages);

        if (wantsTime(lastUser) && isAllowed(request.allowedTools()) && !hasToolResult(messages)) {
            log.debug("[FAKE LLM] skill={}, requesting {}", request.skillName(), TIME_TOOL);
            String content = "Let me check the current time.";
            return new LlmResponse(content,
                    List.of(new LlmToolCall(TIME_TOOL, Map.of())),
                    LlmResponse.FINISH_TOOL_USE,
                    new TokenUsage(promptTokens, estimateTokens(content), promptTokens + estimateTokens(content)));
        }

        String content = generateAnswer(request.skillName(), lastUser);
        log.debug("[FAKE LLM] skill={}, response length={}", request.skillName(), content.length());
        int completion = estimateTokens(content);
        return new LlmResponse(content, List.of(), LlmResponse.FINISH_END_TURN,
                new TokenUsage(promptTokens, completion, promptTokens + completion));
    }

    private String generateAnswer(String skillName, String lastUser) {
        if (lastUser.startsWith(TOOL_RESULT_PREFIX)) {
            return "Done. " + truncate(lastUser, 200);
        }
        if (lastUser.isBlank()) {
            return "[%s] Nothing to do.".formatted(skillName);
        }
        return "[%s] Handled: %s".formatted(skillName, truncate(lastUser, 200));
    }

    private static boolean wantsTime(String text) {
        String lower = text.toLowerCase();
        return lower.contains("time") || lower.contains("date");
    }

    private static boolean isAllowed(List<String> allowedTools) {
        return allowedTools == null || allowedTools.contains(TIME_TOOL);
    }

    private static boolean hasToolResult(List<ChatMessage> messages) {
        return messages.stream().anyMatch(m -> ChatMessage.USER.equals(m.role())
                && m.content().startsWith(TOOL_RESULT_PREFIX));
    }

    private static String lastUserMessage(List<ChatMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (ChatMessage.USER.equals(messages.get(i).role())) {
                return messages.get(i).content();
            }
        }
        return "";
    }

    static int estimateTokens(List<ChatMessage> messages) {
        int total = 0;
        for (ChatMessage m : messages) {
            total += estimateTokens(m.content());
        }
        return total;
    }

    static int estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
