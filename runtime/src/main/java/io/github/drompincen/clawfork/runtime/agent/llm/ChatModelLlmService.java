package io.github.drompincen.clawfork.runtime.agent.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;
import io.github.drompincen.clawfork.runtime.tools.Tool;
import io.github.drompincen.clawfork.runtime.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LLM service backed by a Spring AI {@link ChatModel} (Anthropic or OpenAI,
 * whichever starter is enabled).
 * <p>
 * The tools a subagent may use are described in a system message. Tool
 * requests are taken from the model's native tool calls when present,
 * otherwise from inline {@code <tool_call>} blocks in the reply text.
 *
 * Activate with: CLAWFORK_LLM_PROVIDER=spring-ai
 */
@Service
@ConditionalOnProperty(name = "clawfork.llm.provider", havingValue = "spring-ai")
public class ChatModelLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmService.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final ChatModel chatModel;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final InlineToolCallParser inlineParser;

    public ChatModelLlmService(ChatModel chatModel, ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.inlineParser = new InlineToolCallParser(objectMapper);
    }

    @Autowired
    public ChatModelLlmService(ObjectProvider<ChatModel> chatModel,
                               ObjectProvider<ToolRegistry> toolRegistry,
                               ObjectProvider<ObjectMapper> objectMapper) {
        this(chatModel.getIfUnique(), toolRegistry.getIfAvailable(),
                objectMapper.getIfAvailable(ObjectMapper::new));
        log.info("ChatModelLlmService initialized, model={}",
                this.chatModel != null ? this.chatModel.getClass().getSimpleName() : "missing");
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public LlmResponse chat(LlmRequest request, CancellationToken cancellation) {
        if (chatModel == null) {
            throw new LlmException("No chat model configured; set spring.ai.model.chat and the provider API key");
        }
        if (cancellation != null && cancellation.isCancelled()) {
            throw new LlmException("request cancelled before the model call");
        }

        Prompt prompt = buildPrompt(request);
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            throw new LlmException("Chat model call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmException("Chat model returned an empty response");
        }

        Generation generation = response.getResult();
        AssistantMessage output = generation.getOutput();
        String text = output.getText() != null ? output.getText() : "";

        List<LlmToolCall> calls = nativeToolCalls(output);
        String content = text;
        if (calls.isEmpty()) {
            calls = inlineParser.parse(text);
            if (!calls.isEmpty()) {
                content = inlineParser.strip(text);
            }
        }

        String finishReason = calls.isEmpty() ? LlmResponse.FINISH_END_TURN : LlmResponse.FINISH_TOOL_USE;
        TokenUsage usage = usageOf(response);
        log.debug("Chat model reply: providerFinish={}, tools={}, tokens={}",
                generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null,
                calls.size(), usage.totalTokens());
        return new LlmResponse(content, calls, finishReason, usage);
    }

    Prompt buildPrompt(LlmRequest request) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPrompt(request)));
        for (ChatMessage msg : request.messages()) {
            // an unknown or missing role is sent as user input
            String role = msg.role() != null ? msg.role() : ChatMessage.USER;
            switch (role) {
                case ChatMessage.SYSTEM -> messages.add(new SystemMessage(msg.content()));
                case ChatMessage.ASSISTANT -> messages.add(new AssistantMessage(msg.content()));
                default -> messages.add(new UserMessage(msg.content()));
            }
        }
        return new Prompt(messages);
    }

    private String systemPrompt(LlmRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a subagent running the skill '").append(request.skillName())
                .append("'. Complete the task autonomously and reply with the final answer when done.\n");
        List<Tool> visible = toolRegistry != null ? toolRegistry.visibleTo(request.allowedTools()) : List.of();
        if (visible.isEmpty()) {
            sb.append("No tools are available.");
            return sb.toString();
        }
        sb.append("To use a tool, reply with a block of the form ")
                .append(inlineParser.format("tool_name", Map.of("arg", "value")))
                .append(". Available tools:\n");
        for (Tool tool : visible) {
            sb.append("- ").append(tool.name()).append(": ").append(tool.description());
            if (tool.inputSchema() != null) {
                sb.append(" Input schema: ").append(tool.inputSchema());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private List<LlmToolCall> nativeToolCalls(AssistantMessage output) {
        if (!output.hasToolCalls()) return List.of();
        List<LlmToolCall> calls = new ArrayList<>();
        for (AssistantMessage.ToolCall call : output.getToolCalls()) {
            calls.add(new LlmToolCall(call.name(), parseArguments(call.name(), call.arguments())));
        }
        return calls;
    }

    private Map<String, Object> parseArguments(String toolName, String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return objectMapper.readValue(json, ARGS_TYPE);
        } catch (Exception e) {
            throw new LlmException("Malformed arguments for tool " + toolName + ": " + json, e);
        }
    }

    private static TokenUsage usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return TokenUsage.EMPTY;
        }
        Usage usage = response.getMetadata().getUsage();
        int prompt = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        int completion = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        Integer total = usage.getTotalTokens();
        return new TokenUsage(prompt, completion, total != null ? total : prompt + completion);
    }
}
