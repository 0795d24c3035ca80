package io.github.drompincen.clawfork.runtime.agent.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads tool requests that a model wrote into its text as
 * {@code <tool_call>{"name":"...","args":{...}}</tool_call>} blocks.
 */
public class InlineToolCallParser {

    private static final Logger log = LoggerFactory.getLogger(InlineToolCallParser.class);

    private static final Pattern TOOL_CALL_PATTERN =
            Pattern.compile("<tool_call>\\s*(\\{.*?\\})\\s*</tool_call>", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public InlineToolCallParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Malformed blocks and blocks without a name are skipped. */
    public List<LlmToolCall> parse(String text) {
        if (text == null) return List.of();
        List<LlmToolCall> calls = new ArrayList<>();
        Matcher matcher = TOOL_CALL_PATTERN.matcher(text);
        while (matcher.find()) {
            String json = matcher.group(1);
            try {
                JsonNode node = objectMapper.readTree(json);
                String name = node.path("name").asText(null);
                if (name == null || name.isBlank()) continue;
                JsonNode argsNode = node.path("args");
                Map<String, Object> args = argsNode.isObject()
                        ? objectMapper.convertValue(argsNode, ARGS_TYPE)
                        : Map.of();
                calls.add(new LlmToolCall(name, args));
            } catch (Exception e) {
                log.warn("Failed to parse tool call JSON: {}", json, e);
            }
        }
        return calls;
    }

    /** The text with every tool call block removed. */
    public String strip(String text) {
        if (text == null) return "";
        return TOOL_CALL_PATTERN.matcher(text).replaceAll("").trim();
    }

    public String format(String toolName, Map<String, Object> args) {
        try {
            return "<tool_call>" + objectMapper.writeValueAsString(
                    Map.of("name", toolName, "args", args != null ? args : Map.of())) + "</tool_call>";
        } catch (Exception e) {
            throw new LlmException("Cannot encode tool call for " + toolName, e);
        }
    }
}
