package io.github.drompincen.clawfork.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-indexed tool catalog. Tools come from Spring beans and from
 * {@link ServiceLoader} providers. Explicit registrations replace a tool of
 * the same name; SPI providers never shadow one already registered.
 */
@Component
public class ToolRegistry implements ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public ToolRegistry() {
        this(new ObjectMapper());
    }

    public ToolRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Autowired
    public ToolRegistry(ObjectProvider<ObjectMapper> objectMapper, ObjectProvider<Tool> beanTools) {
        this(objectMapper.getIfAvailable(ObjectMapper::new));
        beanTools.orderedStream().forEach(this::register);
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            tools.putIfAbsent(tool.name(), tool);
        }
        log.info("Loaded {} tools (beans + SPI)", tools.size());
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /** Tools visible under an allowlist: null means all, empty means none. */
    public List<Tool> visibleTo(List<String> allowedTools) {
        return tools.values().stream()
                .filter(t -> allowedTools == null || allowedTools.contains(t.name()))
                .sorted(Comparator.comparing(Tool::name))
                .toList();
    }

    @Override
    public String execute(CancellationToken cancellation, String toolName, Map<String, Object> args) {
        Tool tool = get(toolName)
                .orElseThrow(() -> new ToolExecutionException("Tool not found: " + toolName));

        JsonNode input = objectMapper.valueToTree(args != null ? args : Map.of());
        ToolResult result;
        try {
            result = tool.execute(new ToolContext(toolName, cancellation), input);
        } catch (RuntimeException e) {
            log.warn("Tool {} threw: {}", toolName, e.getMessage());
            throw new ToolExecutionException(toolName + " failed: " + e.getMessage(), e);
        }

        if (result == null) {
            throw new ToolExecutionException(toolName + " returned no result");
        }
        if (!result.success()) {
            throw new ToolExecutionException(result.error() != null ? result.error() : toolName + " failed");
        }
        JsonNode output = result.output();
        if (output == null || output.isNull()) return "OK";
        return output.isTextual() ? output.asText() : output.toString();
    }
}
