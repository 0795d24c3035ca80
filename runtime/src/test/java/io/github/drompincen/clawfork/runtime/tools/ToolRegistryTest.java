package io.github.drompincen.clawfork.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
    }

    private static Tool tool(String name, ToolResult result) {
        return new Tool() {
            @Override public String name() { return name; }
            @Override public String description() { return "test tool " + name; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return result; }
        };
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(tool("test_tool", ToolResult.success(null)));

        assertThat(registry.get("test_tool")).isPresent();
        assertThat(registry.get("nonexistent")).isEmpty();
        assertThat(registry.all()).hasSize(1);
    }

    @Test
    void loadsBuiltinToolsThroughServiceLoader() {
        registry.loadTools();

        assertThat(registry.get("current_time")).isPresent();
    }

    @Test
    void serviceLoaderDoesNotShadowRegisteredTool() {
        Tool custom = tool("current_time", ToolResult.success(TextNode.valueOf("noon")));
        registry.register(custom);

        registry.loadTools();

        assertThat(registry.get("current_time")).containsSame(custom);
    }

    @Test
    void visibleToHonoursAllowlist() {
        registry.register(tool("b", ToolResult.success(null)));
        registry.register(tool("a", ToolResult.success(null)));

        assertThat(registry.visibleTo(null)).extracting(Tool::name).containsExactly("a", "b");
        assertThat(registry.visibleTo(List.of())).isEmpty();
        assertThat(registry.visibleTo(List.of("b"))).extracting(Tool::name).containsExactly("b");
    }

    @Test
    void executeReturnsTextualOutput() {
        registry.register(tool("echo", ToolResult.success(TextNode.valueOf("hello"))));

        String out = registry.execute(CancellationToken.create(), "echo", Map.of("x", 1));

        assertThat(out).isEqualTo("hello");
    }

    @Test
    void executeWithoutOutputReturnsOk() {
        registry.register(tool("noop", ToolResult.success(null)));

        assertThat(registry.execute(CancellationToken.create(), "noop", null)).isEqualTo("OK");
    }

    @Test
    void executePassesArgumentsAsJson() {
        registry.register(new Tool() {
            @Override public String name() { return "args"; }
            @Override public String description() { return "echoes args"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                return ToolResult.success(input);
            }
        });

        String out = registry.execute(CancellationToken.create(), "args", Map.of("q", "x"));

        assertThat(out).isEqualTo("{\"q\":\"x\"}");
    }

    @Test
    void unknownToolFails() {
        assertThatThrownBy(() -> registry.execute(CancellationToken.create(), "missing", Map.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("Tool not found: missing");
    }

    @Test
    void failedResultBecomesException() {
        registry.register(tool("broken", ToolResult.failure("disk full")));

        assertThatThrownBy(() -> registry.execute(CancellationToken.create(), "broken", Map.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("disk full");
    }

    @Test
    void throwingToolIsWrapped() {
        registry.register(new Tool() {
            @Override public String name() { return "boom"; }
            @Override public String description() { return "throws"; }
            @Override public JsonNode inputSchema() { return null; }
            @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
                throw new IllegalStateException("kaboom");
            }
        });

        assertThatThrownBy(() -> registry.execute(CancellationToken.create(), "boom", Map.of()))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageContaining("kaboom")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
