package io.github.drompincen.clawfork.runtime.fork;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.protocol.api.ResourceLimits;
import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.runtime.agent.SubagentValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextForkerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private final ContextForker forker = new ContextForker(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void forkCopiesParentState() {
        List<ChatMessage> history = List.of(ChatMessage.system("be brief"), ChatMessage.user("summarize"));

        SubagentContext ctx = forker.fork("parent-1", history, "summarizer", List.of("current_time"),
                ResourceLimits.defaults());

        assertThat(ctx.id()).startsWith("subagent-");
        assertThat(ctx.parentContextId()).isEqualTo("parent-1");
        assertThat(ctx.skillName()).isEqualTo("summarizer");
        assertThat(ctx.conversationHistory()).containsExactlyElementsOf(history);
        assertThat(ctx.allowedTools()).containsExactly("current_time");
        assertThat(ctx.createdAt()).isEqualTo(NOW);
        assertThat(ctx.metadata()).isEmpty();
    }

    @Test
    void laterParentMutationIsNotObserved() {
        List<ChatMessage> history = new ArrayList<>(List.of(ChatMessage.user("one")));
        List<String> tools = new ArrayList<>(List.of("a"));

        SubagentContext ctx = forker.fork("p", history, "s", tools, ResourceLimits.defaults());
        history.add(ChatMessage.user("two"));
        tools.add("b");

        assertThat(ctx.conversationHistory()).hasSize(1);
        assertThat(ctx.allowedTools()).containsExactly("a");
        assertThatThrownBy(() -> ctx.conversationHistory().add(ChatMessage.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullAllowlistStaysUnrestricted() {
        SubagentContext ctx = forker.fork("p", null, "s", null, ResourceLimits.defaults());

        assertThat(ctx.allowedTools()).isNull();
        assertThat(ctx.conversationHistory()).isEmpty();
        assertThat(ctx.isToolAllowed("anything")).isTrue();
    }

    @Test
    void emptyAllowlistStaysEmpty() {
        SubagentContext ctx = forker.fork("p", List.of(), "s", List.of(), ResourceLimits.defaults());

        assertThat(ctx.allowedTools()).isEmpty();
        assertThat(ctx.isToolAllowed("anything")).isFalse();
    }

    @Test
    void metadataIsCopied() {
        SubagentContext ctx = forker.fork("p", List.of(), "s", null, ResourceLimits.defaults(),
                Map.of("origin", "test"));

        assertThat(ctx.metadata()).containsEntry("origin", "test");
    }

    @Test
    void idsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(forker.fork("p", List.of(), "s", null, ResourceLimits.defaults()).id());
        }
        assertThat(ids).hasSize(1000);
    }

    @Test
    void rejectsBlankParentOrSkill() {
        assertThatThrownBy(() -> forker.fork(" ", List.of(), "s", null, ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class)
                .hasMessageContaining("parent context ID");
        assertThatThrownBy(() -> forker.fork("p", List.of(), "", null, ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class)
                .hasMessageContaining("skill name");
    }

    @Test
    void rejectsInvalidLimits() {
        assertThatThrownBy(() -> forker.fork("p", List.of(), "s", null, null))
                .isInstanceOf(SubagentValidationException.class);
        assertThatThrownBy(() -> forker.fork("p", List.of(), "s", null,
                new ResourceLimits(10, 1, Duration.ZERO)))
                .isInstanceOf(SubagentValidationException.class)
                .hasMessageContaining("timeout");
        assertThatThrownBy(() -> forker.fork("p", List.of(), "s", null,
                new ResourceLimits(-1, 1, Duration.ofSeconds(1))))
                .isInstanceOf(SubagentValidationException.class);
    }

    @Test
    void rejectsNullEntries() {
        assertThatThrownBy(() -> forker.fork("p", Arrays.asList(ChatMessage.user("a"), null), "s", null,
                ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class);
        assertThatThrownBy(() -> forker.fork("p", List.of(), "s", Arrays.asList("a", null),
                ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class);
    }

    @Test
    void rejectsMessagesWithoutRole() {
        assertThatThrownBy(() -> forker.fork("p", List.of(new ChatMessage(null, "x")), "s", null,
                ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class)
                .hasMessageContaining("without a role");
        assertThatThrownBy(() -> forker.fork("p", List.of(ChatMessage.user("a"), new ChatMessage(" ", "x")), "s",
                null, ResourceLimits.defaults()))
                .isInstanceOf(SubagentValidationException.class);
    }
}
