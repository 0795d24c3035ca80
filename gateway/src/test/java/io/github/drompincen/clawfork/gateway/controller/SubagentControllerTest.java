package io.github.drompincen.clawfork.gateway.controller;

import io.github.drompincen.clawfork.protocol.api.ChatMessage;
import io.github.drompincen.clawfork.protocol.api.StartSubagentRequest;
import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;
import io.github.drompincen.clawfork.protocol.api.SubagentStatus;
import io.github.drompincen.clawfork.runtime.agent.SubagentCapacityException;
import io.github.drompincen.clawfork.runtime.agent.SubagentConflictException;
import io.github.drompincen.clawfork.runtime.agent.SubagentNotFoundException;
import io.github.drompincen.clawfork.runtime.agent.SubagentValidationException;
import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import io.github.drompincen.clawfork.runtime.fork.ContextForker;
import io.github.drompincen.clawfork.runtime.lifecycle.SubagentLifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubagentControllerTest {

    @Mock
    private SubagentLifecycleManager manager;

    private SubagentProperties properties;
    private SubagentController controller;

    @BeforeEach
    void setUp() {
        properties = new SubagentProperties();
        controller = new SubagentController(new ContextForker(), manager, properties);
    }

    private static StartSubagentRequest request(Integer maxTokens, Long timeoutSeconds) {
        return new StartSubagentRequest("parent-1", "research",
                List.of(ChatMessage.user("look this up")), List.of("current_time"),
                maxTokens, null, timeoutSeconds, Map.of("origin", "api"));
    }

    @Test
    void startForksAndReturnsAccepted() {
        when(manager.getStatus(anyString())).thenAnswer(inv -> SubagentResult.running(inv.getArgument(0)));

        ResponseEntity<SubagentResult> response = controller.start(request(500, 30L));

        assertThat(response.getStatusCode().value()).isEqualTo(202);
        assertThat(response.getBody().status()).isEqualTo(SubagentStatus.RUNNING);

        ArgumentCaptor<SubagentContext> captor = ArgumentCaptor.forClass(SubagentContext.class);
        verify(manager).start(captor.capture());
        SubagentContext ctx = captor.getValue();
        assertThat(response.getBody().subagentId()).isEqualTo(ctx.id());
        assertThat(ctx.parentContextId()).isEqualTo("parent-1");
        assertThat(ctx.allowedTools()).containsExactly("current_time");
        assertThat(ctx.resourceLimits().maxTokens()).isEqualTo(500);
        assertThat(ctx.resourceLimits().timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(ctx.metadata()).containsEntry("origin", "api");
    }

    @Test
    void missingBudgetFieldsUseConfiguredDefaults() {
        properties.getDefaultLimits().setMaxToolCalls(7);
        when(manager.getStatus(anyString())).thenAnswer(inv -> SubagentResult.running(inv.getArgument(0)));

        controller.start(request(null, null));

        ArgumentCaptor<SubagentContext> captor = ArgumentCaptor.forClass(SubagentContext.class);
        verify(manager).start(captor.capture());
        assertThat(captor.getValue().resourceLimits().maxTokens()).isEqualTo(100_000);
        assertThat(captor.getValue().resourceLimits().maxToolCalls()).isEqualTo(7);
        assertThat(captor.getValue().resourceLimits().timeout()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void invalidRequestNeverReachesManager() {
        StartSubagentRequest bad = new StartSubagentRequest("", "research", List.of(), null,
                null, null, null, null);

        assertThatThrownBy(() -> controller.start(bad)).isInstanceOf(SubagentValidationException.class);
        verify(manager, never()).start(org.mockito.ArgumentMatchers.any(SubagentContext.class));
    }

    @Test
    void getReturnsCurrentResult() {
        when(manager.getStatus("s1")).thenReturn(SubagentResult.running("s1"));

        assertThat(controller.get("s1").getBody().subagentId()).isEqualTo("s1");
    }

    @Test
    void cancelReturnsUpdatedResult() {
        when(manager.getStatus("s1"))
                .thenReturn(SubagentResult.running("s1").withStatus(SubagentStatus.CANCELLED, "cancelled by user"));

        ResponseEntity<SubagentResult> response = controller.cancel("s1");

        verify(manager).cancel("s1");
        assertThat(response.getBody().status()).isEqualTo(SubagentStatus.CANCELLED);
    }

    @Test
    void listReturnsRunningIds() {
        when(manager.listRunning()).thenReturn(List.of("a", "b"));

        assertThat(controller.listRunning()).containsExactly("a", "b");
    }

    @Test
    void exceptionsMapToStatusCodes() {
        assertThat(controller.badRequest(new SubagentValidationException("bad")).getStatusCode().value())
                .isEqualTo(400);
        assertThat(controller.notFound(new SubagentNotFoundException("x")).getStatusCode().value())
                .isEqualTo(404);
        assertThat(controller.conflict(new SubagentConflictException("x")).getStatusCode().value())
                .isEqualTo(409);
        ResponseEntity<Map<String, String>> full = controller.unavailable(new SubagentCapacityException("full"));
        assertThat(full.getStatusCode().value()).isEqualTo(503);
        assertThat(full.getBody()).containsEntry("error", "full");
    }
}
