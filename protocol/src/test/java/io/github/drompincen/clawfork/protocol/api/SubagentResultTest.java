package io.github.drompincen.clawfork.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubagentResultTest {

    @Test
    void runningResultHasNoCompletionTime() {
        SubagentResult result = SubagentResult.running("s1");

        assertThat(result.status()).isEqualTo(SubagentStatus.RUNNING);
        assertThat(result.completedAt()).isNull();
        assertThat(result.stepResults()).isEmpty();
        result.validate();
    }

    @Test
    void withTerminalStatusStampsCompletion() {
        SubagentResult cancelled = SubagentResult.running("s1")
                .withStatus(SubagentStatus.CANCELLED, "cancelled by user");

        assertThat(cancelled.status()).isEqualTo(SubagentStatus.CANCELLED);
        assertThat(cancelled.errorMessage()).isEqualTo("cancelled by user");
        assertThat(cancelled.completedAt()).isNotNull();
    }

    @Test
    void errorResultRequiresMessage() {
        SubagentResult bad = SubagentResult.running("s1").withStatus(SubagentStatus.ERROR, null);

        assertThatThrownBy(bad::validate).hasMessageContaining("error message");
        SubagentResult.failed("s1", "boom").validate();
    }
}
