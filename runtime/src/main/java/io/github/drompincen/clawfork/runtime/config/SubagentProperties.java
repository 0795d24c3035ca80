package io.github.drompincen.clawfork.runtime.config;

import io.github.drompincen.clawfork.protocol.api.ResourceLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "clawfork.subagent")
public class SubagentProperties {

    /** Hard ceiling on loop iterations per subagent, independent of budgets. */
    private int maxIterations = 50;

    /**
     * Worker runs allowed at once; 0 means unbounded. A cancelled run holds
     * its slot until its thread returns from the executor.
     */
    private int maxConcurrent = 0;

    private Duration shutdownTimeout = Duration.ofSeconds(5);

    private Duration shutdownPollInterval = Duration.ofMillis(50);

    /** How long finished entries stay queryable before the reaper drops them. */
    private Duration retention = Duration.ofMinutes(10);

    private final Limits defaultLimits = new Limits();

    public int getMaxIterations() { return maxIterations; }
    public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }

    public int getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }

    public Duration getShutdownPollInterval() { return shutdownPollInterval; }
    public void setShutdownPollInterval(Duration shutdownPollInterval) { this.shutdownPollInterval = shutdownPollInterval; }

    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }

    public Limits getDefaultLimits() { return defaultLimits; }

    public static class Limits {

        private int maxTokens = ResourceLimits.DEFAULT_MAX_TOKENS;
        private int maxToolCalls = ResourceLimits.DEFAULT_MAX_TOOL_CALLS;
        private Duration timeout = ResourceLimits.DEFAULT_TIMEOUT;

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public ResourceLimits toResourceLimits() {
            return new ResourceLimits(maxTokens, maxToolCalls, timeout);
        }
    }
}
