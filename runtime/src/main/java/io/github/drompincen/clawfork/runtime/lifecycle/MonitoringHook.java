package io.github.drompincen.clawfork.runtime.lifecycle;

import io.github.drompincen.clawfork.protocol.api.SubagentStatus;

/**
 * Observer of subagent status changes. Runs synchronously on the thread that
 * made the transition, so implementations must be fast and must not block.
 */
@FunctionalInterface
public interface MonitoringHook {

    void onStatusChange(String subagentId, SubagentStatus status);
}
