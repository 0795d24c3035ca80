package io.github.drompincen.clawfork.runtime.lifecycle;

import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;
import io.github.drompincen.clawfork.protocol.api.SubagentStatus;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracking entry for one subagent. Its own lock guards the current result,
 * so writers never need the manager's map to be locked. Every write goes
 * through a RUNNING check: once terminal, the result is never replaced.
 */
final class RunningSubagent {

    private final SubagentContext context;
    private final CancellationToken token;
    private final Instant startedAt;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private SubagentResult result;
    private Instant finishedAt;

    RunningSubagent(SubagentContext context, CancellationToken token, Instant startedAt) {
        this.context = context;
        this.token = token;
        this.startedAt = startedAt;
        this.result = SubagentResult.running(context.id());
    }

    SubagentContext context() { return context; }

    CancellationToken token() { return token; }

    Instant startedAt() { return startedAt; }

    SubagentResult snapshot() {
        lock.readLock().lock();
        try {
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isRunning() {
        return snapshot().status() == SubagentStatus.RUNNING;
    }

    /**
     * Replaces the RUNNING result with a terminal one; false if already terminal.
     * {@code at} is the manager's clock reading, used for eviction.
     */
    boolean completeIfRunning(SubagentResult terminal, Instant at) {
        lock.writeLock().lock();
        try {
            if (result.status() != SubagentStatus.RUNNING) return false;
            result = terminal;
            finishedAt = at;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean cancelIfRunning(String reason, Instant at) {
        token.cancel();
        lock.writeLock().lock();
        try {
            if (result.status() != SubagentStatus.RUNNING) return false;
            result = result.withStatus(SubagentStatus.CANCELLED, reason, at);
            finishedAt = at;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    boolean isFinishedBefore(Instant cutoff) {
        lock.readLock().lock();
        try {
            return finishedAt != null && finishedAt.isBefore(cutoff);
        } finally {
            lock.readLock().unlock();
        }
    }
}
