package io.github.drompincen.clawfork.runtime.lifecycle;

import io.github.drompincen.clawfork.protocol.api.SubagentContext;
import io.github.drompincen.clawfork.protocol.api.SubagentResult;
import io.github.drompincen.clawfork.protocol.api.SubagentStatus;
import io.github.drompincen.clawfork.runtime.agent.CancellationToken;
import io.github.drompincen.clawfork.runtime.agent.SubagentCapacityException;
import io.github.drompincen.clawfork.runtime.agent.SubagentConflictException;
import io.github.drompincen.clawfork.runtime.agent.SubagentExecutor;
import io.github.drompincen.clawfork.runtime.agent.SubagentNotFoundException;
import io.github.drompincen.clawfork.runtime.agent.SubagentValidationException;
import io.github.drompincen.clawfork.runtime.config.SubagentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Supervises concurrently running subagents, keyed by context id.
 * <p>
 * {@link #start} returns as soon as the entry is registered; the executor
 * runs on a pooled background thread. Status changes are one-way: the first
 * writer to move an entry out of RUNNING wins, whether that is the
 * background run, {@link #cancel} or a rejected submission.
 */
@Service
public class SubagentLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(SubagentLifecycleManager.class);
    static final String CANCELLED_BY_USER = "cancelled by user";

    private final SubagentExecutor executor;
    private final ExecutorService workers;
    private final int maxConcurrent;
    private final Duration defaultShutdownTimeout;
    private final Duration pollInterval;
    private final Clock clock;
    private final ConcurrentHashMap<String, RunningSubagent> running = new ConcurrentHashMap<>();
    private final AtomicInteger activeCount = new AtomicInteger();
    private volatile MonitoringHook monitoringHook;
    private volatile boolean shuttingDown;

    public SubagentLifecycleManager(SubagentExecutor executor) {
        this(executor, new SubagentProperties());
    }

    @Autowired
    public SubagentLifecycleManager(SubagentExecutor executor, SubagentProperties properties) {
        this(executor, properties, newWorkerPool(), Clock.systemUTC());
    }

    public SubagentLifecycleManager(SubagentExecutor executor, SubagentProperties properties,
                                    ExecutorService workers, Clock clock) {
        this.executor = executor;
        this.workers = workers;
        this.maxConcurrent = properties.getMaxConcurrent();
        this.defaultShutdownTimeout = properties.getShutdownTimeout();
        this.pollInterval = properties.getShutdownPollInterval();
        this.clock = clock;
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "subagent-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void start(SubagentContext context) {
        start(CancellationToken.create(clock), context);
    }

    public void start(CancellationToken parent, SubagentContext context) {
        if (context == null) {
            throw new SubagentValidationException("subagent context is required");
        }
        try {
            context.validate();
        } catch (IllegalArgumentException e) {
            throw new SubagentValidationException("invalid subagent context: " + e.getMessage(), e);
        }
        if (shuttingDown) {
            throw new SubagentCapacityException("lifecycle manager is shutting down");
        }
        String id = context.id();
        if (running.containsKey(id)) {
            throw new SubagentConflictException(id);
        }
        CancellationToken base = parent != null ? parent : CancellationToken.create(clock);
        CancellationToken token;
        try {
            token = base.withTimeout(context.resourceLimits().timeout());
        } catch (IllegalArgumentException e) {
            throw new SubagentValidationException("invalid subagent context: " + e.getMessage(), e);
        }
        RunningSubagent entry = new RunningSubagent(context, token, clock.instant());

        // from here on every exit path releases the slot
        reserveSlot(id);
        if (running.putIfAbsent(id, entry) != null) {
            releaseSlot();
            throw new SubagentConflictException(id);
        }

        log.info("Started subagent {} (skill={}, parent={}, timeout={})",
                id, context.skillName(), context.parentContextId(), context.resourceLimits().timeout());
        fireHook(id, SubagentStatus.RUNNING);

        try {
            workers.execute(() -> runInBackground(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected subagent {}", id);
            finish(entry, SubagentResult.failed(id, "execution rejected: " + e.getMessage(), clock.instant()));
            running.remove(id, entry);
            releaseSlot();
            throw new SubagentCapacityException("no worker available for subagent " + id, e);
        }
    }

    private void reserveSlot(String id) {
        if (maxConcurrent <= 0) {
            activeCount.incrementAndGet();
            return;
        }
        if (activeCount.incrementAndGet() > maxConcurrent) {
            activeCount.decrementAndGet();
            log.warn("Rejected subagent {}: {} already running", id, maxConcurrent);
            throw new SubagentCapacityException(
                    "concurrency limit reached (" + maxConcurrent + " running subagents)");
        }
    }

    private void releaseSlot() {
        activeCount.decrementAndGet();
    }

    /** Holds its concurrency slot until the worker returns, even after a cancel. */
    private void runInBackground(RunningSubagent entry) {
        String id = entry.context().id();
        try {
            SubagentResult result;
            try {
                result = executor.execute(entry.context(), entry.token());
                if (result == null) {
                    result = SubagentResult.failed(id, "executor returned no result", clock.instant());
                } else if (!result.status().isTerminal()) {
                    result = result.withStatus(SubagentStatus.ERROR,
                            "executor returned non-terminal status " + result.status(), clock.instant());
                }
            } catch (RuntimeException e) {
                log.error("Subagent {} executor failed", id, e);
                result = SubagentResult.failed(id,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                        clock.instant());
            }

            if (!finish(entry, result)) {
                log.debug("Subagent {} already {}; discarding late {} result",
                        id, entry.snapshot().status(), result.status());
            }
        } finally {
            releaseSlot();
        }
    }

    private boolean finish(RunningSubagent entry, SubagentResult terminal) {
        if (!entry.completeIfRunning(terminal, clock.instant())) return false;
        log.info("Subagent {} finished: {}", entry.context().id(), terminal.status());
        fireHook(entry.context().id(), terminal.status());
        return true;
    }

    public void cancel(String subagentId) {
        RunningSubagent entry = lookup(subagentId);
        if (entry.cancelIfRunning(CANCELLED_BY_USER, clock.instant())) {
            log.info("Cancelled subagent {}", subagentId);
            fireHook(subagentId, SubagentStatus.CANCELLED);
        } else {
            log.debug("Cancel ignored for subagent {}: already {}", subagentId, entry.snapshot().status());
        }
    }

    public SubagentResult getStatus(String subagentId) {
        return lookup(subagentId).snapshot();
    }

    public List<String> listRunning() {
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, RunningSubagent> e : running.entrySet()) {
            if (e.getValue().isRunning()) {
                ids.add(e.getKey());
            }
        }
        return ids;
    }

    public void setMonitoringHook(MonitoringHook hook) {
        this.monitoringHook = hook;
    }

    /**
     * Drops finished entries whose completion is older than {@code retention}.
     * Running entries are never evicted.
     *
     * @return number of entries removed
     */
    public int evictFinished(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (Map.Entry<String, RunningSubagent> e : running.entrySet()) {
            if (e.getValue().isFinishedBefore(cutoff) && running.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted {} finished subagent(s)", removed);
        }
        return removed;
    }

    public int trackedCount() {
        return running.size();
    }

    public void shutdown() {
        shutdown(defaultShutdownTimeout);
    }

    public void shutdown(Duration timeout) {
        shutdown(CancellationToken.create(clock).withTimeout(timeout));
    }

    /**
     * Cancels every running subagent, then polls until none reports RUNNING.
     * Uses the token's deadline, or the configured default when it has none.
     * Background threads are not joined; a run blocked in an external call
     * keeps its thread until that call returns.
     *
     * @throws SubagentShutdownTimeoutException if subagents are still running
     *         when the deadline passes or the token is cancelled
     */
    public void shutdown(CancellationToken cancellation) {
        shuttingDown = true;
        List<String> ids = listRunning();
        log.info("Shutting down lifecycle manager; cancelling {} running subagent(s)", ids.size());
        cancelAll(ids);

        Instant deadline = cancellation.deadline()
                .orElseGet(() -> clock.instant().plus(defaultShutdownTimeout));
        while (true) {
            List<String> remaining = listRunning();
            // a start that raced the first snapshot
            cancelAll(remaining);
            remaining = listRunning();
            if (remaining.isEmpty()) {
                workers.shutdown();
                log.info("Lifecycle manager drained");
                return;
            }
            if (cancellation.isCancellationRequested()) {
                throw new SubagentShutdownTimeoutException("shutdown cancelled", remaining);
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("Shutdown timed out with {} subagent(s) still running", remaining.size());
                throw new SubagentShutdownTimeoutException(
                        "shutdown timeout: some subagents still running", remaining);
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SubagentShutdownTimeoutException("shutdown interrupted", remaining, e);
            }
        }
    }

    private void cancelAll(List<String> ids) {
        for (String id : ids) {
            try {
                cancel(id);
            } catch (SubagentNotFoundException e) {
                log.debug("Subagent {} vanished during shutdown", id);
            }
        }
    }

    private RunningSubagent lookup(String subagentId) {
        RunningSubagent entry = subagentId != null ? running.get(subagentId) : null;
        if (entry == null) {
            throw new SubagentNotFoundException(subagentId);
        }
        return entry;
    }

    private void fireHook(String subagentId, SubagentStatus status) {
        MonitoringHook hook = monitoringHook;
        if (hook == null) return;
        try {
            hook.onStatusChange(subagentId, status);
        } catch (RuntimeException e) {
            log.warn("Monitoring hook failed for {} ({}): {}", subagentId, status, e.getMessage());
        }
    }
}
