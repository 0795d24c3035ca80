package io.github.drompincen.clawfork.runtime.agent;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cooperative cancellation signal with an optional deadline.
 * <p>
 * A token derived with {@link #withTimeout(Duration)} observes its parent: it
 * reports cancellation when the parent is cancelled and never outlives the
 * parent's deadline. Cancelling a child does not affect the parent. Nothing
 * is interrupted; holders poll {@link #isCancelled()} at safe points.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancellationRequested;

    private CancellationToken(CancellationToken parent, Instant deadline, Clock clock) {
        this.parent = parent;
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return create(Clock.systemUTC());
    }

    public static CancellationToken create(Clock clock) {
        return new CancellationToken(null, null, clock);
    }

    public CancellationToken withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Instant candidate = saturatingPlus(clock.instant(), timeout);
        Instant effective = deadline().filter(d -> d.isBefore(candidate)).orElse(candidate);
        return new CancellationToken(this, effective, clock);
    }

    private static Instant saturatingPlus(Instant base, Duration timeout) {
        try {
            return base.plus(timeout);
        } catch (ArithmeticException | DateTimeException e) {
            return Instant.MAX;
        }
    }

    public void cancel() {
        cancellationRequested = true;
    }

    /** True when this token or an ancestor was cancelled explicitly. */
    public boolean isCancellationRequested() {
        return cancellationRequested || (parent != null && parent.isCancellationRequested());
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isCancelled() {
        return isCancellationRequested() || isDeadlineExceeded();
    }

    public Optional<Instant> deadline() {
        if (deadline != null) return Optional.of(deadline);
        return parent != null ? parent.deadline() : Optional.empty();
    }

    public Optional<Duration> remaining() {
        return deadline().map(d -> {
            Duration left = Duration.between(clock.instant(), d);
            return left.isNegative() ? Duration.ZERO : left;
        });
    }
}
