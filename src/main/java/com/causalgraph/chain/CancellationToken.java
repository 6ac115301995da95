package com.causalgraph.chain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for path enumeration: checked between path expansions, never
 * interrupts a thread. Cancelled either explicitly or once its deadline passes.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, null);

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /** A token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken withTimeout(Clock clock, Duration timeout) {
        return new CancellationToken(clock, clock.instant().plus(timeout));
    }

    public static CancellationToken manual() {
        return new CancellationToken(null, null);
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        return deadline != null && clock.instant().isAfter(deadline);
    }
}
