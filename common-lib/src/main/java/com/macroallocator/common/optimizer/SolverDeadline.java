package com.macroallocator.common.optimizer;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Time budget and cancellation flag shared by one optimization run.
 *
 * <p>Expiry is advisory: the exact solver gives up when it passes the budget, the
 * approximate solver ignores it. Cancellation is binding for every solver.
 */
public final class SolverDeadline {

    private final long deadlineNanos;
    private final boolean bounded;
    private volatile boolean cancelled;

    private SolverDeadline(long deadlineNanos, boolean bounded) {
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    public static SolverDeadline after(Duration budget) {
        return new SolverDeadline(System.nanoTime() + budget.toNanos(), true);
    }

    public static SolverDeadline unbounded() {
        return new SolverDeadline(0L, false);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() - deadlineNanos >= 0;
    }

    /** @throws CancellationException once {@link #cancel()} has been called */
    public void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("optimization cancelled");
        }
    }
}
