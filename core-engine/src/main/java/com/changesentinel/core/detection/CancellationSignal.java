package com.changesentinel.core.detection;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag checked by long-running loops between
 * iterations. A signal fires either when {@link #cancel()} is called or when
 * its optional deadline passes.
 *
 * <p>
 * Work that observes a fired signal throws {@link CancellationException} and
 * discards its partial results.
 * </p>
 *
 * @since 1.0.0
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(Long.MAX_VALUE, false);

    private final long deadlineNanos;
    private final boolean hasDeadline;
    private volatile boolean cancelled;

    private CancellationSignal(long deadlineNanos, boolean hasDeadline) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    /**
     * @return a signal that can be cancelled manually
     */
    public static CancellationSignal create() {
        return new CancellationSignal(Long.MAX_VALUE, false);
    }

    /**
     * @param budget wall-clock budget from now
     * @return a signal that fires once {@code budget} has elapsed
     */
    public static CancellationSignal withDeadline(Duration budget) {
        Objects.requireNonNull(budget, "budget must not be null");
        return new CancellationSignal(System.nanoTime() + budget.toNanos(), true);
    }

    /**
     * @return a shared signal that never fires
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op signal cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (hasDeadline && System.nanoTime() - deadlineNanos > 0);
    }

    /**
     * @param what short description of the interrupted work, used in the
     *             exception message
     * @throws CancellationException if the signal has fired
     */
    public void throwIfCancelled(String what) {
        if (isCancelled()) {
            throw new CancellationException(what + " cancelled");
        }
    }
}
