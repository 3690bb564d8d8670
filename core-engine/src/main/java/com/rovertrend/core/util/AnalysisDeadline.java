package com.rovertrend.core.util;

import java.util.concurrent.CancellationException;

/**
 * Cooperative wall-clock budget for the expensive analysis paths.
 *
 * <p>
 * Long loops call {@link #checkpoint(String)} between units of work. A
 * checkpoint throws {@link CancellationException} once the budget is spent or
 * the calling thread has been interrupted. The interrupt flag is left set.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisDeadline {

    private static final AnalysisDeadline NONE = new AnalysisDeadline(false, 0L);

    private final boolean bounded;
    private final long deadlineNanos;

    private AnalysisDeadline(boolean bounded, long deadlineNanos) {
        this.bounded = bounded;
        this.deadlineNanos = deadlineNanos;
    }

    /** @return a deadline that only reacts to thread interruption */
    public static AnalysisDeadline none() {
        return NONE;
    }

    /**
     * @param timeoutMillis budget from now; {@code 0} or less means unbounded
     */
    public static AnalysisDeadline afterMillis(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            return NONE;
        }
        return new AnalysisDeadline(true, System.nanoTime() + timeoutMillis * 1_000_000L);
    }

    public boolean isExpired() {
        return bounded && System.nanoTime() - deadlineNanos > 0;
    }

    /**
     * @param stage name of the work about to start, used in the exception message
     * @throws CancellationException if the deadline passed or the thread was interrupted
     */
    public void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Interrupted before " + stage);
        }
        if (isExpired()) {
            throw new CancellationException("Analysis deadline exceeded before " + stage);
        }
    }
}
