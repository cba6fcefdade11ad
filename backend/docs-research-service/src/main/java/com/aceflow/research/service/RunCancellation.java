package com.aceflow.research.service;

import com.aceflow.research.entity.FetchFailureReason;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation handle of one pipeline run.
 *
 * A run stops either because someone called {@link #cancel()} or because its deadline passed.
 * Stages poll {@link #isCancelled()} between units of work; in-flight fetches are aborted by the fetcher.
 */
public class RunCancellation {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<FetchFailureReason> reason = new AtomicReference<>();

    private RunCancellation(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static RunCancellation withTimeout(Duration timeout, Clock clock) {
        return new RunCancellation(clock, clock.instant().plus(timeout));
    }

    public static RunCancellation none(Clock clock) {
        return new RunCancellation(clock, null);
    }

    public void cancel() {
        reason.compareAndSet(null, FetchFailureReason.CANCELLED);
    }

    public boolean isCancelled() {
        if (reason.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            reason.compareAndSet(null, FetchFailureReason.RUN_DEADLINE);
            return true;
        }
        return false;
    }

    /**
     * CANCELLED or RUN_DEADLINE once {@link #isCancelled()} is true, otherwise null.
     */
    public FetchFailureReason reason() {
        return isCancelled() ? reason.get() : null;
    }
}
