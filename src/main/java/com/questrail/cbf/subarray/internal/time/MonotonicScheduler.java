package com.questrail.cbf.subarray.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred-execution surface used by the model-update dispatchers.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are monotonic ticks from a {@link MonotonicClock}, never wall-clock
 * instants. A task whose deadline has already passed runs as soon as possible.
 */
public interface MonotonicScheduler
{
    /**
     * Runs {@code task} at or after {@code deadlineNanos}.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Runs {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
