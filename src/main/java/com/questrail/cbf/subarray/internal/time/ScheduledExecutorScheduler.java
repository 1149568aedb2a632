package com.questrail.cbf.subarray.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Absolute monotonic deadlines are turned into relative delays at scheduling
 * time using the supplied clock, which must be the same clock the callers use
 * to compute deadlines.</p>
 *
 * <h2>Threading</h2>
 * <p>With a pool of more than one thread, wake-ups of different model types run
 * concurrently. Each dispatcher serialises its own wake-ups.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>The executor is owned by the composition root, which shuts it down.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long now = clock.nowNanos();
        long delayNanos = 0;
        if (deadlineNanos > now) {
            delayNanos = deadlineNanos - now;
            if (delayNanos < 0) {
                delayNanos = Long.MAX_VALUE;
            }
        }
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // Never interrupt a fan-out that is already in progress.
        return () -> future.cancel(false);
    }
}
