package com.questrail.cbf.subarray.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a wake-up armed on a {@link MonotonicScheduler}.
 *
 * <p>The model-update dispatchers re-arm their wake-up whenever an entry with
 * an earlier epoch arrives, cancelling the previous one through this handle.</p>
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task was cancelled before it ran;
     *         {@code false} if it already ran or was cancelled earlier
     */
    boolean cancel();
}
