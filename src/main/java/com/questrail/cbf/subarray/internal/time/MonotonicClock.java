package com.questrail.cbf.subarray.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for all operational waiting.
 *
 * <h2>Binding invariant</h2>
 * Wake-up deadlines are always expressed in this clock's ticks. Epochs carried
 * by model documents are absolute wall-clock instants; they are converted to a
 * monotonic deadline once, when the entry is accepted, using the offset between
 * {@link WallClock} and this clock at that moment.
 */
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds. Only differences between values are meaningful.
     */
    long nowNanos();
}
