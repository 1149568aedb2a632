package com.questrail.cbf.subarray.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Absolute time source.
 *
 * <p>Used for event timestamps and to place model-update epochs, which are
 * absolute instants, on the monotonic timeline. It must not be used to measure
 * elapsed time.</p>
 */
public interface WallClock
{
    Instant now();
}
