package com.questrail.cbf.subarray.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly while driving the subarray.
 */
public record SubarrayErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
