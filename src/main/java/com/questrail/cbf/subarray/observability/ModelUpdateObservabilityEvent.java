package com.questrail.cbf.subarray.observability;

import com.questrail.cbf.api.ModelType;

import java.time.Instant;

/**
 * Record representing what happened to a model document or one of its entries.
 *
 * @param epoch the entry's epoch, or {@code null} for document-level outcomes
 */
public record ModelUpdateObservabilityEvent(
    Instant timestamp,
    ModelType type,
    Kind kind,
    Instant epoch,
    String detail
) {
    public enum Kind {
        ACCEPTED,
        DUPLICATE_DROPPED,
        REJECTED_BY_STATE,
        MALFORMED,
        APPLIED,
        FANOUT_FAILED,
        STALE_DROPPED,
        SKIPPED_BY_STATE
    }
}
