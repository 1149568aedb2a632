package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.cbf.api.FunctionMode;

import java.util.Objects;

/**
 * One validated per-node entry: the target function-mode node, the mode it is
 * to be bound to, and the normalized entry as it appears in the document.
 *
 * <p>The entry node is shared with the enclosing document; callers that need
 * to add fields must work on a {@link ObjectNode#deepCopy() copy}.</p>
 */
public record FspConfiguration(int fspId, FunctionMode mode, ObjectNode entry)
{
    public FspConfiguration {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(entry, "entry");
    }

    public int frequencySliceId() {
        return entry.path(ScanConfigKeys.FREQUENCY_SLICE_ID).asInt(0);
    }

    public int zoomFactor() {
        return entry.path(ScanConfigKeys.ZOOM_FACTOR).asInt(0);
    }

    /** Zoom window centre in Hz; meaningful only when {@link #zoomFactor()} is positive. */
    public double zoomWindowTuningHz() {
        return entry.path(ScanConfigKeys.ZOOM_WINDOW_TUNING).asDouble() * 1e3;
    }
}
