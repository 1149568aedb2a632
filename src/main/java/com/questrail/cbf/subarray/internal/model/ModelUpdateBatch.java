package com.questrail.cbf.subarray.internal.model;

import com.questrail.cbf.api.ModelType;

import java.util.List;
import java.util.Objects;

/**
 * Entries of one model document, in document order.
 */
public record ModelUpdateBatch(ModelType type, List<ModelUpdateEntry> entries)
{
    public ModelUpdateBatch {
        Objects.requireNonNull(type, "type");
        entries = List.copyOf(entries);
    }
}
