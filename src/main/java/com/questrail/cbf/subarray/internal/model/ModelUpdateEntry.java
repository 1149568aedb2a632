package com.questrail.cbf.subarray.internal.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One epoch-stamped entry of a model document.
 *
 * @param epoch   instant the entry must take effect
 * @param payload compact JSON forwarded unchanged to the fleet
 */
public record ModelUpdateEntry(Instant epoch, String payload)
{
    public ModelUpdateEntry {
        Objects.requireNonNull(epoch, "epoch");
        Objects.requireNonNull(payload, "payload");
    }
}
