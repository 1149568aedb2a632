package com.questrail.cbf.api;

import java.util.List;
import java.util.Objects;

/**
 * Output-link placement of the active configuration. Empty when the subarray
 * is not configured.
 */
public record OutputLinkDistribution(String configId, List<FspOutputLinks> fsps)
{
    private static final OutputLinkDistribution EMPTY = new OutputLinkDistribution("", List.of());

    public OutputLinkDistribution {
        Objects.requireNonNull(configId, "configId");
        fsps = List.copyOf(fsps);
    }

    public static OutputLinkDistribution empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return fsps.isEmpty();
    }
}
