package com.questrail.cbf.api;

import java.util.List;

/**
 * Non-empty output links of one correlation node, sorted by link id.
 */
public record FspOutputLinks(int fspId, List<OutputLink> links)
{
    public FspOutputLinks {
        links = List.copyOf(links);
    }

    public int channelCount() {
        return links.stream().mapToInt(l -> l.channels().size()).sum();
    }
}
