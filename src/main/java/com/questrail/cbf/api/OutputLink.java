package com.questrail.cbf.api;

import java.util.List;

/**
 * An output link and the channels it carries, in channel order.
 */
public record OutputLink(int linkId, List<OutputChannel> channels)
{
    public OutputLink {
        channels = List.copyOf(channels);
    }
}
