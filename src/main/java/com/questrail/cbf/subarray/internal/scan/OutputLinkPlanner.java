package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.cbf.api.FspOutputLinks;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.api.OutputChannel;
import com.questrail.cbf.api.OutputLink;
import com.questrail.cbf.api.OutputLinkDistribution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * OutputLinkPlanner
 * -----------------------------------------------------------------------------
 * Places the averaged output channels of every correlation node onto output
 * links.
 *
 * <p>The observed bandwidth of a node (one frequency slice, narrowed by the
 * zoom factor) is split into {@link BandPlan#CHANNEL_GROUPS} groups of
 * {@link BandPlan#CHANNELS_PER_GROUP} fine channels. A group with averaging
 * factor 0 is dropped; otherwise every {@code factor}-th fine channel opens an
 * averaged channel. Each averaged channel goes to one link picked from the
 * injected {@link Random}. The link choice carries no meaning; each surviving
 * channel lands on exactly one link and only links with channels are
 * reported.</p>
 */
public final class OutputLinkPlanner
{
    private final Random random;

    public OutputLinkPlanner(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public OutputLinkDistribution plan(ScanConfiguration configuration) {
        List<FspOutputLinks> fsps = new ArrayList<>();
        for (FspConfiguration fsp : configuration.fsps()) {
            if (fsp.mode() == FunctionMode.CORR) {
                fsps.add(planNode(configuration.common(), fsp));
            }
        }
        return new OutputLinkDistribution(configuration.common().configId(), fsps);
    }

    FspOutputLinks planNode(CommonConfiguration common, FspConfiguration fsp) {
        int zoom = fsp.zoomFactor();
        double bandwidth = BandPlan.FREQUENCY_SLICE_BANDWIDTH_HZ / (1 << zoom);
        double next = zoom == 0
                ? BandPlan.sliceSpan(common, fsp.frequencySliceId()).startHz()
                : fsp.zoomWindowTuningHz() - bandwidth / 2;

        int[] factors = averagingFactors(fsp.entry().get(ScanConfigKeys.CHANNEL_AVERAGING_MAP));
        Map<Integer, List<OutputChannel>> links = new TreeMap<>();

        for (int group = 0; group < BandPlan.CHANNEL_GROUPS; group++) {
            int factor = factors[group];
            if (factor == 0) {
                next += bandwidth / BandPlan.CHANNEL_GROUPS;
                continue;
            }
            double channelBandwidth = bandwidth / BandPlan.FINE_CHANNELS * factor;
            int first = group * BandPlan.CHANNELS_PER_GROUP + 1;
            int last = (group + 1) * BandPlan.CHANNELS_PER_GROUP;
            for (int channel = first; channel <= last; channel += factor) {
                OutputChannel out = new OutputChannel(channel, channelBandwidth, next + channelBandwidth / 2);
                int link = random.nextInt(BandPlan.OUTPUT_LINKS) + 1;
                links.computeIfAbsent(link, id -> new ArrayList<>()).add(out);
                next += channelBandwidth;
            }
        }

        List<OutputLink> result = new ArrayList<>(links.size());
        links.forEach((id, channels) -> result.add(new OutputLink(id, channels)));
        return new FspOutputLinks(fsp.fspId(), result);
    }

    /**
     * Per-group averaging factors; groups missing from the map average by 1.
     */
    private static int[] averagingFactors(JsonNode map) {
        int[] factors = new int[BandPlan.CHANNEL_GROUPS];
        Arrays.fill(factors, 1);
        if (map != null && map.isArray()) {
            for (int i = 0; i < map.size() && i < factors.length; i++) {
                factors[i] = map.get(i).get(1).asInt();
            }
        }
        return factors;
    }
}
