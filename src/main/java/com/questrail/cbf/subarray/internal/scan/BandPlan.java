package com.questrail.cbf.subarray.internal.scan;

import com.questrail.cbf.api.FrequencyBand;

/**
 * Band plan arithmetic shared by validation, distribution and output-link
 * planning. All frequencies are in Hz unless the name says otherwise.
 */
public final class BandPlan
{
    public static final double FREQUENCY_SLICE_BANDWIDTH_HZ = 200e6;
    public static final double BAND5_STREAM_BANDWIDTH_HZ = 2.5e9;
    public static final double MAX_STREAM_OFFSET_HZ = FREQUENCY_SLICE_BANDWIDTH_HZ / 2;

    public static final int FINE_CHANNELS = 14880;
    public static final int CHANNEL_GROUPS = 20;
    public static final int CHANNELS_PER_GROUP = FINE_CHANNELS / CHANNEL_GROUPS;
    public static final int OUTPUT_LINKS = 80;
    public static final int MAX_ZOOM_FACTOR = 6;

    /** Frequency slices 1..13 of a band-5 variant come from stream 1, the rest from stream 2. */
    public static final int BAND5_STREAM1_SLICES = 13;

    static final double DELTA_F_HZ = 1800;

    private BandPlan() {}

    /**
     * Physical span of one frequency slice.
     */
    public record SliceSpan(double startHz, double stopHz) {
        public boolean contains(double hz) {
            return hz >= startHz && hz <= stopHz;
        }
    }

    /**
     * Computes the span of {@code sliceId} (1-based) for the common settings of a
     * configuration.
     */
    public static SliceSpan sliceSpan(CommonConfiguration common, int sliceId) {
        FrequencyBand band = common.band();
        double start;
        if (!band.isBand5()) {
            start = band.rangeStartGhz() * 1e9
                    + common.streamOffset1Hz()
                    + (sliceId - 1) * FREQUENCY_SLICE_BANDWIDTH_HZ;
        } else if (sliceId <= BAND5_STREAM1_SLICES) {
            start = common.band5Tuning().stream1Ghz() * 1e9
                    - BAND5_STREAM_BANDWIDTH_HZ / 2
                    + common.streamOffset1Hz()
                    + (sliceId - 1) * FREQUENCY_SLICE_BANDWIDTH_HZ;
        } else {
            start = common.band5Tuning().stream2Ghz() * 1e9
                    - BAND5_STREAM_BANDWIDTH_HZ / 2
                    + common.streamOffset2Hz()
                    + (sliceId - BAND5_STREAM1_SLICES - 1) * FREQUENCY_SLICE_BANDWIDTH_HZ;
        }
        return new SliceSpan(start, start + FREQUENCY_SLICE_BANDWIDTH_HZ);
    }

    /**
     * Sample rate of a receptor's digitiser in the given band.
     *
     * @param k the receptor's frequency offset index
     */
    public static long dishSampleRate(FrequencyBand band, int k) {
        return Math.round(band.baseDishSampleRateMhz() * 1e6 + band.sampleRateConstant() * k * DELTA_F_HZ);
    }

    /**
     * Sample rate of one frequency slice produced from a receptor's stream.
     */
    public static long frequencySliceSampleRate(FrequencyBand band, int k) {
        return (long) Math.floor(dishSampleRate(band, k) * 10.0 / 9.0 / band.totalFrequencySlices());
    }
}
