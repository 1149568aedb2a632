package com.questrail.cbf.api;

import java.util.Optional;

/**
 * FrequencyBand
 * -----------------------------------------------------------------------------
 * The six receiver bands a subarray can observe in, with the band plan figures
 * the orchestrator needs for validation and sample-rate derivation.
 *
 * <p>Bands 1 to 4 have a fixed observed range. Bands 5a and 5b are observed as
 * two 2.5 GHz streams whose centres are set per scan by the band-5 tuning pair;
 * for these bands {@link #rangeStartGhz()}/{@link #rangeStopGhz()} are the
 * permitted tuning bounds instead.</p>
 */
public enum FrequencyBand
{
    BAND_1("1", 0, 0.35, 1.05, 4, 3960, 1.0, 20, 18),
    BAND_2("2", 1, 0.95, 1.76, 5, 3960, 1.0, 20, 18),
    BAND_3("3", 2, 1.65, 3.05, 7, 3168, 0.8, 20, 18),
    BAND_4("4", 3, 2.80, 5.18, 12, 5940, 1.5, 30, 27),
    BAND_5A("5a", 4, 5.85, 7.25, 26, 5940, 1.5, 60, 27),
    BAND_5B("5b", 5, 9.55, 14.05, 26, 5940, 1.5, 60, 27);

    private final String wireName;
    private final int index;
    private final double rangeStartGhz;
    private final double rangeStopGhz;
    private final int frequencySliceCount;
    private final int baseDishSampleRateMhz;
    private final double sampleRateConstant;
    private final int totalFrequencySlices;
    private final int samplesPerFrame;

    FrequencyBand(String wireName,
                  int index,
                  double rangeStartGhz,
                  double rangeStopGhz,
                  int frequencySliceCount,
                  int baseDishSampleRateMhz,
                  double sampleRateConstant,
                  int totalFrequencySlices,
                  int samplesPerFrame) {
        this.wireName = wireName;
        this.index = index;
        this.rangeStartGhz = rangeStartGhz;
        this.rangeStopGhz = rangeStopGhz;
        this.frequencySliceCount = frequencySliceCount;
        this.baseDishSampleRateMhz = baseDishSampleRateMhz;
        this.sampleRateConstant = sampleRateConstant;
        this.totalFrequencySlices = totalFrequencySlices;
        this.samplesPerFrame = samplesPerFrame;
    }

    public String wireName() {
        return wireName;
    }

    /** Zero-based band index as reported by the {@code frequencyBand} attribute. */
    public int index() {
        return index;
    }

    public boolean isBand5() {
        return this == BAND_5A || this == BAND_5B;
    }

    public double rangeStartGhz() {
        return rangeStartGhz;
    }

    public double rangeStopGhz() {
        return rangeStopGhz;
    }

    /** Number of frequency slices that can be selected in this band. */
    public int frequencySliceCount() {
        return frequencySliceCount;
    }

    public int baseDishSampleRateMhz() {
        return baseDishSampleRateMhz;
    }

    public double sampleRateConstant() {
        return sampleRateConstant;
    }

    /** Number of frequency slices the channeliser produces over the whole band. */
    public int totalFrequencySlices() {
        return totalFrequencySlices;
    }

    public int samplesPerFrame() {
        return samplesPerFrame;
    }

    public static Optional<FrequencyBand> fromWireName(String name) {
        for (FrequencyBand band : values()) {
            if (band.wireName.equals(name)) {
                return Optional.of(band);
            }
        }
        return Optional.empty();
    }
}
