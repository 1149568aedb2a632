package com.questrail.cbf.subarray.internal.scan;

/**
 * Centre frequencies, in GHz, of the two band-5 streams. {@code (0, 0)} means
 * the streams are not tuned.
 */
public record Band5Tuning(double stream1Ghz, double stream2Ghz)
{
    public static final Band5Tuning UNTUNED = new Band5Tuning(0.0, 0.0);

    public boolean isUntuned() {
        return stream1Ghz == 0.0 && stream2Ghz == 0.0;
    }
}
