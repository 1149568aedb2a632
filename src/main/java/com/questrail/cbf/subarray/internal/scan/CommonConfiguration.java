package com.questrail.cbf.subarray.internal.scan;

import com.questrail.cbf.api.FrequencyBand;

import java.util.Objects;

/**
 * Resolved common section of a validated scan configuration.
 */
public record CommonConfiguration(String configId,
                                  int subarrayId,
                                  FrequencyBand band,
                                  Band5Tuning band5Tuning,
                                  long streamOffset1Hz,
                                  long streamOffset2Hz)
{
    public CommonConfiguration {
        Objects.requireNonNull(configId, "configId");
        Objects.requireNonNull(band, "band");
        Objects.requireNonNull(band5Tuning, "band5Tuning");
    }
}
