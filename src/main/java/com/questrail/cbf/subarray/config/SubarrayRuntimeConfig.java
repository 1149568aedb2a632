package com.questrail.cbf.subarray.config;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for one subarray's production runtime.
 *
 * @param subarrayId            subarray number, 1..16
 * @param vccCount              number of channel-input nodes in the fleet
 * @param fspCount              number of function-mode nodes in the fleet
 * @param receptors             receptor to VCC table
 * @param modelFeedBindAddress  local UDP address of the model-document feed, or {@code null} to disable it
 * @param schedulerThreads      worker threads for epoch-scheduled model fan-out
 */
public record SubarrayRuntimeConfig(
    int subarrayId,
    int vccCount,
    int fspCount,
    ReceptorMapping receptors,
    InetSocketAddress modelFeedBindAddress,
    int schedulerThreads
) {
    public static final int MAX_SUBARRAYS = 16;
    public static final int DEFAULT_VCC_COUNT = 197;
    public static final int DEFAULT_FSP_COUNT = 27;

    public SubarrayRuntimeConfig {
        if (subarrayId < 1 || subarrayId > MAX_SUBARRAYS) {
            throw new IllegalArgumentException("Subarray id must be 1-" + MAX_SUBARRAYS + ": " + subarrayId);
        }
        if (vccCount < 1 || fspCount < 1) {
            throw new IllegalArgumentException("Node counts must be positive");
        }
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("schedulerThreads must be >= 1");
        }
        Objects.requireNonNull(receptors, "receptors");
        for (int id : receptors.allReceptors()) {
            int vcc = receptors.resolve(id).orElseThrow().vccId();
            if (vcc > vccCount) {
                throw new IllegalArgumentException("Receptor " + id + " maps to VCC " + vcc
                        + " beyond vccCount " + vccCount);
            }
        }
    }

    public Optional<InetSocketAddress> modelFeed() {
        return Optional.ofNullable(modelFeedBindAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int subarrayId = 1;
        private int vccCount = DEFAULT_VCC_COUNT;
        private int fspCount = DEFAULT_FSP_COUNT;
        private ReceptorMapping receptors;
        private InetSocketAddress modelFeedBindAddress;
        private int schedulerThreads = 2;

        public Builder withSubarrayId(int subarrayId) {
            this.subarrayId = subarrayId;
            return this;
        }

        public Builder withVccCount(int vccCount) {
            this.vccCount = vccCount;
            return this;
        }

        public Builder withFspCount(int fspCount) {
            this.fspCount = fspCount;
            return this;
        }

        public Builder withReceptors(ReceptorMapping receptors) {
            this.receptors = receptors;
            return this;
        }

        public Builder withModelFeed(InetSocketAddress bindAddress) {
            this.modelFeedBindAddress = bindAddress;
            return this;
        }

        public Builder withSchedulerThreads(int threads) {
            this.schedulerThreads = threads;
            return this;
        }

        public SubarrayRuntimeConfig build() {
            return new SubarrayRuntimeConfig(subarrayId, vccCount, fspCount, receptors,
                    modelFeedBindAddress, schedulerThreads);
        }
    }
}
