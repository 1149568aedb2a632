package com.questrail.cbf.subarray.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only receptor table supplied by the telescope model.
 * Maps each receptor id to its backing channel-input node (VCC) and to the
 * receptor's frequency offset index {@code k}, which fixes its sample rate.
 */
public final class ReceptorMapping {

    /**
     * One row of the table.
     */
    public record Entry(int receptorId, int vccId, int frequencyOffsetK) {}

    private final Map<Integer, Entry> entries;

    private ReceptorMapping(Map<Integer, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * Resolves a receptor id.
     *
     * @return the mapping entry, or empty if the receptor is unknown
     */
    public Optional<Entry> resolve(int receptorId) {
        return Optional.ofNullable(entries.get(receptorId));
    }

    public Set<Integer> allReceptors() {
        return entries.keySet();
    }

    /**
     * Identity mapping for {@code count} receptors: receptor {@code n} is backed
     * by VCC {@code n} with offset index {@code n}.
     */
    public static ReceptorMapping identity(int count) {
        Builder b = builder();
        for (int id = 1; id <= count; id++) {
            b.addReceptor(id, id, id);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, Entry> entries = new LinkedHashMap<>();

        public Builder addReceptor(int receptorId, int vccId, int frequencyOffsetK) {
            if (receptorId < 1) {
                throw new IllegalArgumentException("Receptor id must be >= 1: " + receptorId);
            }
            if (vccId < 1) {
                throw new IllegalArgumentException("VCC id must be >= 1: " + vccId);
            }
            for (Entry e : entries.values()) {
                if (e.vccId() == vccId && e.receptorId() != receptorId) {
                    throw new IllegalArgumentException(
                            "VCC " + vccId + " already backs receptor " + e.receptorId());
                }
            }
            entries.put(receptorId, new Entry(receptorId, vccId, frequencyOffsetK));
            return this;
        }

        public ReceptorMapping build() {
            if (entries.isEmpty()) {
                throw new IllegalStateException("At least one receptor required");
            }
            return new ReceptorMapping(entries);
        }
    }
}
