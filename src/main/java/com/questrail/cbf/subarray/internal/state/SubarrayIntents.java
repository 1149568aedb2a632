package com.questrail.cbf.subarray.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SubarrayIntents
 * -----------------------------------------------------------------------------
 * Immutable set of fleet actions emitted by the {@link SubarrayStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * Intents are the bridge between the pure lifecycle interpreter and the
 * side-effecting components (allocator, validator, distributor). The reducer
 * decides <b>what</b> must happen; the intent executor decides <b>how</b>.
 *
 * <h2>Execution order</h2>
 * Kinds are executed in their declaration order, which encodes the required
 * side-effect ordering: an active scan is ended before the fleet is aborted,
 * and configuration is torn down before receptors are released or a new
 * configuration is applied.
 */
public final class SubarrayIntents
{
    /**
     * Kinds of fleet action, in execution order.
     */
    public enum Kind {
        /** End the active scan on every assigned node group. */
        END_SCAN,

        /** Abort every assigned node group. */
        ABORT_FLEET,

        /** Reset every assigned node group after an abort or fault. */
        RESET_FLEET,

        /** Cancel telemetry subscriptions, release node groups and clear configuration. */
        DECONFIGURE,

        /** Return channel-input nodes to idle. */
        IDLE_FLEET,

        /** Release every assigned receptor. */
        RELEASE_ALL_RECEPTORS,

        /** Claim the receptors in {@link #receptorIds()}. */
        ALLOCATE_RECEPTORS,

        /** Release the receptors in {@link #receptorIds()}. */
        RELEASE_RECEPTORS,

        /** Validate and distribute {@link #configuration()}. */
        APPLY_CONFIGURATION,

        /** Start scan {@link #scanId()} on every assigned node group. */
        START_SCAN
    }

    private final Set<Kind> kinds;
    private final List<Integer> receptorIds;
    private final String configuration;
    private final int scanId;

    private SubarrayIntents(Set<Kind> kinds, List<Integer> receptorIds, String configuration, int scanId) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.receptorIds = List.copyOf(receptorIds);
        this.configuration = configuration;
        this.scanId = scanId;
    }

    /**
     * Kinds in execution order.
     */
    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /** Receptors targeted by allocate/release intents. */
    public List<Integer> receptorIds() {
        return receptorIds;
    }

    /** Raw configuration document targeted by {@link Kind#APPLY_CONFIGURATION}. */
    public Optional<String> configuration() {
        return Optional.ofNullable(configuration);
    }

    public int scanId() {
        return scanId;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private List<Integer> receptorIds = List.of();
        private String configuration;
        private int scanId;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder receptorIds(List<Integer> ids) {
            this.receptorIds = List.copyOf(ids);
            return this;
        }

        public Builder configuration(String document) {
            this.configuration = Objects.requireNonNull(document, "document");
            return this;
        }

        public Builder scanId(int id) {
            this.scanId = id;
            return this;
        }

        public SubarrayIntents build() {
            return new SubarrayIntents(kinds, receptorIds, configuration, scanId);
        }
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static SubarrayIntents none() {
        return builder().build();
    }

    public static SubarrayIntents allocate(List<Integer> receptorIds) {
        return builder().add(Kind.ALLOCATE_RECEPTORS).receptorIds(receptorIds).build();
    }

    public static SubarrayIntents release(List<Integer> receptorIds) {
        return builder().add(Kind.RELEASE_RECEPTORS).receptorIds(receptorIds).build();
    }

    public static SubarrayIntents releaseAll() {
        return builder().add(Kind.RELEASE_ALL_RECEPTORS).build();
    }

    /**
     * Tear down any previous configuration, then validate and apply a new one.
     */
    public static SubarrayIntents reconfigure(String document) {
        return builder().add(Kind.DECONFIGURE).add(Kind.APPLY_CONFIGURATION).configuration(document).build();
    }

    public static SubarrayIntents startScan(int scanId) {
        return builder().add(Kind.START_SCAN).scanId(scanId).build();
    }

    public static SubarrayIntents endScan() {
        return builder().add(Kind.END_SCAN).build();
    }

    public static SubarrayIntents goToIdle() {
        return builder().add(Kind.DECONFIGURE).add(Kind.IDLE_FLEET).build();
    }

    /**
     * Abort the fleet, ending the active scan first when {@code scanActive}.
     */
    public static SubarrayIntents abort(boolean scanActive) {
        Builder b = builder().add(Kind.ABORT_FLEET);
        if (scanActive) {
            b.add(Kind.END_SCAN);
        }
        return b.build();
    }

    public static SubarrayIntents obsReset() {
        return builder().add(Kind.RESET_FLEET).add(Kind.DECONFIGURE).build();
    }

    public static SubarrayIntents restart() {
        return builder().add(Kind.RESET_FLEET).add(Kind.DECONFIGURE).add(Kind.RELEASE_ALL_RECEPTORS).build();
    }

    @Override
    public String toString() {
        return "SubarrayIntents" + kinds;
    }
}
