package com.questrail.cbf.subarray.internal.state;

import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.subarray.internal.scan.Band5Tuning;
import com.questrail.cbf.subarray.internal.scan.CommonConfiguration;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SubarrayState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one subarray's aggregate state.
 *
 * <h2>Role in the architecture</h2>
 * This is the state consumed and produced by {@link SubarrayStateReducer}. It
 * holds the facts the lifecycle depends on:
 * <ul>
 *   <li>the authoritative {@link ObsState}</li>
 *   <li>the assigned receptors, in assignment order</li>
 *   <li>the active configuration fields (id, band, band-5 tuning, stream offsets)</li>
 *   <li>the active scan id</li>
 *   <li>the function-mode nodes assigned per mode</li>
 * </ul>
 * Live fleet handles (subscriptions, group members) are not part of this
 * snapshot; they are owned by the components that manage them.
 */
public final class SubarrayState
{
    private final int subarrayId;
    private final ObsState obsState;
    private final List<Integer> receptors;
    private final String configId;
    private final FrequencyBand band;
    private final Band5Tuning band5Tuning;
    private final long streamOffset1Hz;
    private final long streamOffset2Hz;
    private final int scanId;
    private final Map<FunctionMode, List<Integer>> assignedNodes;
    private final Instant lastTransition;

    private SubarrayState(int subarrayId,
                          ObsState obsState,
                          List<Integer> receptors,
                          String configId,
                          FrequencyBand band,
                          Band5Tuning band5Tuning,
                          long streamOffset1Hz,
                          long streamOffset2Hz,
                          int scanId,
                          Map<FunctionMode, List<Integer>> assignedNodes,
                          Instant lastTransition) {
        this.subarrayId = subarrayId;
        this.obsState = Objects.requireNonNull(obsState, "obsState");
        this.receptors = List.copyOf(receptors);
        this.configId = Objects.requireNonNull(configId, "configId");
        this.band = band;
        this.band5Tuning = Objects.requireNonNull(band5Tuning, "band5Tuning");
        this.streamOffset1Hz = streamOffset1Hz;
        this.streamOffset2Hz = streamOffset2Hz;
        this.scanId = scanId;
        this.assignedNodes = copyAssignments(assignedNodes);
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    /**
     * Initial state of a freshly created subarray.
     */
    public static SubarrayState initial(int subarrayId, Instant now) {
        return new SubarrayState(subarrayId, ObsState.EMPTY, List.of(), "", null,
                Band5Tuning.UNTUNED, 0, 0, 0, Map.of(), now);
    }

    public int subarrayId() {
        return subarrayId;
    }

    public ObsState obsState() {
        return obsState;
    }

    public List<Integer> receptors() {
        return receptors;
    }

    public String configId() {
        return configId;
    }

    public Optional<FrequencyBand> band() {
        return Optional.ofNullable(band);
    }

    public Band5Tuning band5Tuning() {
        return band5Tuning;
    }

    public long streamOffset1Hz() {
        return streamOffset1Hz;
    }

    public long streamOffset2Hz() {
        return streamOffset2Hz;
    }

    public int scanId() {
        return scanId;
    }

    /** Assigned function-mode node ids per mode; modes without nodes are absent. */
    public Map<FunctionMode, List<Integer>> assignedNodes() {
        return assignedNodes;
    }

    public boolean hasAssignedNodes() {
        return !assignedNodes.isEmpty();
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Copy helpers
    // ---------------------------------------------------------------------

    public SubarrayState withObsState(ObsState newState, Instant now) {
        return new SubarrayState(subarrayId, newState, receptors, configId, band, band5Tuning,
                streamOffset1Hz, streamOffset2Hz, scanId, assignedNodes, now);
    }

    public SubarrayState withReceptors(List<Integer> newReceptors, Instant now) {
        return new SubarrayState(subarrayId, obsState, newReceptors, configId, band, band5Tuning,
                streamOffset1Hz, streamOffset2Hz, scanId, assignedNodes, now);
    }

    public SubarrayState withScanId(int newScanId, Instant now) {
        return new SubarrayState(subarrayId, obsState, receptors, configId, band, band5Tuning,
                streamOffset1Hz, streamOffset2Hz, newScanId, assignedNodes, now);
    }

    /**
     * Returns a state carrying a freshly applied configuration.
     */
    public SubarrayState withConfiguration(CommonConfiguration common,
                                           Map<FunctionMode, List<Integer>> nodes,
                                           Instant now) {
        return new SubarrayState(subarrayId, obsState, receptors, common.configId(), common.band(),
                common.band5Tuning(), common.streamOffset1Hz(), common.streamOffset2Hz(),
                scanId, nodes, now);
    }

    /**
     * Returns a state with every configuration field reset to its default and
     * no function-mode nodes assigned.
     */
    public SubarrayState withConfigurationCleared(Instant now) {
        return new SubarrayState(subarrayId, obsState, receptors, "", null, Band5Tuning.UNTUNED,
                0, 0, 0, Map.of(), now);
    }

    private static Map<FunctionMode, List<Integer>> copyAssignments(Map<FunctionMode, List<Integer>> source) {
        Map<FunctionMode, List<Integer>> copy = new EnumMap<>(FunctionMode.class);
        source.forEach((mode, ids) -> {
            if (!ids.isEmpty()) {
                copy.put(mode, List.copyOf(ids));
            }
        });
        return Map.copyOf(copy);
    }

    @Override
    public String toString() {
        return "SubarrayState[" + subarrayId + " " + obsState
                + " receptors=" + receptors
                + " configId=" + configId
                + " scanId=" + scanId + "]";
    }
}
