package com.questrail.cbf.subarray.internal.state;

import com.questrail.cbf.api.ObsState;

import java.util.List;
import java.util.Optional;

/**
 * Post-command consistency checks between the state snapshot and the live
 * fleet bookkeeping. A violation is an internal inconsistency and sends the
 * subarray to {@link ObsState#FAULT}.
 */
public final class SubarrayInvariants
{
    private SubarrayInvariants() {}

    /**
     * Throwing form of {@link #check}.
     *
     * @throws InternalInconsistencyException describing the first violated invariant
     */
    public static void verify(SubarrayState state,
                              List<Integer> allocatedReceptors,
                              boolean nodeGroupsAssigned) {
        check(state, allocatedReceptors, nodeGroupsAssigned).ifPresent(reason -> {
            throw new InternalInconsistencyException(reason);
        });
    }

    /**
     * @param state              snapshot after a lifecycle command has been fully processed
     * @param allocatedReceptors receptors the allocator currently holds, in order
     * @param nodeGroupsAssigned whether any function-mode node group is non-empty
     * @return the first violated invariant, if any
     */
    public static Optional<String> check(SubarrayState state,
                                         List<Integer> allocatedReceptors,
                                         boolean nodeGroupsAssigned) {
        ObsState obs = state.obsState();

        if (obs.isTransient()) {
            return Optional.of("Lifecycle command left the subarray in transient state " + obs);
        }
        if (!state.receptors().equals(allocatedReceptors)) {
            return Optional.of("Assigned receptors " + state.receptors()
                    + " disagree with allocator " + allocatedReceptors);
        }
        if (obs == ObsState.EMPTY && !state.receptors().isEmpty()) {
            return Optional.of("EMPTY subarray still holds receptors " + state.receptors());
        }
        if ((obs == ObsState.EMPTY || obs == ObsState.IDLE)
                && (nodeGroupsAssigned || state.hasAssignedNodes())) {
            return Optional.of("Node groups still assigned in " + obs);
        }
        if (obs == ObsState.SCANNING && state.scanId() == 0) {
            return Optional.of("SCANNING without a scan id");
        }
        if (obs != ObsState.SCANNING && state.scanId() != 0) {
            return Optional.of("Scan id " + state.scanId() + " set outside SCANNING");
        }
        return Optional.empty();
    }
}
