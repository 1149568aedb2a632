package com.questrail.cbf.subarray.observability;

import com.questrail.cbf.subarray.internal.events.SubarrayEvent;
import com.questrail.cbf.subarray.internal.state.SubarrayIntents;
import com.questrail.cbf.subarray.internal.state.SubarrayState;

import java.time.Instant;

/**
 * Record representing one reducer step of the subarray lifecycle.
 */
public record SubarrayStateTransitionEvent(
    Instant timestamp,
    SubarrayState oldState,
    SubarrayState newState,
    SubarrayEvent triggeringEvent,
    SubarrayIntents resultingIntents
) {
    /**
     * Checks if the obsState changed during this transition.
     */
    public boolean isObsStateChange() {
        return oldState.obsState() != newState.obsState();
    }

    /**
     * Checks if the assigned receptors changed during this transition.
     */
    public boolean isReceptorChange() {
        return !oldState.receptors().equals(newState.receptors());
    }
}
