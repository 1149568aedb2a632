package com.questrail.cbf.api;

/**
 * ObsState
 * -----------------------------------------------------------------------------
 * Authoritative observation lifecycle state of a subarray.
 *
 * <h2>Stable vs transient states</h2>
 * {@link #RESOURCING}, {@link #CONFIGURING}, {@link #ABORTING}, {@link #RESETTING}
 * and {@link #RESTARTING} are transient: they are entered when a lifecycle command
 * is accepted and left once the fleet work it triggered has completed. Callers
 * observing the subarray between lifecycle calls only ever see stable states.
 *
 * <h2>State graph</h2>
 * <pre>
 *   EMPTY/IDLE --AddReceptors--> RESOURCING --> IDLE | EMPTY
 *   IDLE/READY --ConfigureScan--> CONFIGURING --> READY | IDLE | FAULT
 *   READY --Scan--> SCANNING --EndScan--> READY
 *   READY --GoToIdle--> IDLE
 *   RESOURCING/IDLE/CONFIGURING/READY/SCANNING --Abort--> ABORTING --> ABORTED
 *   ABORTED --ObsReset--> RESETTING --> IDLE
 *   ABORTED/FAULT --Restart--> RESTARTING --> EMPTY
 * </pre>
 */
public enum ObsState
{
    EMPTY,
    RESOURCING,
    IDLE,
    CONFIGURING,
    READY,
    SCANNING,
    ABORTING,
    ABORTED,
    RESETTING,
    RESTARTING,
    FAULT;

    /**
     * Returns {@code true} for states that are only visible while a lifecycle
     * command is being processed.
     */
    public boolean isTransient() {
        return switch (this) {
            case RESOURCING, CONFIGURING, ABORTING, RESETTING, RESTARTING -> true;
            default -> false;
        };
    }

    /**
     * Returns {@code true} if model updates may be fanned out in this state.
     */
    public boolean acceptsModelUpdates() {
        return this == READY || this == SCANNING;
    }
}
