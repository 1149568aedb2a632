package com.questrail.cbf.subarray.observability;

/**
 * Main interface for receiving subarray observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SubarrayObservabilitySink {
    /**
     * Called after every event the lifecycle reducer applied.
     * @param event the transition event details
     */
    void onStateTransition(SubarrayStateTransitionEvent event);

    /**
     * Called for every accepted, dropped, applied or failed model update.
     * @param event the model update event
     */
    void onModelUpdate(ModelUpdateObservabilityEvent event);

    /**
     * Called when an error or anomaly occurs while driving the fleet.
     * @param event the error event
     */
    void onError(SubarrayErrorEvent event);
}
