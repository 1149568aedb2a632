package com.questrail.cbf.subarray.observability;

/**
 * No-op implementation of SubarrayObservabilitySink.
 */
public final class NullObservabilitySink implements SubarrayObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SubarrayStateTransitionEvent event) {}

    @Override
    public void onModelUpdate(ModelUpdateObservabilityEvent event) {}

    @Override
    public void onError(SubarrayErrorEvent event) {}
}
