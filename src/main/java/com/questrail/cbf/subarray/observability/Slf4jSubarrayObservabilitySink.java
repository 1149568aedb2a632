package com.questrail.cbf.subarray.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SubarrayObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSubarrayObservabilitySink implements SubarrayObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSubarrayObservabilitySink.class);

    @Override
    public void onStateTransition(SubarrayStateTransitionEvent event) {
        var oldState = event.oldState();
        var newState = event.newState();

        if (event.isObsStateChange()) {
            log.info("Subarray {} obsState: {} -> {} ({})",
                newState.subarrayId(),
                oldState.obsState(),
                newState.obsState(),
                event.triggeringEvent());
        }

        if (event.isReceptorChange()) {
            log.info("Subarray {} receptors: {} -> {}",
                newState.subarrayId(),
                oldState.receptors(),
                newState.receptors());
        }

        if (!event.resultingIntents().isEmpty()) {
            log.debug("Subarray {} intents: {}", newState.subarrayId(), event.resultingIntents());
        }
    }

    @Override
    public void onModelUpdate(ModelUpdateObservabilityEvent event) {
        switch (event.kind()) {
            case DUPLICATE_DROPPED, REJECTED_BY_STATE, MALFORMED, STALE_DROPPED ->
                log.warn("{} update {}: {}", event.type(), event.kind(), event.detail());
            case FANOUT_FAILED ->
                log.error("{} update for epoch {} failed: {}", event.type(), event.epoch(), event.detail());
            default ->
                log.debug("{} update {} (epoch {})", event.type(), event.kind(), event.epoch());
        }
    }

    @Override
    public void onError(SubarrayErrorEvent event) {
        log.error("Subarray error: {}", event.message(), event.cause());
    }
}
