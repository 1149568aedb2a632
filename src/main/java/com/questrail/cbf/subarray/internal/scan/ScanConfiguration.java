package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.fleet.SubscriptionPoint;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ScanConfiguration
 * -----------------------------------------------------------------------------
 * Typed view of a validated, normalized scan configuration document.
 *
 * <p>A configuration is created per ConfigureScan call and is never merged
 * with a previous one. {@link #document()} is the normalized JSON tree;
 * re-validating it yields an equal document.</p>
 */
public record ScanConfiguration(CommonConfiguration common,
                                List<FspConfiguration> fsps,
                                List<ObjectNode> searchWindows,
                                Map<ModelType, SubscriptionPoint> modelSubscriptions,
                                SubscriptionPoint dopplerSubscription,
                                ObjectNode document)
{
    public ScanConfiguration {
        Objects.requireNonNull(common, "common");
        fsps = List.copyOf(fsps);
        searchWindows = List.copyOf(searchWindows);
        modelSubscriptions = Map.copyOf(modelSubscriptions);
        Objects.requireNonNull(document, "document");
    }

    public Optional<SubscriptionPoint> doppler() {
        return Optional.ofNullable(dopplerSubscription);
    }
}
