package com.questrail.cbf.subarray.internal.health;

import com.questrail.cbf.api.DeviceState;
import com.questrail.cbf.api.HealthState;
import com.questrail.cbf.api.NodeStatus;
import com.questrail.cbf.fleet.ChangeEvent;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.NodeClass;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.fleet.SubscriptionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * DeviceHealthAggregator
 * -----------------------------------------------------------------------------
 * Last-known liveness and health of every node currently assigned to the
 * subarray, fed exclusively by change events.
 *
 * <h2>Views</h2>
 * One view per node class (VCC and FSP), ordered by when the node was
 * watched, not by id. Views are copies; callers never see the live maps.
 *
 * <h2>Threading</h2>
 * Change events arrive on gateway threads while lifecycle commands watch and
 * unwatch nodes. All access goes through this object's monitor.
 */
public final class DeviceHealthAggregator
{
    private static final Logger log = LoggerFactory.getLogger(DeviceHealthAggregator.class);

    private final DeviceFleetGateway gateway;

    private final Map<NodeRef, NodeStatus> vccStatus = new LinkedHashMap<>();
    private final Map<NodeRef, NodeStatus> fspStatus = new LinkedHashMap<>();
    private final Map<NodeRef, List<SubscriptionId>> subscriptions = new HashMap<>();

    public DeviceHealthAggregator(DeviceFleetGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    /**
     * Starts tracking a node and subscribes to its {@code state} and
     * {@code healthState} attributes.
     *
     * <p>Watching an already tracked node is a no-op. If either subscription
     * fails, the node is untracked again and the failure is rethrown.</p>
     */
    public void watch(NodeRef node) throws RemoteCallFailedException {
        Objects.requireNonNull(node, "node");
        synchronized (this) {
            if (viewFor(node).containsKey(node)) {
                return;
            }
            viewFor(node).put(node, NodeStatus.UNKNOWN);
        }

        List<SubscriptionId> ids = new ArrayList<>(2);
        try {
            ids.add(gateway.subscribe(node, FleetCommands.STATE, this::onStateEvent));
            ids.add(gateway.subscribe(node, FleetCommands.HEALTH_STATE, this::onHealthEvent));
        } catch (RemoteCallFailedException e) {
            unsubscribeAll(node, ids);
            synchronized (this) {
                viewFor(node).remove(node);
            }
            throw e;
        }

        synchronized (this) {
            subscriptions.put(node, ids);
        }
    }

    /**
     * Stops tracking a node. Unsubscribe failures are logged; the node is
     * untracked regardless.
     */
    public void unwatch(NodeRef node) {
        List<SubscriptionId> ids;
        synchronized (this) {
            viewFor(node).remove(node);
            ids = subscriptions.remove(node);
        }
        if (ids != null) {
            unsubscribeAll(node, ids);
        }
    }

    public synchronized boolean isWatching(NodeRef node) {
        return viewFor(node).containsKey(node);
    }

    /** VCC statuses keyed by node name, in watch order. */
    public synchronized Map<String, NodeStatus> vccView() {
        return copy(vccStatus);
    }

    /** FSP statuses keyed by node name, in watch order. */
    public synchronized Map<String, NodeStatus> fspView() {
        return copy(fspStatus);
    }

    // ---------------------------------------------------------------------
    // Change-event callbacks
    // ---------------------------------------------------------------------

    void onStateEvent(ChangeEvent event) {
        if (event.isError()) {
            log.error("Error event for {}/{}: {}", event.source(), event.attribute(), event.error());
            return;
        }
        DeviceState state = DeviceState.parse(event.value());
        update(event, current -> current.withState(state));
    }

    void onHealthEvent(ChangeEvent event) {
        if (event.isError()) {
            log.error("Error event for {}/{}: {}", event.source(), event.attribute(), event.error());
            return;
        }
        HealthState health = HealthState.parse(event.value());
        update(event, current -> current.withHealth(health));
    }

    private synchronized void update(ChangeEvent event, UnaryOperator<NodeStatus> change) {
        NodeRef node = event.source();
        Map<NodeRef, NodeStatus> view = viewFor(node);
        NodeStatus current = view.get(node);
        if (current == null) {
            log.warn("Discarding {} event for untracked node {}", event.attribute(), node);
            return;
        }
        view.put(node, change.apply(current));
    }

    private void unsubscribeAll(NodeRef node, List<SubscriptionId> ids) {
        for (SubscriptionId id : ids) {
            try {
                gateway.unsubscribe(id);
            } catch (RemoteCallFailedException e) {
                log.warn("Failed to unsubscribe {} from {}: {}", id, node, e.getMessage());
            }
        }
    }

    private Map<NodeRef, NodeStatus> viewFor(NodeRef node) {
        if (node.nodeClass() == NodeClass.VCC) {
            return vccStatus;
        }
        if (node.nodeClass() == NodeClass.FSP) {
            return fspStatus;
        }
        throw new IllegalArgumentException("Health is not tracked for " + node.nodeClass() + " nodes");
    }

    private static Map<String, NodeStatus> copy(Map<NodeRef, NodeStatus> source) {
        Map<String, NodeStatus> copy = new LinkedHashMap<>();
        source.forEach((node, status) -> copy.put(node.name(), status));
        return Collections.unmodifiableMap(copy);
    }
}
