package com.questrail.cbf.api;

import java.util.Objects;

/**
 * Last-known liveness and health of one node, as seen through change events.
 */
public record NodeStatus(DeviceState state, HealthState health)
{
    public static final NodeStatus UNKNOWN = new NodeStatus(DeviceState.UNKNOWN, HealthState.UNKNOWN);

    public NodeStatus {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(health, "health");
    }

    public NodeStatus withState(DeviceState newState) {
        return new NodeStatus(newState, health);
    }

    public NodeStatus withHealth(HealthState newHealth) {
        return new NodeStatus(state, newHealth);
    }
}
