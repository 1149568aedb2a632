package com.questrail.cbf.fleet;

import java.util.Objects;

/**
 * NodeRef
 * -----------------------------------------------------------------------------
 * Reference to a single remote node reachable through {@link DeviceFleetGateway}.
 *
 * <p>{@code id} is the 1-based node number within its class; telemetry sources
 * have no number and use zero. {@code name} is the fleet address the gateway
 * resolves.</p>
 */
public record NodeRef(NodeClass nodeClass, int id, String name)
{
    public NodeRef {
        Objects.requireNonNull(nodeClass, "nodeClass");
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (nodeClass != NodeClass.TELEMETRY && id < 1) {
            throw new IllegalArgumentException(nodeClass + " id must be >= 1: " + id);
        }
    }

    public static NodeRef vcc(int id) {
        return new NodeRef(NodeClass.VCC, id, String.format("mid_csp_cbf/vcc/%03d", id));
    }

    public static NodeRef fsp(int id) {
        return new NodeRef(NodeClass.FSP, id, String.format("mid_csp_cbf/fsp/%02d", id));
    }

    public static NodeRef telemetry(String deviceName) {
        return new NodeRef(NodeClass.TELEMETRY, 0, deviceName);
    }

    @Override
    public String toString() {
        return name;
    }
}
