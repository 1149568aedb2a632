package com.questrail.cbf.fleet;

/**
 * Explicit class tag carried by every {@link NodeRef}.
 *
 * <p>Consumers dispatch on this tag rather than on node names.</p>
 */
public enum NodeClass
{
    /** Channel-input (per-receptor) processing node. */
    VCC,

    /** Function-mode processing node. */
    FSP,

    /** External telemetry source publishing model documents. */
    TELEMETRY
}
