package com.questrail.cbf.fleet;

/**
 * Opaque handle returned by {@link DeviceFleetGateway#subscribe}.
 */
public record SubscriptionId(long value)
{
}
