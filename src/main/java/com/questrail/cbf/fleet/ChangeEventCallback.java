package com.questrail.cbf.fleet;

/**
 * Callback registered per subscription.
 *
 * <p>Invoked on a gateway-owned thread. Implementations must not block for
 * long and must tolerate being called concurrently with lifecycle commands.</p>
 */
@FunctionalInterface
public interface ChangeEventCallback
{
    void onChange(ChangeEvent event);
}
