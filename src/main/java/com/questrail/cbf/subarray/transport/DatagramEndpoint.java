package com.questrail.cbf.subarray.transport;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a receive-side datagram transport (UDP-style).
 *
 * <p>The endpoint only moves bytes. Turning a datagram into a model update is
 * the listener's job.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}
