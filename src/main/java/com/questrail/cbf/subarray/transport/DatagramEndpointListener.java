package com.questrail.cbf.subarray.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    /** Called when the transport becomes usable. */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is a full datagram, copied out of any framework buffer.</p>
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
