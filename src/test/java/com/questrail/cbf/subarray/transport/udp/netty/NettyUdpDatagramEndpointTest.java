package com.questrail.cbf.subarray.transport.udp.netty;

import com.questrail.cbf.subarray.transport.DatagramEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback tests against a real socket bound to an ephemeral port.
 */
class NettyUdpDatagramEndpointTest {

    private static final class LatchListener implements DatagramEndpointListener {
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);
        final CountDownLatch received = new CountDownLatch(1);
        final AtomicReference<byte[]> payload = new AtomicReference<>();
        final AtomicReference<SocketAddress> sender = new AtomicReference<>();

        @Override
        public void onTransportUp() {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause) {
            down.countDown();
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] bytes) {
            sender.set(remote);
            payload.set(bytes);
            received.countDown();
        }
    }

    private NettyUdpDatagramEndpoint endpoint;

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.stop();
        }
    }

    @Test
    void startWithoutListenerFails() {
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));

        assertThrows(IllegalStateException.class, endpoint::start);
    }

    @Test
    void receivedDatagramIsDeliveredAsBytes() throws IOException, InterruptedException {
        LatchListener listener = new LatchListener();
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        endpoint.setListener(listener);

        endpoint.start();
        assertTrue(listener.up.await(2, TimeUnit.SECONDS), "endpoint should come up");
        InetSocketAddress local = endpoint.localAddress().orElseThrow();

        byte[] document = "{\"delayModel\":[]}".getBytes(StandardCharsets.UTF_8);
        try (DatagramSocket socket = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            socket.send(new DatagramPacket(document, document.length, local));

            assertTrue(listener.received.await(2, TimeUnit.SECONDS), "datagram should arrive");
            assertArrayEquals(document, listener.payload.get());
            assertEquals(socket.getLocalPort(), ((InetSocketAddress) listener.sender.get()).getPort());
        }
    }

    @Test
    void stopReportsTransportDown() throws InterruptedException {
        LatchListener listener = new LatchListener();
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        endpoint.setListener(listener);
        endpoint.start();
        assertTrue(listener.up.await(2, TimeUnit.SECONDS));

        endpoint.stop();
        endpoint = null;

        assertTrue(listener.down.await(2, TimeUnit.SECONDS), "stop should report transport down");
    }
}
