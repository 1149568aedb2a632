package com.questrail.cbf.subarray.transport.udp;

import com.questrail.cbf.subarray.internal.model.ModelUpdateScheduler;
import com.questrail.cbf.subarray.transport.DatagramEndpoint;
import com.questrail.cbf.subarray.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UdpModelFeedAdapter
 * =============================================================================
 * Bridges a {@link DatagramEndpoint} to the {@link ModelUpdateScheduler}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        -> UTF-8 text
 *            -> ModelUpdateScheduler.onModelDocument(raw)
 * </pre>
 *
 * <p>Each datagram carries exactly one model document; the document's
 * top-level key selects the model type. Malformed, duplicate or
 * state-rejected documents are dropped by the scheduler and counted here.</p>
 */
public class UdpModelFeedAdapter implements DatagramEndpointListener {

    private static final Logger log = LoggerFactory.getLogger(UdpModelFeedAdapter.class);

    private final ModelUpdateScheduler scheduler;
    private final DatagramEndpoint endpoint;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean up;

    public UdpModelFeedAdapter(ModelUpdateScheduler scheduler, DatagramEndpoint endpoint) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    /** Documents the scheduler accepted. */
    public long acceptedCount() {
        return accepted.get();
    }

    /** Datagrams dropped for any reason. */
    public long droppedCount() {
        return dropped.get();
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
        log.info("Model feed transport up");
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause != null) {
            log.warn("Model feed transport down", cause);
        } else {
            log.info("Model feed transport down");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        String raw = new String(payload, StandardCharsets.UTF_8);
        ModelUpdateScheduler.Disposition disposition = scheduler.onModelDocument(raw);
        if (disposition == ModelUpdateScheduler.Disposition.ACCEPTED) {
            accepted.incrementAndGet();
        } else {
            dropped.incrementAndGet();
            log.debug("Model datagram from {} not accepted: {}", remote, disposition);
        }
    }
}
