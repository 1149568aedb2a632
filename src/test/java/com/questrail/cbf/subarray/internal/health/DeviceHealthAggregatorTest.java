package com.questrail.cbf.subarray.internal.health;

import com.questrail.cbf.api.DeviceState;
import com.questrail.cbf.api.HealthState;
import com.questrail.cbf.api.NodeStatus;
import com.questrail.cbf.fleet.ChangeEvent;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RecordingFleetGateway;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceHealthAggregatorTest {

    private RecordingFleetGateway gateway;
    private DeviceHealthAggregator health;

    @BeforeEach
    void setUp() {
        gateway = new RecordingFleetGateway();
        health = new DeviceHealthAggregator(gateway);
    }

    @Test
    void watchedNodeStartsUnknownAndFollowsEvents() throws RemoteCallFailedException {
        NodeRef vcc = NodeRef.vcc(2);
        health.watch(vcc);

        assertEquals(NodeStatus.UNKNOWN, health.vccView().get(vcc.name()));

        gateway.emit(vcc, FleetCommands.STATE, "ON");
        gateway.emit(vcc, FleetCommands.HEALTH_STATE, "DEGRADED");

        NodeStatus status = health.vccView().get(vcc.name());
        assertEquals(DeviceState.ON, status.state());
        assertEquals(HealthState.DEGRADED, status.health());
    }

    @Test
    void viewsAreSeparatedByNodeClassAndKeepWatchOrder() throws RemoteCallFailedException {
        health.watch(NodeRef.vcc(3));
        health.watch(NodeRef.fsp(1));
        health.watch(NodeRef.vcc(1));

        assertEquals(List.of("mid_csp_cbf/vcc/003", "mid_csp_cbf/vcc/001"), List.copyOf(health.vccView().keySet()));
        assertEquals(List.of("mid_csp_cbf/fsp/01"), List.copyOf(health.fspView().keySet()));
    }

    @Test
    void watchingTwiceSubscribesOnce() throws RemoteCallFailedException {
        health.watch(NodeRef.fsp(2));
        health.watch(NodeRef.fsp(2));

        assertEquals(2, gateway.subscriptionCount());
    }

    @Test
    void unwatchStopsUpdatesAndDropsTheNode() throws RemoteCallFailedException {
        NodeRef fsp = NodeRef.fsp(1);
        health.watch(fsp);

        health.unwatch(fsp);

        assertFalse(health.isWatching(fsp));
        assertTrue(health.fspView().isEmpty());
        assertEquals(0, gateway.subscriptionCount());
    }

    @Test
    void eventsForUntrackedNodesAreDiscarded() {
        NodeRef vcc = NodeRef.vcc(9);

        health.onStateEvent(ChangeEvent.value(vcc, FleetCommands.STATE, "ON", Instant.now()));

        assertTrue(health.vccView().isEmpty());
    }

    @Test
    void errorEventsDoNotChangeStatus() throws RemoteCallFailedException {
        NodeRef vcc = NodeRef.vcc(1);
        health.watch(vcc);
        gateway.emit(vcc, FleetCommands.STATE, "ON");

        health.onStateEvent(ChangeEvent.error(vcc, FleetCommands.STATE, "device timeout", Instant.now()));

        assertEquals(DeviceState.ON, health.vccView().get(vcc.name()).state());
    }

    @Test
    void failedSubscriptionLeavesNothingBehind() {
        NodeRef vcc = NodeRef.vcc(1);
        gateway.failOn(vcc.name(), "subscribe:" + FleetCommands.HEALTH_STATE, "no such attribute");

        assertThrows(RemoteCallFailedException.class, () -> health.watch(vcc));

        assertFalse(health.isWatching(vcc));
        assertEquals(0, gateway.subscriptionCount());
    }

    @Test
    void viewsAreUnmodifiable() throws RemoteCallFailedException {
        health.watch(NodeRef.vcc(1));
        Map<String, NodeStatus> view = health.vccView();

        assertThrows(UnsupportedOperationException.class, () -> view.clear());
    }
}
