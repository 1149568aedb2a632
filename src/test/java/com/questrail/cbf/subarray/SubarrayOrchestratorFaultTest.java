package com.questrail.cbf.subarray;

import com.questrail.cbf.api.CommandResult;
import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.api.ResultCode;
import com.questrail.cbf.api.SubarrayController;
import com.questrail.cbf.fleet.ChangeEventCallback;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.GroupRef;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RecordingFleetGateway;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.fleet.SubscriptionId;
import com.questrail.cbf.subarray.config.ReceptorMapping;
import com.questrail.cbf.subarray.config.SubarrayRuntimeConfig;
import com.questrail.cbf.subarray.observability.RecordingObservabilitySink;
import com.questrail.cbf.subarray.observability.SubarrayErrorEvent;
import com.questrail.cbf.subarray.runtime.SubarrayProductionRuntime;
import com.questrail.cbf.subarray.test.SubarrayTestHarness;
import com.questrail.cbf.subarray.time.DeterministicScheduler;
import com.questrail.cbf.subarray.time.ManualMonotonicClock;
import com.questrail.cbf.subarray.time.ManualWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.cbf.subarray.test.ScanConfigFixtures.correlation;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SubarrayOrchestratorFaultTest
 * -----------------------------------------------------------------------------
 * Unexpected failures inside fleet work must never escape a command; they
 * move the subarray to FAULT, from which only Restart recovers.
 */
class SubarrayOrchestratorFaultTest {

    /**
     * Delegates to a recording fleet but throws an unchecked exception for
     * one node command while armed.
     */
    private static final class FaultingGateway implements DeviceFleetGateway {
        private final RecordingFleetGateway delegate;
        private volatile String faultyCommand;

        FaultingGateway(RecordingFleetGateway delegate) {
            this.delegate = delegate;
        }

        void arm(String command) {
            faultyCommand = command;
        }

        void disarm() {
            faultyCommand = null;
        }

        @Override
        public String call(NodeRef node, String command, String payload) throws RemoteCallFailedException {
            if (command.equals(faultyCommand)) {
                throw new IllegalStateException("driver crashed on " + command);
            }
            return delegate.call(node, command, payload);
        }

        @Override
        public void callGroup(GroupRef group, String command, String payload) throws RemoteCallFailedException {
            delegate.callGroup(group, command, payload);
        }

        @Override
        public void callAsync(NodeRef node, String command, String payload) {
            delegate.callAsync(node, command, payload);
        }

        @Override
        public SubscriptionId subscribe(NodeRef node, String attribute, ChangeEventCallback callback)
                throws RemoteCallFailedException {
            return delegate.subscribe(node, attribute, callback);
        }

        @Override
        public void unsubscribe(SubscriptionId subscription) throws RemoteCallFailedException {
            delegate.unsubscribe(subscription);
        }

        @Override
        public boolean probe(String reference) {
            return delegate.probe(reference);
        }
    }

    private RecordingFleetGateway fleet;
    private FaultingGateway gateway;
    private RecordingObservabilitySink sink;
    private SubarrayController subarray;

    @BeforeEach
    void setUp() {
        fleet = new RecordingFleetGateway();
        gateway = new FaultingGateway(fleet);
        sink = new RecordingObservabilitySink();
        ManualMonotonicClock clock = new ManualMonotonicClock();

        SubarrayProductionRuntime runtime = SubarrayProductionRuntime.builder()
                .withConfig(SubarrayRuntimeConfig.builder()
                        .withSubarrayId(1)
                        .withFspCount(4)
                        .withReceptors(ReceptorMapping.identity(8))
                        .build())
                .withGateway(gateway)
                .withObservabilitySink(sink)
                .withClocks(clock, new ManualWallClock(SubarrayTestHarness.START))
                .withScheduler(new DeterministicScheduler(clock))
                .build();
        subarray = runtime.controller();
    }

    @Test
    void crashDuringDistributionFaultsTheSubarray() {
        subarray.addReceptors(List.of(1, 2));
        gateway.arm(FleetCommands.CONFIGURE_SCAN);

        CommandResult result = subarray.configureScan(correlation(1, "cfg-1").toString());

        assertEquals(ResultCode.FAILED, result.code());
        assertEquals(ErrorKind.INTERNAL_INCONSISTENCY, result.errorKind());
        assertTrue(result.message().contains("driver crashed"), result.message());
        assertEquals(ObsState.FAULT, subarray.obsState());
    }

    @Test
    void crashOutsideDistributionIsReportedAsAnError() {
        gateway.arm(FleetCommands.GET_SUBARRAY_MEMBERSHIP);

        CommandResult result = subarray.addReceptors(List.of(1));

        assertEquals(ErrorKind.INTERNAL_INCONSISTENCY, result.errorKind());
        assertTrue(result.message().startsWith("AddReceptors failed unexpectedly"), result.message());
        assertEquals(ObsState.FAULT, subarray.obsState());
        assertTrue(sink.hasEventOfType(SubarrayErrorEvent.class));
    }

    @Test
    void faultedSubarrayOnlyAcceptsRestart() {
        subarray.addReceptors(List.of(1, 2));
        gateway.arm(FleetCommands.CONFIGURE_SCAN);
        subarray.configureScan(correlation(1, "cfg-1").toString());
        gateway.disarm();

        assertEquals(ResultCode.REJECTED, subarray.abort().code());
        assertEquals(ResultCode.REJECTED, subarray.obsReset().code());
        assertEquals(ResultCode.REJECTED, subarray.scan(1).code());

        assertTrue(subarray.restart().isOk());
        assertEquals(ObsState.EMPTY, subarray.obsState());
        assertTrue(subarray.assignedReceptors().isEmpty());
        assertTrue(fleet.fspOwners(1).isEmpty());
        assertEquals(0, fleet.vccOwner(1));
        assertEquals(0, fleet.subscriptionCount());
    }

    @Test
    void subarrayIsUsableAgainAfterRestart() {
        gateway.arm(FleetCommands.GET_SUBARRAY_MEMBERSHIP);
        subarray.addReceptors(List.of(1));
        gateway.disarm();

        assertTrue(subarray.restart().isOk());
        assertTrue(subarray.addReceptors(List.of(3)).isOk());
        assertTrue(subarray.configureScan(correlation(1, "cfg-1").toString()).isOk());
        assertEquals(ObsState.READY, subarray.obsState());
    }
}
