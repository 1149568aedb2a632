package com.questrail.cbf.subarray.internal.state;

import com.questrail.cbf.api.ObsState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubarrayInvariantsTest {

    private final Instant now = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void initialStateIsConsistent() {
        assertTrue(SubarrayInvariants.check(SubarrayState.initial(1, now), List.of(), false).isEmpty());
    }

    @Test
    void transientStateIsReported() {
        SubarrayState s = SubarrayState.initial(1, now).withObsState(ObsState.RESOURCING, now);

        assertTrue(SubarrayInvariants.check(s, List.of(), false).isPresent());
    }

    @Test
    void receptorDisagreementIsReported() {
        SubarrayState s = SubarrayState.initial(1, now)
                .withReceptors(List.of(1, 2), now)
                .withObsState(ObsState.IDLE, now);

        assertTrue(SubarrayInvariants.check(s, List.of(1, 2), false).isEmpty());
        assertTrue(SubarrayInvariants.check(s, List.of(2, 1), false).isPresent());
    }

    @Test
    void idleWithFunctionModeNodesIsReported() {
        SubarrayState s = SubarrayState.initial(1, now)
                .withReceptors(List.of(1), now)
                .withObsState(ObsState.IDLE, now);

        InternalInconsistencyException e = assertThrows(InternalInconsistencyException.class,
                () -> SubarrayInvariants.verify(s, List.of(1), true));
        assertTrue(e.getMessage().contains("IDLE"));
    }

    @Test
    void scanIdMustMatchScanning() {
        SubarrayState ready = SubarrayState.initial(1, now)
                .withReceptors(List.of(1), now)
                .withObsState(ObsState.READY, now);

        assertTrue(SubarrayInvariants.check(ready.withScanId(4, now), List.of(1), true).isPresent());
        assertTrue(SubarrayInvariants.check(ready.withObsState(ObsState.SCANNING, now), List.of(1), true).isPresent());
        assertTrue(SubarrayInvariants.check(
                ready.withScanId(4, now).withObsState(ObsState.SCANNING, now), List.of(1), true).isEmpty());
    }
}
