package com.questrail.cbf.subarray.internal.state;

import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.subarray.internal.events.FleetOutcomeEvent;
import com.questrail.cbf.subarray.internal.events.LifecycleCommandEvent;
import com.questrail.cbf.subarray.internal.events.SubarrayEvent;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SubarrayStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic lifecycle interpreter for one subarray.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link SubarrayState} and a single {@link SubarrayEvent}, the
 * reducer computes:
 * <ul>
 *   <li>a new {@link SubarrayState}</li>
 *   <li>the {@link SubarrayIntents} describing the fleet work to do next</li>
 *   <li>or, for a lifecycle command whose guard fails, a rejection</li>
 * </ul>
 * It performs no I/O. The orchestrator executes the intents and feeds their
 * {@link FleetOutcomeEvent}s back in.
 *
 * <h2>Transient states</h2>
 * A command moves the subarray into a transient state (for example
 * {@link ObsState#RESOURCING}) and the matching outcome moves it on. GoToIdle,
 * Scan and EndScan have no transient state: the subarray stays where it is
 * until the outcome arrives.
 */
public final class SubarrayStateReducer
{
    private static final Set<ObsState> ABORTABLE = EnumSet.of(
            ObsState.RESOURCING, ObsState.IDLE, ObsState.CONFIGURING, ObsState.READY, ObsState.SCANNING);

    /**
     * A refused command.
     */
    public record Rejection(ErrorKind kind, String reason) {
        public Rejection {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * Result of applying an event.
     *
     * @param newState  the updated state; identical to the input when rejected
     * @param intents   fleet work to execute
     * @param rejection present only when a lifecycle command was refused
     */
    public record Result(SubarrayState newState,
                         SubarrayIntents intents,
                         Optional<Rejection> rejection) {

        static Result of(SubarrayState state, SubarrayIntents intents) {
            return new Result(state, intents, Optional.empty());
        }

        static Result unchanged(SubarrayState state) {
            return of(state, SubarrayIntents.none());
        }

        static Result rejected(SubarrayState state, ErrorKind kind, String reason) {
            return new Result(state, SubarrayIntents.none(), Optional.of(new Rejection(kind, reason)));
        }

        public boolean isRejected() {
            return rejection.isPresent();
        }
    }

    public Result apply(SubarrayState state, SubarrayEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof LifecycleCommandEvent command) {
            return onCommand(state, command);
        }
        if (event instanceof FleetOutcomeEvent outcome) {
            return onOutcome(state, outcome);
        }
        return Result.unchanged(state);
    }

    // ---------------------------------------------------------------------
    // Lifecycle commands
    // ---------------------------------------------------------------------

    private Result onCommand(SubarrayState state, LifecycleCommandEvent command) {
        final ObsState current = state.obsState();
        final Instant now = command.timestamp();

        if (command instanceof LifecycleCommandEvent.AddReceptors c) {
            if (current != ObsState.EMPTY && current != ObsState.IDLE) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.RESOURCING, now),
                    SubarrayIntents.allocate(c.receptorIds()));
        }
        if (command instanceof LifecycleCommandEvent.RemoveReceptors c) {
            if (current != ObsState.IDLE) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.RESOURCING, now),
                    SubarrayIntents.release(c.receptorIds()));
        }
        if (command instanceof LifecycleCommandEvent.RemoveAllReceptors) {
            if (current != ObsState.IDLE) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.RESOURCING, now), SubarrayIntents.releaseAll());
        }
        if (command instanceof LifecycleCommandEvent.ConfigureScan c) {
            // READY is accepted: the new configuration replaces the old one wholesale.
            if (current != ObsState.IDLE && current != ObsState.READY) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.CONFIGURING, now),
                    SubarrayIntents.reconfigure(c.document()));
        }
        if (command instanceof LifecycleCommandEvent.Scan c) {
            if (current != ObsState.READY) {
                return notPermitted(state, command);
            }
            if (c.scanId() <= 0) {
                return Result.rejected(state, ErrorKind.VALIDATION_FAILED,
                        "Scan id must be a positive integer (received " + c.scanId() + ")");
            }
            return Result.of(state, SubarrayIntents.startScan(c.scanId()));
        }
        if (command instanceof LifecycleCommandEvent.EndScan) {
            if (current != ObsState.SCANNING) {
                return notPermitted(state, command);
            }
            return Result.of(state, SubarrayIntents.endScan());
        }
        if (command instanceof LifecycleCommandEvent.GoToIdle) {
            if (current != ObsState.READY) {
                return notPermitted(state, command);
            }
            return Result.of(state, SubarrayIntents.goToIdle());
        }
        if (command instanceof LifecycleCommandEvent.Abort) {
            if (!ABORTABLE.contains(current)) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.ABORTING, now),
                    SubarrayIntents.abort(current == ObsState.SCANNING));
        }
        if (command instanceof LifecycleCommandEvent.ObsReset) {
            if (current != ObsState.ABORTED) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.RESETTING, now), SubarrayIntents.obsReset());
        }
        if (command instanceof LifecycleCommandEvent.Restart) {
            if (current != ObsState.ABORTED && current != ObsState.FAULT) {
                return notPermitted(state, command);
            }
            return Result.of(state.withObsState(ObsState.RESTARTING, now), SubarrayIntents.restart());
        }

        return Result.unchanged(state);
    }

    private static Result notPermitted(SubarrayState state, LifecycleCommandEvent command) {
        return Result.rejected(state, ErrorKind.REJECTED_BY_STATE,
                command.commandName() + " not permitted in obsState " + state.obsState());
    }

    // ---------------------------------------------------------------------
    // Fleet outcomes
    // ---------------------------------------------------------------------

    private Result onOutcome(SubarrayState state, FleetOutcomeEvent outcome) {
        final ObsState current = state.obsState();
        final Instant now = outcome.timestamp();

        if (outcome instanceof FleetOutcomeEvent.ReceptorsUpdated e) {
            SubarrayState updated = state.withReceptors(e.assigned(), now);
            if (current == ObsState.RESOURCING) {
                ObsState next = e.assigned().isEmpty() ? ObsState.EMPTY : ObsState.IDLE;
                return Result.unchanged(updated.withObsState(next, now));
            }
            if (current == ObsState.RESTARTING) {
                return Result.unchanged(updated.withObsState(ObsState.EMPTY, now));
            }
            return Result.unchanged(updated);
        }
        if (outcome instanceof FleetOutcomeEvent.ConfigurationApplied e) {
            if (current != ObsState.CONFIGURING) {
                return Result.unchanged(state);
            }
            return Result.unchanged(state
                    .withConfiguration(e.configuration().common(), e.assignedNodes(), now)
                    .withObsState(ObsState.READY, now));
        }
        if (outcome instanceof FleetOutcomeEvent.ConfigurationRejected) {
            if (current != ObsState.CONFIGURING) {
                return Result.unchanged(state);
            }
            return Result.unchanged(state.withConfigurationCleared(now).withObsState(ObsState.IDLE, now));
        }
        if (outcome instanceof FleetOutcomeEvent.ConfigurationFaulted
                || outcome instanceof FleetOutcomeEvent.InconsistencyDetected) {
            return Result.unchanged(state.withScanId(0, now).withObsState(ObsState.FAULT, now));
        }
        if (outcome instanceof FleetOutcomeEvent.Deconfigured) {
            SubarrayState cleared = state.withConfigurationCleared(now);
            return switch (current) {
                case READY, RESETTING -> Result.unchanged(cleared.withObsState(ObsState.IDLE, now));
                default -> Result.unchanged(cleared);
            };
        }
        if (outcome instanceof FleetOutcomeEvent.ScanStarted e) {
            if (current != ObsState.READY) {
                return Result.unchanged(state);
            }
            return Result.unchanged(state.withScanId(e.scanId(), now).withObsState(ObsState.SCANNING, now));
        }
        if (outcome instanceof FleetOutcomeEvent.ScanEnded) {
            if (current == ObsState.SCANNING) {
                return Result.unchanged(state.withScanId(0, now).withObsState(ObsState.READY, now));
            }
            return Result.unchanged(state.withScanId(0, now));
        }
        if (outcome instanceof FleetOutcomeEvent.FleetAborted) {
            if (current != ObsState.ABORTING) {
                return Result.unchanged(state);
            }
            return Result.unchanged(state.withScanId(0, now).withObsState(ObsState.ABORTED, now));
        }

        // FleetReset, FleetIdled and FleetCommandFailed carry no state change.
        return Result.unchanged(state);
    }
}
