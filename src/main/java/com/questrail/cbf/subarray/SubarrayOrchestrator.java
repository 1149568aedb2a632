package com.questrail.cbf.subarray;

import com.questrail.cbf.api.CommandResult;
import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.api.ModelUpdatePhase;
import com.questrail.cbf.api.NodeStatus;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.api.OutputLinkDistribution;
import com.questrail.cbf.api.SubarrayController;
import com.questrail.cbf.subarray.internal.events.FleetOutcomeEvent;
import com.questrail.cbf.subarray.internal.events.LifecycleCommandEvent;
import com.questrail.cbf.subarray.internal.events.SubarrayEvent;
import com.questrail.cbf.subarray.internal.exec.SubarrayIntentExecutor;
import com.questrail.cbf.subarray.internal.health.DeviceHealthAggregator;
import com.questrail.cbf.subarray.internal.model.ModelUpdateScheduler;
import com.questrail.cbf.subarray.internal.resource.NodeGroupAssignments;
import com.questrail.cbf.subarray.internal.resource.ResourceAllocator;
import com.questrail.cbf.subarray.internal.scan.ScanConfigDistributor;
import com.questrail.cbf.subarray.internal.state.InternalInconsistencyException;
import com.questrail.cbf.subarray.internal.state.SubarrayInvariants;
import com.questrail.cbf.subarray.internal.state.SubarrayState;
import com.questrail.cbf.subarray.internal.state.SubarrayStateReducer;
import com.questrail.cbf.subarray.internal.time.WallClock;
import com.questrail.cbf.subarray.observability.NullObservabilitySink;
import com.questrail.cbf.subarray.observability.SubarrayErrorEvent;
import com.questrail.cbf.subarray.observability.SubarrayObservabilitySink;
import com.questrail.cbf.subarray.observability.SubarrayStateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SubarrayOrchestrator
 * =============================================================================
 * Production {@link SubarrayController}: owns the subarray state and drives
 * the fleet through the reducer / executor loop.
 *
 * <h2>Command processing</h2>
 * <pre>
 *   command event -> reducer -> transient state + intents
 *                 -> executor -> outcome events
 *                 -> reducer (per outcome) -> stable state
 *                 -> invariant check
 * </pre>
 * The first failure carried by an outcome becomes the command's result.
 *
 * <h2>Threading model</h2>
 * Lifecycle commands are serialized by a single lock and run to completion on
 * the caller's thread. The current {@link SubarrayState} is published through
 * a volatile field so attribute reads and the model-update scheduler never
 * wait for an in-flight command.
 *
 * <h2>Failure containment</h2>
 * No exception leaves a command method. A broken invariant or an unexpected
 * runtime failure is reported to the observability sink and moves the
 * subarray to {@link ObsState#FAULT}.
 */
public final class SubarrayOrchestrator implements SubarrayController
{
    private static final Logger log = LoggerFactory.getLogger(SubarrayOrchestrator.class);

    private final SubarrayStateReducer reducer;
    private final SubarrayIntentExecutor executor;
    private final ResourceAllocator allocator;
    private final NodeGroupAssignments groups;
    private final DeviceHealthAggregator health;
    private final ScanConfigDistributor distributor;
    private final ModelUpdateScheduler scheduler;
    private final WallClock wallClock;
    private final SubarrayObservabilitySink observabilitySink;

    private final Object lifecycleLock = new Object();
    private volatile SubarrayState state;

    public SubarrayOrchestrator(int subarrayId,
                                SubarrayStateReducer reducer,
                                SubarrayIntentExecutor executor,
                                ResourceAllocator allocator,
                                NodeGroupAssignments groups,
                                DeviceHealthAggregator health,
                                ScanConfigDistributor distributor,
                                ModelUpdateScheduler scheduler,
                                WallClock wallClock,
                                SubarrayObservabilitySink observabilitySink) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.health = Objects.requireNonNull(health, "health");
        this.distributor = Objects.requireNonNull(distributor, "distributor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.state = SubarrayState.initial(subarrayId, wallClock.now());
    }

    // ---------------------------------------------------------------------
    // Lifecycle commands
    // ---------------------------------------------------------------------

    @Override
    public CommandResult addReceptors(List<Integer> receptorIds) {
        if (receptorIds == null || receptorIds.contains(null)) {
            return CommandResult.failed(ErrorKind.VALIDATION_FAILED, "Receptor ids are required");
        }
        return submit(new LifecycleCommandEvent.AddReceptors(wallClock.now(), receptorIds));
    }

    @Override
    public CommandResult removeReceptors(List<Integer> receptorIds) {
        if (receptorIds == null || receptorIds.contains(null)) {
            return CommandResult.failed(ErrorKind.VALIDATION_FAILED, "Receptor ids are required");
        }
        return submit(new LifecycleCommandEvent.RemoveReceptors(wallClock.now(), receptorIds));
    }

    @Override
    public CommandResult removeAllReceptors() {
        return submit(new LifecycleCommandEvent.RemoveAllReceptors(wallClock.now()));
    }

    @Override
    public CommandResult configureScan(String configuration) {
        return submit(new LifecycleCommandEvent.ConfigureScan(wallClock.now(),
                configuration == null ? "" : configuration));
    }

    @Override
    public CommandResult scan(int scanId) {
        return submit(new LifecycleCommandEvent.Scan(wallClock.now(), scanId));
    }

    @Override
    public CommandResult endScan() {
        return submit(new LifecycleCommandEvent.EndScan(wallClock.now()));
    }

    @Override
    public CommandResult goToIdle() {
        return submit(new LifecycleCommandEvent.GoToIdle(wallClock.now()));
    }

    @Override
    public CommandResult abort() {
        return submit(new LifecycleCommandEvent.Abort(wallClock.now()));
    }

    @Override
    public CommandResult obsReset() {
        return submit(new LifecycleCommandEvent.ObsReset(wallClock.now()));
    }

    @Override
    public CommandResult restart() {
        return submit(new LifecycleCommandEvent.Restart(wallClock.now()));
    }

    private CommandResult submit(LifecycleCommandEvent command) {
        synchronized (lifecycleLock) {
            try {
                return process(command);
            } catch (RuntimeException e) {
                String reason = command.commandName() + " failed unexpectedly: " + e;
                observabilitySink.onError(new SubarrayErrorEvent(wallClock.now(), reason, e));
                step(new FleetOutcomeEvent.InconsistencyDetected(wallClock.now(), reason));
                return CommandResult.failed(ErrorKind.INTERNAL_INCONSISTENCY, reason);
            }
        }
    }

    private CommandResult process(LifecycleCommandEvent command) {
        SubarrayStateReducer.Result accepted = step(command);
        if (accepted.isRejected()) {
            SubarrayStateReducer.Rejection rejection = accepted.rejection().get();
            log.warn("{} refused: {}", command.commandName(), rejection.reason());
            return rejection.kind() == ErrorKind.REJECTED_BY_STATE
                    ? CommandResult.rejected(rejection.reason())
                    : CommandResult.failed(rejection.kind(), rejection.reason());
        }

        CommandResult failure = null;
        Deque<FleetOutcomeEvent> outcomes = new ArrayDeque<>(executor.execute(accepted.intents()));
        while (!outcomes.isEmpty()) {
            FleetOutcomeEvent outcome = outcomes.poll();
            if (failure == null && outcome.failure().isPresent()) {
                failure = CommandResult.failed(outcome.failure().get(), outcome.detail());
            }
            SubarrayStateReducer.Result next = step(outcome);
            if (!next.intents().isEmpty()) {
                outcomes.addAll(executor.execute(next.intents()));
            }
        }

        try {
            SubarrayInvariants.verify(state, allocator.assignedReceptors(), groups.hasFunctionModeNodes());
        } catch (InternalInconsistencyException e) {
            observabilitySink.onError(new SubarrayErrorEvent(wallClock.now(), e.getMessage(), e));
            step(new FleetOutcomeEvent.InconsistencyDetected(wallClock.now(), e.getMessage()));
            return CommandResult.failed(ErrorKind.INTERNAL_INCONSISTENCY, e.getMessage());
        }

        if (failure != null) {
            return failure;
        }
        return CommandResult.ok(command.commandName() + " completed; obsState " + state.obsState());
    }

    /**
     * Applies one event to the current state and publishes the result.
     * Caller holds the lifecycle lock.
     */
    private SubarrayStateReducer.Result step(SubarrayEvent event) {
        SubarrayState oldState = state;
        SubarrayStateReducer.Result result = reducer.apply(oldState, event);
        state = result.newState();

        observabilitySink.onStateTransition(new SubarrayStateTransitionEvent(
                wallClock.now(),
                oldState,
                result.newState(),
                event,
                result.intents()));
        return result;
    }

    // ---------------------------------------------------------------------
    // Attributes
    // ---------------------------------------------------------------------

    /** Current state snapshot. */
    public SubarrayState currentState() {
        return state;
    }

    @Override
    public int subarrayId() {
        return state.subarrayId();
    }

    @Override
    public ObsState obsState() {
        return state.obsState();
    }

    @Override
    public int scanId() {
        return state.scanId();
    }

    @Override
    public String configId() {
        return state.configId();
    }

    @Override
    public int frequencyBand() {
        return state.band().map(FrequencyBand::index).orElse(0);
    }

    @Override
    public List<Integer> assignedReceptors() {
        return state.receptors();
    }

    @Override
    public Map<String, NodeStatus> vccStatus() {
        return health.vccView();
    }

    @Override
    public Map<String, NodeStatus> fspStatus() {
        return health.fspView();
    }

    @Override
    public OutputLinkDistribution outputLinks() {
        return distributor.outputLinks();
    }

    @Override
    public ModelUpdatePhase modelPhase(ModelType type) {
        return scheduler.phase(type);
    }
}
