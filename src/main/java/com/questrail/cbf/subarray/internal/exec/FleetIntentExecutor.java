package com.questrail.cbf.subarray.internal.exec;

import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.NodeGroup;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.subarray.internal.events.FleetOutcomeEvent;
import com.questrail.cbf.subarray.internal.resource.AllocationResult;
import com.questrail.cbf.subarray.internal.resource.NodeGroupAssignments;
import com.questrail.cbf.subarray.internal.resource.ResourceAllocator;
import com.questrail.cbf.subarray.internal.scan.ScanConfigDistributor;
import com.questrail.cbf.subarray.internal.scan.ScanConfigValidator;
import com.questrail.cbf.subarray.internal.scan.ScanConfiguration;
import com.questrail.cbf.subarray.internal.scan.ValidationContext;
import com.questrail.cbf.subarray.internal.scan.ValidationFailedException;
import com.questrail.cbf.subarray.internal.state.SubarrayIntents;
import com.questrail.cbf.subarray.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Production {@link SubarrayIntentExecutor} backed by the resource allocator,
 * the scan configuration validator and the distributor.
 *
 * <p>A configuration that fails validation or distribution is rolled back with
 * a deconfigure and reported as rejected. Any other failure while applying a
 * configuration is reported as faulted.</p>
 */
public final class FleetIntentExecutor implements SubarrayIntentExecutor
{
    private static final Logger log = LoggerFactory.getLogger(FleetIntentExecutor.class);

    private final ResourceAllocator allocator;
    private final ScanConfigValidator validator;
    private final ScanConfigDistributor distributor;
    private final NodeGroupAssignments groups;
    private final WallClock wallClock;

    public FleetIntentExecutor(ResourceAllocator allocator,
                               ScanConfigValidator validator,
                               ScanConfigDistributor distributor,
                               NodeGroupAssignments groups,
                               WallClock wallClock) {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.distributor = Objects.requireNonNull(distributor, "distributor");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public List<FleetOutcomeEvent> execute(SubarrayIntents intents) {
        List<FleetOutcomeEvent> outcomes = new ArrayList<>();
        for (SubarrayIntents.Kind kind : intents.kinds()) {
            outcomes.add(executeOne(kind, intents));
        }
        return outcomes;
    }

    private FleetOutcomeEvent executeOne(SubarrayIntents.Kind kind, SubarrayIntents intents) {
        switch (kind) {
            case END_SCAN:
                try {
                    distributor.endScan();
                    return new FleetOutcomeEvent.ScanEnded(wallClock.now());
                } catch (RemoteCallFailedException e) {
                    return commandFailed(FleetCommands.END_SCAN, e);
                }

            case ABORT_FLEET:
                distributor.abort();
                return new FleetOutcomeEvent.FleetAborted(wallClock.now());

            case RESET_FLEET:
                distributor.obsReset();
                return new FleetOutcomeEvent.FleetReset(wallClock.now());

            case DECONFIGURE:
                distributor.deconfigure();
                return new FleetOutcomeEvent.Deconfigured(wallClock.now());

            case IDLE_FLEET:
                distributor.goToIdleFleet();
                return new FleetOutcomeEvent.FleetIdled(wallClock.now());

            case RELEASE_ALL_RECEPTORS:
                return receptorsUpdated(allocator.releaseAll());

            case ALLOCATE_RECEPTORS:
                return receptorsUpdated(allocator.allocate(intents.receptorIds()));

            case RELEASE_RECEPTORS:
                return receptorsUpdated(allocator.release(intents.receptorIds()));

            case APPLY_CONFIGURATION:
                return applyConfiguration(intents.configuration()
                        .orElseThrow(() -> new IllegalArgumentException("APPLY_CONFIGURATION without a document")));

            case START_SCAN:
                try {
                    distributor.startScan(intents.scanId());
                    return new FleetOutcomeEvent.ScanStarted(wallClock.now(), intents.scanId());
                } catch (RemoteCallFailedException e) {
                    return commandFailed(FleetCommands.SCAN, e);
                }

            default:
                throw new IllegalStateException("Unhandled intent " + kind);
        }
    }

    private FleetOutcomeEvent applyConfiguration(String document) {
        ValidationContext context = new ValidationContext(allocator.assignedReceptors(), assignedNodes());

        ScanConfiguration configuration;
        try {
            configuration = validator.validate(document, context);
        } catch (ValidationFailedException e) {
            log.warn("Scan configuration rejected: {}", e.getMessage());
            distributor.deconfigure();
            return new FleetOutcomeEvent.ConfigurationRejected(wallClock.now(), ErrorKind.VALIDATION_FAILED, e.getMessage());
        }

        try {
            distributor.distribute(configuration);
            return new FleetOutcomeEvent.ConfigurationApplied(wallClock.now(), configuration, distributor.assignments());
        } catch (RemoteCallFailedException e) {
            log.warn("Distribution of {} failed, rolling back: {}", configuration.common().configId(), e.getMessage());
            distributor.deconfigure();
            return new FleetOutcomeEvent.ConfigurationRejected(wallClock.now(), ErrorKind.REMOTE_CALL_FAILED,
                    "Distribution failed: " + e.getMessage() + " Configuration rolled back.");
        } catch (RuntimeException e) {
            log.error("Unexpected failure distributing {}", configuration.common().configId(), e);
            return new FleetOutcomeEvent.ConfigurationFaulted(wallClock.now(),
                    "Unexpected failure distributing " + configuration.common().configId() + ": " + e);
        }
    }

    private List<NodeRef> assignedNodes() {
        List<NodeRef> nodes = new ArrayList<>(groups.snapshot(NodeGroup.VCC).members());
        nodes.addAll(groups.snapshot(NodeGroup.FSP).members());
        return nodes;
    }

    private FleetOutcomeEvent receptorsUpdated(AllocationResult result) {
        return new FleetOutcomeEvent.ReceptorsUpdated(wallClock.now(), result.assigned(), result.errors(),
                result.errorKind());
    }

    private FleetOutcomeEvent commandFailed(String command, RemoteCallFailedException e) {
        log.warn("{} failed: {}", command, e.getMessage());
        return new FleetOutcomeEvent.FleetCommandFailed(wallClock.now(), command, e.getMessage());
    }
}
