package com.questrail.cbf.subarray.internal.resource;

import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.GroupRef;
import com.questrail.cbf.fleet.NodeGroup;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.subarray.config.ReceptorMapping;
import com.questrail.cbf.subarray.internal.health.DeviceHealthAggregator;
import com.questrail.cbf.subarray.internal.scan.BandPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ResourceAllocator
 * =============================================================================
 * Claims and releases receptors for one subarray.
 *
 * <h2>Ownership</h2>
 * A receptor is owned through the subarray membership of its backing VCC:
 * {@code 0} means unowned, anything else is the owning subarray id. The
 * allocator reads membership before claiming and writes it back to {@code 0} on
 * release.
 *
 * <h2>Atomicity per receptor</h2>
 * For every id, the VCC membership, the health subscription, the VCC group
 * and the local assigned set change together or not at all. If the health
 * subscription cannot be established after the membership was written, the
 * membership is rolled back.
 *
 * <h2>Partial success</h2>
 * Errors for one id never stop processing of the remaining ids; the call is
 * reported as failed if any id failed.
 */
public final class ResourceAllocator
{
    private static final Logger log = LoggerFactory.getLogger(ResourceAllocator.class);

    private static final String UNOWNED = "0";

    private final int subarrayId;
    private final ReceptorMapping mapping;
    private final DeviceFleetGateway gateway;
    private final DeviceHealthAggregator health;
    private final NodeGroupAssignments groups;

    private final Set<Integer> assigned = new LinkedHashSet<>();

    public ResourceAllocator(int subarrayId,
                             ReceptorMapping mapping,
                             DeviceFleetGateway gateway,
                             DeviceHealthAggregator health,
                             NodeGroupAssignments groups) {
        this.subarrayId = subarrayId;
        this.mapping = Objects.requireNonNull(mapping, "mapping");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.health = Objects.requireNonNull(health, "health");
        this.groups = Objects.requireNonNull(groups, "groups");
    }

    /**
     * Claims each receptor in order.
     */
    public synchronized AllocationResult allocate(List<Integer> receptorIds) {
        List<String> errors = new ArrayList<>();
        ErrorKind firstKind = null;

        for (Integer id : receptorIds) {
            ErrorKind kind = allocateOne(id, errors);
            if (kind != null && firstKind == null) {
                firstKind = kind;
            }
        }
        return new AllocationResult(new ArrayList<>(assigned), errors, firstKind);
    }

    private ErrorKind allocateOne(int receptorId, List<String> errors) {
        var entry = mapping.resolve(receptorId);
        if (entry.isEmpty()) {
            errors.add("Invalid receptor " + receptorId + "; not in the receptor table");
            return ErrorKind.VALIDATION_FAILED;
        }
        if (assigned.contains(receptorId)) {
            log.warn("Receptor {} already assigned to subarray {}; skipping", receptorId, subarrayId);
            return null;
        }

        NodeRef vcc = NodeRef.vcc(entry.get().vccId());

        int owner;
        try {
            owner = parseMembership(gateway.call(vcc, FleetCommands.GET_SUBARRAY_MEMBERSHIP, null));
        } catch (RemoteCallFailedException e) {
            errors.add("Receptor " + receptorId + ": " + e.getMessage());
            return ErrorKind.REMOTE_CALL_FAILED;
        }
        if (owner != 0 && owner != subarrayId) {
            errors.add("Receptor " + receptorId + " already in use by subarray " + owner);
            return ErrorKind.RESOURCE_CONFLICT;
        }

        try {
            gateway.call(vcc, FleetCommands.SET_SUBARRAY_MEMBERSHIP, Integer.toString(subarrayId));
        } catch (RemoteCallFailedException e) {
            errors.add("Receptor " + receptorId + ": " + e.getMessage());
            return ErrorKind.REMOTE_CALL_FAILED;
        }

        try {
            health.watch(vcc);
        } catch (RemoteCallFailedException e) {
            clearMembership(vcc);
            errors.add("Receptor " + receptorId + ": " + e.getMessage());
            return ErrorKind.REMOTE_CALL_FAILED;
        }

        assigned.add(receptorId);
        groups.add(NodeGroup.VCC, vcc);
        log.debug("Receptor {} assigned to subarray {} via {}", receptorId, subarrayId, vcc);
        return null;
    }

    /**
     * Releases each receptor in order. Ids that are not assigned are skipped
     * with a warning.
     */
    public synchronized AllocationResult release(List<Integer> receptorIds) {
        for (Integer id : receptorIds) {
            if (!assigned.contains(id)) {
                log.warn("Receptor {} not assigned to subarray {}; nothing to release", id, subarrayId);
                continue;
            }
            NodeRef vcc = NodeRef.vcc(mapping.resolve(id).orElseThrow().vccId());
            health.unwatch(vcc);
            clearMembership(vcc);
            assigned.remove(id);
            groups.remove(NodeGroup.VCC, vcc);
            log.debug("Receptor {} released from subarray {}", id, subarrayId);
        }
        return new AllocationResult(new ArrayList<>(assigned), List.of(), null);
    }

    /**
     * Releases every assigned receptor.
     */
    public synchronized AllocationResult releaseAll() {
        return release(new ArrayList<>(assigned));
    }

    public synchronized List<Integer> assignedReceptors() {
        return List.copyOf(assigned);
    }

    /** VCC ids backing the assigned receptors, in assignment order. */
    public synchronized List<Integer> assignedVccIds() {
        List<Integer> ids = new ArrayList<>(assigned.size());
        for (int receptor : assigned) {
            ids.add(vccIdOf(receptor));
        }
        return ids;
    }

    public int vccIdOf(int receptorId) {
        return mapping.resolve(receptorId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown receptor " + receptorId))
                .vccId();
    }

    public GroupRef vccGroup() {
        return groups.snapshot(NodeGroup.VCC);
    }

    /**
     * Digitiser sample rate of each assigned receptor in {@code band}, keyed by
     * VCC id in assignment order.
     */
    public synchronized Map<Integer, Long> dishSampleRates(FrequencyBand band) {
        Map<Integer, Long> rates = new LinkedHashMap<>();
        for (int receptor : assigned) {
            ReceptorMapping.Entry e = mapping.resolve(receptor).orElseThrow();
            rates.put(e.vccId(), BandPlan.dishSampleRate(band, e.frequencyOffsetK()));
        }
        return rates;
    }

    /**
     * Frequency-slice sample rate of each assigned receptor in {@code band},
     * keyed by VCC id in assignment order.
     */
    public synchronized Map<Integer, Long> fsSampleRates(FrequencyBand band) {
        Map<Integer, Long> rates = new LinkedHashMap<>();
        for (int receptor : assigned) {
            ReceptorMapping.Entry e = mapping.resolve(receptor).orElseThrow();
            rates.put(e.vccId(), BandPlan.frequencySliceSampleRate(band, e.frequencyOffsetK()));
        }
        return rates;
    }

    private void clearMembership(NodeRef vcc) {
        try {
            gateway.call(vcc, FleetCommands.SET_SUBARRAY_MEMBERSHIP, UNOWNED);
        } catch (RemoteCallFailedException e) {
            log.warn("Failed to clear subarray membership of {}: {}", vcc, e.getMessage());
        }
    }

    private static int parseMembership(String reply) throws RemoteCallFailedException {
        if (reply == null || reply.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(reply.trim());
        } catch (NumberFormatException e) {
            throw new RemoteCallFailedException(FleetCommands.GET_SUBARRAY_MEMBERSHIP,
                    "unexpected membership reply '" + reply + "'", e);
        }
    }
}
