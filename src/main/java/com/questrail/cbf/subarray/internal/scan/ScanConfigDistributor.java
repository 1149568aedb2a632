package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.api.OutputLinkDistribution;
import com.questrail.cbf.fleet.ChangeEvent;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.GroupRef;
import com.questrail.cbf.fleet.NodeGroup;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.fleet.SubscriptionId;
import com.questrail.cbf.fleet.SubscriptionPoint;
import com.questrail.cbf.subarray.internal.health.DeviceHealthAggregator;
import com.questrail.cbf.subarray.internal.model.ModelUpdateScheduler;
import com.questrail.cbf.subarray.internal.resource.NodeGroupAssignments;
import com.questrail.cbf.subarray.internal.resource.ResourceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.cbf.subarray.internal.scan.ScanConfigKeys.*;

/**
 * ScanConfigDistributor
 * =============================================================================
 * Pushes a validated scan configuration to the fleet and tears it down again.
 *
 * <h2>Distribution</h2>
 * <ol>
 *   <li>{@code ConfigureBand} to each assigned VCC, then the common part of the
 *       configuration and the search windows to the VCC group</li>
 *   <li>telemetry subscriptions for model documents and Doppler corrections</li>
 *   <li>per function mode, in document order: the node joins its node groups,
 *       is bound to the mode and to this subarray, is watched for health, and
 *       receives one {@code ConfigureScan} with its augmented entry</li>
 *   <li>output-link planning for correlation nodes</li>
 * </ol>
 * A node is always a member of its node groups before the first command is
 * sent to it, so a failed distribution can be rolled back with
 * {@link #deconfigure()}.
 *
 * <h2>Teardown</h2>
 * {@link #deconfigure()} never throws. Each failed step is logged and skipped
 * so the teardown always completes. With nothing configured it sends nothing.
 */
public final class ScanConfigDistributor
{
    private static final Logger log = LoggerFactory.getLogger(ScanConfigDistributor.class);

    private final int subarrayId;
    private final DeviceFleetGateway gateway;
    private final DeviceHealthAggregator health;
    private final NodeGroupAssignments groups;
    private final ResourceAllocator allocator;
    private final ModelUpdateScheduler scheduler;
    private final OutputLinkPlanner planner;
    private final ObjectMapper mapper;

    private ScanConfiguration active;
    private final List<SubscriptionId> telemetry = new ArrayList<>();
    private final Map<FunctionMode, List<Integer>> assignments = new EnumMap<>(FunctionMode.class);
    private volatile OutputLinkDistribution outputLinks = OutputLinkDistribution.empty();

    public ScanConfigDistributor(int subarrayId,
                                 DeviceFleetGateway gateway,
                                 DeviceHealthAggregator health,
                                 NodeGroupAssignments groups,
                                 ResourceAllocator allocator,
                                 ModelUpdateScheduler scheduler,
                                 OutputLinkPlanner planner,
                                 ObjectMapper mapper) {
        this.subarrayId = subarrayId;
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.health = Objects.requireNonNull(health, "health");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ---------------------------------------------------------------------
    // Distribution
    // ---------------------------------------------------------------------

    /**
     * Sends {@code configuration} to the fleet.
     *
     * @throws RemoteCallFailedException on the first failed fleet call; the
     *         caller is expected to roll back with {@link #deconfigure()}
     */
    public synchronized void distribute(ScanConfiguration configuration) throws RemoteCallFailedException {
        Objects.requireNonNull(configuration, "configuration");
        active = configuration;
        CommonConfiguration common = configuration.common();

        configureChannelNodes(configuration);
        subscribeTelemetry(configuration);

        Map<FunctionMode, List<FspConfiguration>> byMode = new LinkedHashMap<>();
        for (FspConfiguration fsp : configuration.fsps()) {
            byMode.computeIfAbsent(fsp.mode(), m -> new ArrayList<>()).add(fsp);
        }
        for (Map.Entry<FunctionMode, List<FspConfiguration>> e : byMode.entrySet()) {
            for (FspConfiguration fsp : e.getValue()) {
                configureFunctionNode(common, fsp);
            }
        }

        outputLinks = planner.plan(configuration);
        log.info("Subarray {} configured as {} (band {}, {} function-mode nodes)",
                subarrayId, common.configId(), common.band().wireName(), configuration.fsps().size());
    }

    private void configureChannelNodes(ScanConfiguration configuration) throws RemoteCallFailedException {
        CommonConfiguration common = configuration.common();
        FrequencyBand band = common.band();

        for (Map.Entry<Integer, Long> e : allocator.dishSampleRates(band).entrySet()) {
            ObjectNode bandPayload = mapper.createObjectNode();
            bandPayload.put(FREQUENCY_BAND, band.wireName());
            bandPayload.put(DISH_SAMPLE_RATE, e.getValue());
            bandPayload.put(SAMPLES_PER_FRAME, band.samplesPerFrame());
            gateway.call(NodeRef.vcc(e.getKey()), FleetCommands.CONFIGURE_BAND, write(bandPayload));
        }

        GroupRef vccGroup = groups.snapshot(NodeGroup.VCC);
        ObjectNode scanPayload = mapper.createObjectNode();
        scanPayload.put(CONFIG_ID, common.configId());
        scanPayload.put(FREQUENCY_BAND, band.wireName());
        putTuning(scanPayload, common);
        scanPayload.put(OFFSET_STREAM_1, common.streamOffset1Hz());
        scanPayload.put(OFFSET_STREAM_2, common.streamOffset2Hz());
        JsonNode mask = configuration.document().path(CBF).get(RFI_FLAGGING_MASK);
        if (mask != null) {
            scanPayload.set(RFI_FLAGGING_MASK, mask.deepCopy());
        }
        gateway.callGroup(vccGroup, FleetCommands.CONFIGURE_SCAN, write(scanPayload));

        for (ObjectNode window : configuration.searchWindows()) {
            gateway.callGroup(vccGroup, FleetCommands.CONFIGURE_SEARCH_WINDOW, write(window));
        }
    }

    private void subscribeTelemetry(ScanConfiguration configuration) throws RemoteCallFailedException {
        for (Map.Entry<ModelType, SubscriptionPoint> e : configuration.modelSubscriptions().entrySet()) {
            ModelType type = e.getKey();
            SubscriptionPoint point = e.getValue();
            telemetry.add(gateway.subscribe(point.node(), point.attribute(), event -> onModelEvent(type, event)));
        }
        Optional<SubscriptionPoint> doppler = configuration.doppler();
        if (doppler.isPresent()) {
            SubscriptionPoint point = doppler.get();
            telemetry.add(gateway.subscribe(point.node(), point.attribute(), this::onDopplerEvent));
        }
    }

    private void configureFunctionNode(CommonConfiguration common, FspConfiguration fsp)
            throws RemoteCallFailedException {
        NodeRef node = NodeRef.fsp(fsp.fspId());
        FunctionMode mode = fsp.mode();
        ObjectNode augmented = augment(common, fsp);

        groups.add(NodeGroup.forMode(mode), node);
        groups.add(NodeGroup.FSP, node);
        List<Integer> modeNodes = assignments.computeIfAbsent(mode, m -> new ArrayList<>());
        if (!modeNodes.contains(fsp.fspId())) {
            modeNodes.add(fsp.fspId());
        }

        String bound = gateway.call(node, FleetCommands.GET_FUNCTION_MODE, null);
        if (FunctionMode.fromWireName(bound == null ? null : bound.trim()).orElse(FunctionMode.IDLE) == FunctionMode.IDLE) {
            gateway.call(node, FleetCommands.SET_FUNCTION_MODE, mode.wireName());
        }
        gateway.call(node, FleetCommands.ADD_SUBARRAY_MEMBERSHIP, Integer.toString(subarrayId));
        health.watch(node);
        gateway.call(node, FleetCommands.CONFIGURE_SCAN, write(augmented));
    }

    /**
     * Copy of a node's entry extended with the resolved common parameters and
     * the subarray's receptor facts.
     */
    ObjectNode augment(CommonConfiguration common, FspConfiguration fsp) {
        ObjectNode augmented = fsp.entry().deepCopy();
        FrequencyBand band = common.band();

        augmented.put(CONFIG_ID, common.configId());
        augmented.put(SUB_ID, subarrayId);
        augmented.put(FREQUENCY_BAND, band.wireName());
        putTuning(augmented, common);
        augmented.put(OFFSET_STREAM_1, common.streamOffset1Hz());
        augmented.put(OFFSET_STREAM_2, common.streamOffset2Hz());

        ArrayNode vccIds = augmented.putArray(SUBARRAY_VCC_IDS);
        allocator.assignedVccIds().forEach(vccIds::add);

        ArrayNode rates = augmented.putArray(FS_SAMPLE_RATES);
        allocator.fsSampleRates(band).forEach((vcc, rate) -> {
            ObjectNode r = rates.addObject();
            r.put(VCC_ID, vcc);
            r.put(FS_SAMPLE_RATE, rate);
        });

        if (fsp.mode() == FunctionMode.CORR) {
            ArrayNode corr = augmented.putArray(CORR_VCC_IDS);
            for (JsonNode receptor : fsp.entry().path(RECEPTORS)) {
                corr.add(allocator.vccIdOf(receptor.asInt()));
            }
        }
        return augmented;
    }

    private static void putTuning(ObjectNode target, CommonConfiguration common) {
        ArrayNode tuning = target.putArray(BAND_5_TUNING);
        tuning.add(common.band5Tuning().stream1Ghz());
        tuning.add(common.band5Tuning().stream2Ghz());
    }

    // ---------------------------------------------------------------------
    // Telemetry callbacks
    // ---------------------------------------------------------------------

    private void onModelEvent(ModelType type, ChangeEvent event) {
        if (event.isError()) {
            log.error("{} telemetry error from {}: {}", type, event.source(), event.error());
            return;
        }
        scheduler.onModelDocument(type, event.value());
    }

    private void onDopplerEvent(ChangeEvent event) {
        if (event.isError()) {
            log.error("Doppler telemetry error from {}: {}", event.source(), event.error());
            return;
        }
        for (NodeRef vcc : groups.snapshot(NodeGroup.VCC).members()) {
            gateway.callAsync(vcc, FleetCommands.UPDATE_DOPPLER_PHASE_CORRECTION, event.value());
        }
    }

    // ---------------------------------------------------------------------
    // Teardown
    // ---------------------------------------------------------------------

    /**
     * Full teardown of the active configuration.
     *
     * @return {@code true} if there was anything to tear down
     */
    public synchronized boolean deconfigure() {
        if (active == null && telemetry.isEmpty() && !groups.hasFunctionModeNodes()) {
            return false;
        }

        for (SubscriptionId id : telemetry) {
            try {
                gateway.unsubscribe(id);
            } catch (RemoteCallFailedException e) {
                log.warn("Deconfigure: failed to unsubscribe {}: {}", id, e.getMessage());
            }
        }
        telemetry.clear();

        for (GroupRef group : functionModeGroups()) {
            try {
                gateway.callGroup(group, FleetCommands.GO_TO_IDLE, null);
            } catch (RemoteCallFailedException e) {
                log.warn("Deconfigure: {} to {} failed: {}", FleetCommands.GO_TO_IDLE, group.group(), e.getMessage());
            }
        }

        for (NodeRef node : groups.snapshot(NodeGroup.FSP).members()) {
            try {
                gateway.call(node, FleetCommands.REMOVE_SUBARRAY_MEMBERSHIP, Integer.toString(subarrayId));
            } catch (RemoteCallFailedException e) {
                log.warn("Deconfigure: failed to release {}: {}", node, e.getMessage());
            }
            health.unwatch(node);
        }

        for (NodeGroup group : NodeGroup.values()) {
            if (group != NodeGroup.VCC) {
                groups.clear(group);
            }
        }

        String configId = active == null ? "" : active.common().configId();
        active = null;
        assignments.clear();
        scheduler.resetDeduplication();
        outputLinks = OutputLinkDistribution.empty();
        log.info("Subarray {} deconfigured {}", subarrayId, configId);
        return true;
    }

    // ---------------------------------------------------------------------
    // Observation commands
    // ---------------------------------------------------------------------

    public void startScan(int scanId) throws RemoteCallFailedException {
        String payload = Integer.toString(scanId);
        for (GroupRef group : activeGroups()) {
            gateway.callGroup(group, FleetCommands.SCAN, payload);
        }
    }

    public void endScan() throws RemoteCallFailedException {
        for (GroupRef group : activeGroups()) {
            gateway.callGroup(group, FleetCommands.END_SCAN, null);
        }
    }

    public void abort() {
        sendLogged(activeGroups(), FleetCommands.ABORT);
    }

    public void obsReset() {
        sendLogged(activeGroups(), FleetCommands.OBS_RESET);
    }

    /** Returns the channel-input nodes to idle. */
    public void goToIdleFleet() {
        sendLogged(List.of(groups.snapshot(NodeGroup.VCC)), FleetCommands.GO_TO_IDLE);
    }

    private void sendLogged(List<GroupRef> targets, String command) {
        for (GroupRef group : targets) {
            try {
                gateway.callGroup(group, command, null);
            } catch (RemoteCallFailedException e) {
                log.warn("{} to {} failed: {}", command, group.group(), e.getMessage());
            }
        }
    }

    /** VCC group followed by every non-empty function-mode group. */
    private List<GroupRef> activeGroups() {
        List<GroupRef> result = new ArrayList<>();
        GroupRef vcc = groups.snapshot(NodeGroup.VCC);
        if (!vcc.isEmpty()) {
            result.add(vcc);
        }
        result.addAll(functionModeGroups());
        return result;
    }

    private List<GroupRef> functionModeGroups() {
        List<GroupRef> result = new ArrayList<>();
        for (FunctionMode mode : FunctionMode.values()) {
            if (mode == FunctionMode.IDLE) {
                continue;
            }
            GroupRef group = groups.snapshot(NodeGroup.forMode(mode));
            if (!group.isEmpty()) {
                result.add(group);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    /** Function-mode node ids per mode of the active configuration. */
    public synchronized Map<FunctionMode, List<Integer>> assignments() {
        Map<FunctionMode, List<Integer>> copy = new EnumMap<>(FunctionMode.class);
        assignments.forEach((mode, ids) -> copy.put(mode, List.copyOf(ids)));
        return copy;
    }

    public synchronized boolean hasAssignments() {
        return !assignments.isEmpty() || groups.hasFunctionModeNodes();
    }

    public synchronized Optional<ScanConfiguration> activeConfiguration() {
        return Optional.ofNullable(active);
    }

    public OutputLinkDistribution outputLinks() {
        return outputLinks;
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise fleet payload", e);
        }
    }
}
