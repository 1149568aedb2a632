package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.cbf.api.DeviceState;
import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.fleet.SubscriptionPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.questrail.cbf.subarray.internal.scan.ScanConfigKeys.*;

/**
 * ScanConfigValidator
 * =============================================================================
 * Checks a scan configuration document and normalizes it.
 *
 * <h2>Order of checks</h2>
 * <ol>
 *   <li>structure (common section, per-node list)</li>
 *   <li>liveness of every node currently assigned to the subarray</li>
 *   <li>frequency band, configuration id, subarray id and band-5 tuning</li>
 *   <li>stream frequency offsets</li>
 *   <li>reachability of referenced telemetry subscription points</li>
 *   <li>search windows</li>
 *   <li>each per-node entry, including its function-mode parameters</li>
 * </ol>
 * Validation stops at the first failure and reports it as a
 * {@link ValidationFailedException}. Nothing is sent to the fleet apart from
 * read-only queries and probes.
 *
 * <h2>Normalization</h2>
 * Missing optional fields are written into the returned document with their
 * defaults. Only absent fields are filled, so validating a normalized
 * document yields an equal document.
 */
public final class ScanConfigValidator
{
    private static final Logger log = LoggerFactory.getLogger(ScanConfigValidator.class);

    static final int MAX_SEARCH_WINDOWS = 2;
    static final int MAX_SEARCH_BEAMS = 192;
    static final int MAX_SEARCH_BEAM_ID = 1500;
    static final int MAX_TIMING_BEAMS = 16;
    static final int MAX_INTEGRATION_FACTOR = 10;
    static final int DEFAULT_CHANNEL_OFFSET = 1;
    static final Set<Integer> AVERAGING_FACTORS = Set.of(0, 1, 2, 3, 4, 6, 8);

    private static final Map<ModelType, String> MODEL_POINT_KEYS = Map.of(
            ModelType.DELAY, DELAY_MODEL_POINT,
            ModelType.JONES, JONES_MATRIX_POINT,
            ModelType.BEAM_WEIGHTS, BEAM_WEIGHTS_POINT);

    private final int subarrayId;
    private final int fspCount;
    private final DeviceFleetGateway gateway;
    private final ObjectMapper mapper;

    public ScanConfigValidator(int subarrayId, int fspCount, DeviceFleetGateway gateway, ObjectMapper mapper) {
        this.subarrayId = subarrayId;
        this.fspCount = fspCount;
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Validates {@code document} against the current subarray facts.
     *
     * @return the typed, normalized configuration
     * @throws ValidationFailedException carrying the first offending reason
     */
    public ScanConfiguration validate(String document, ValidationContext context) throws ValidationFailedException {
        Objects.requireNonNull(context, "context");

        // 1. structure
        ObjectNode root = parse(document);
        ObjectNode common = requireObject(root, COMMON, "Scan configuration");
        ObjectNode cbf = requireObject(root, CBF, "Scan configuration");
        ArrayNode fspEntries = requireArray(cbf, FSP, "cbf");

        // 2. liveness of assigned nodes
        for (NodeRef node : context.assignedNodes()) {
            checkOn(node);
        }

        // 3. common parameters
        String configId = requireText(common, CONFIG_ID, "common");
        if (configId.isBlank()) {
            throw fail("config_id must not be empty.");
        }
        int declaredSubarray = requireInt(common, SUBARRAY_ID, "common");
        if (declaredSubarray != subarrayId) {
            throw fail("subarray_id " + declaredSubarray + " does not match subarray " + subarrayId + ".");
        }
        String bandName = requireText(common, FREQUENCY_BAND, "common");
        FrequencyBand band = FrequencyBand.fromWireName(bandName)
                .orElseThrow(() -> fail("frequency_band '" + bandName + "' is not a supported band."));
        Band5Tuning tuning = band5Tuning(common, band);

        // 4. stream offsets
        long offset1 = streamOffset(cbf, OFFSET_STREAM_1);
        long offset2 = streamOffset(cbf, OFFSET_STREAM_2);

        CommonConfiguration resolved = new CommonConfiguration(configId, subarrayId, band, tuning, offset1, offset2);

        // 5. telemetry subscription points
        Map<ModelType, SubscriptionPoint> modelPoints = new EnumMap<>(ModelType.class);
        for (ModelType type : ModelType.values()) {
            SubscriptionPoint point = subscriptionPoint(cbf, MODEL_POINT_KEYS.get(type));
            if (point != null) {
                modelPoints.put(type, point);
            }
        }
        SubscriptionPoint doppler = subscriptionPoint(cbf, DOPPLER_POINT);

        // 6. search windows
        List<ObjectNode> searchWindows = searchWindows(cbf, context);

        // 7. per-node entries
        List<FspConfiguration> fsps = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (JsonNode element : fspEntries) {
            if (!element.isObject()) {
                throw fail("Each fsp entry must be an object.");
            }
            fsps.add(fspEntry((ObjectNode) element, resolved, context, seen));
        }

        log.debug("Scan configuration {} validated: band {}, {} fsp entries", configId, band.wireName(), fsps.size());
        return new ScanConfiguration(resolved, fsps, searchWindows, modelPoints, doppler, root);
    }

    // ---------------------------------------------------------------------
    // Common section
    // ---------------------------------------------------------------------

    private ObjectNode parse(String document) throws ValidationFailedException {
        if (document == null || document.isBlank()) {
            throw fail("Scan configuration is empty.");
        }
        JsonNode tree;
        try {
            tree = mapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw fail("Scan configuration is not valid JSON: " + e.getOriginalMessage());
        }
        if (tree == null || !tree.isObject()) {
            throw fail("Scan configuration must be a JSON object.");
        }
        return (ObjectNode) tree;
    }

    private void checkOn(NodeRef node) throws ValidationFailedException {
        String reply;
        try {
            reply = gateway.call(node, FleetCommands.QUERY_STATE, null);
        } catch (RemoteCallFailedException e) {
            throw fail("Node " + node + " is unreachable: " + e.getMessage());
        }
        DeviceState state = DeviceState.parse(reply);
        if (state != DeviceState.ON) {
            throw fail("Node " + node + " is not ON (reports " + state + ").");
        }
    }

    private Band5Tuning band5Tuning(ObjectNode common, FrequencyBand band) throws ValidationFailedException {
        JsonNode node = common.get(BAND_5_TUNING);
        if (node == null || node.isNull()) {
            ArrayNode untuned = common.putArray(BAND_5_TUNING);
            untuned.add(0).add(0);
            return Band5Tuning.UNTUNED;
        }
        if (!node.isArray() || node.size() != 2 || !node.get(0).isNumber() || !node.get(1).isNumber()) {
            throw fail("band_5_tuning must be an array of two numbers.");
        }
        Band5Tuning tuning = new Band5Tuning(node.get(0).asDouble(), node.get(1).asDouble());
        if (band.isBand5() && !tuning.isUntuned()) {
            for (double centre : new double[] {tuning.stream1Ghz(), tuning.stream2Ghz()}) {
                if (centre < band.rangeStartGhz() || centre > band.rangeStopGhz()) {
                    throw fail("band_5_tuning " + centre + " GHz is outside ["
                            + band.rangeStartGhz() + ", " + band.rangeStopGhz() + "] GHz for band "
                            + band.wireName() + ".");
                }
            }
        }
        return tuning;
    }

    private long streamOffset(ObjectNode cbf, String key) throws ValidationFailedException {
        JsonNode node = cbf.get(key);
        if (node == null || node.isNull()) {
            cbf.put(key, 0);
            return 0;
        }
        if (!node.isIntegralNumber()) {
            throw fail(key + " must be an integer number of Hz.");
        }
        if (!node.canConvertToLong()) {
            throw fail(key + " " + node.asText() + " Hz exceeds half a frequency slice.");
        }
        long offset = node.longValue();
        if (offset > BandPlan.MAX_STREAM_OFFSET_HZ || offset < -BandPlan.MAX_STREAM_OFFSET_HZ) {
            throw fail(key + " " + offset + " Hz exceeds half a frequency slice.");
        }
        return offset;
    }

    private SubscriptionPoint subscriptionPoint(ObjectNode cbf, String key) throws ValidationFailedException {
        JsonNode node = cbf.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw fail(key + " must be a string.");
        }
        SubscriptionPoint point;
        try {
            point = SubscriptionPoint.parse(node.asText());
        } catch (IllegalArgumentException e) {
            throw fail(key + " '" + node.asText() + "' is not a device attribute reference.");
        }
        if (!gateway.probe(point.toString())) {
            throw fail(key + " '" + point + "' is not reachable.");
        }
        return point;
    }

    private List<ObjectNode> searchWindows(ObjectNode cbf, ValidationContext context) throws ValidationFailedException {
        JsonNode node = cbf.get(SEARCH_WINDOW);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw fail("search_window must be an array.");
        }
        if (node.size() > MAX_SEARCH_WINDOWS) {
            throw fail("At most " + MAX_SEARCH_WINDOWS + " search windows are allowed (received " + node.size() + ").");
        }
        List<ObjectNode> windows = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isObject()) {
                throw fail("Each search_window entry must be an object.");
            }
            ObjectNode window = (ObjectNode) element;
            int id = requireInt(window, SEARCH_WINDOW_ID, "search_window");
            if (id != 1 && id != 2) {
                throw fail("search_window_id must be 1 or 2 (received " + id + ").");
            }
            requireNumber(window, SEARCH_WINDOW_TUNING, "search_window");
            boolean tdc = requireBoolean(window, TDC_ENABLE, "search_window");
            if (tdc) {
                ArrayNode destinations = requireArray(window, TDC_DESTINATION_ADDRESS, "search_window");
                for (JsonNode dest : destinations) {
                    int receptor = requireInt(dest, RECEPTOR_ID, "tdc_destination_address");
                    requireAssigned(receptor, context, "search window " + id);
                }
            }
            windows.add(window);
        }
        return windows;
    }

    // ---------------------------------------------------------------------
    // Per-node entries
    // ---------------------------------------------------------------------

    private FspConfiguration fspEntry(ObjectNode entry,
                                      CommonConfiguration common,
                                      ValidationContext context,
                                      Set<Integer> seen) throws ValidationFailedException {
        int fspId = requireInt(entry, FSP_ID, "fsp");
        if (fspId < 1 || fspId > fspCount) {
            throw fail("fsp_id " + fspId + " is outside [1, " + fspCount + "].");
        }
        if (!seen.add(fspId)) {
            throw fail("fsp_id " + fspId + " appears more than once.");
        }

        String modeName = requireText(entry, FUNCTION_MODE, "fsp " + fspId);
        FunctionMode mode = FunctionMode.fromWireName(modeName)
                .filter(m -> m != FunctionMode.IDLE)
                .orElseThrow(() -> fail("function_mode '" + modeName + "' of fsp " + fspId + " is not supported."));

        NodeRef node = NodeRef.fsp(fspId);
        checkBinding(node, mode);

        switch (mode) {
            case CORR -> validateCorrelation(entry, fspId, common, context);
            case PSS_BF -> validateSearchBeams(entry, fspId, context);
            case PST_BF -> validateTimingBeams(entry, fspId, context);
            default -> log.debug("No mode-specific checks for {} on fsp {}", mode, fspId);
        }
        return new FspConfiguration(fspId, mode, entry);
    }

    private void checkBinding(NodeRef node, FunctionMode requested) throws ValidationFailedException {
        try {
            String current = gateway.call(node, FleetCommands.GET_FUNCTION_MODE, null);
            FunctionMode bound = FunctionMode.fromWireName(current == null ? null : current.trim())
                    .orElse(FunctionMode.IDLE);
            if (bound != FunctionMode.IDLE && bound != requested) {
                throw fail(node + " is bound to " + bound.wireName() + ", not " + requested.wireName() + ".");
            }

            String members = gateway.call(node, FleetCommands.GET_SUBARRAY_MEMBERSHIP, null);
            List<Integer> owners = parseMembershipList(node, members);
            if (!owners.isEmpty() && !owners.contains(subarrayId)) {
                throw fail(node + " is owned by subarray(s) " + owners + ".");
            }
        } catch (RemoteCallFailedException e) {
            throw fail("Node " + node + " is unreachable: " + e.getMessage());
        }
    }

    private List<Integer> parseMembershipList(NodeRef node, String reply) throws ValidationFailedException {
        if (reply == null || reply.isBlank()) {
            return List.of();
        }
        try {
            JsonNode tree = mapper.readTree(reply);
            List<Integer> ids = new ArrayList<>();
            if (tree.isArray()) {
                tree.forEach(n -> ids.add(n.asInt()));
            } else if (tree.isInt() && tree.asInt() != 0) {
                ids.add(tree.asInt());
            }
            return ids;
        } catch (JsonProcessingException e) {
            throw fail(node + " returned an unreadable membership list.");
        }
    }

    private void validateCorrelation(ObjectNode entry,
                                     int fspId,
                                     CommonConfiguration common,
                                     ValidationContext context) throws ValidationFailedException {
        String where = "fsp " + fspId;
        defaultReceptors(entry, RECEPTORS, context.receptors(), context, where);

        FrequencyBand band = common.band();
        int slice = requireInt(entry, FREQUENCY_SLICE_ID, where);
        if (slice < 1 || slice > band.frequencySliceCount()) {
            throw fail("frequency_slice_id " + slice + " of " + where + " is outside [1, "
                    + band.frequencySliceCount() + "] for band " + band.wireName() + ".");
        }

        int zoom = requireInt(entry, ZOOM_FACTOR, where);
        if (zoom < 0 || zoom > BandPlan.MAX_ZOOM_FACTOR) {
            throw fail("zoom_factor " + zoom + " of " + where + " is outside [0, " + BandPlan.MAX_ZOOM_FACTOR + "].");
        }
        if (zoom > 0) {
            if (!entry.hasNonNull(ZOOM_WINDOW_TUNING)) {
                throw fail("zoom_window_tuning is required for " + where + " when zoom_factor is " + zoom + ".");
            }
            double tuningHz = requireNumber(entry, ZOOM_WINDOW_TUNING, where) * 1e3;
            boolean untunedBand5 = band.isBand5() && common.band5Tuning().isUntuned();
            if (!untunedBand5) {
                BandPlan.SliceSpan span = BandPlan.sliceSpan(common, slice);
                if (!span.contains(tuningHz)) {
                    throw fail("zoom_window_tuning of " + where + " must be within frequency slice "
                            + slice + " [" + span.startHz() + ", " + span.stopHz() + "] Hz.");
                }
            }
        }

        int integration = requireInt(entry, INTEGRATION_FACTOR, where);
        if (integration < 1 || integration > MAX_INTEGRATION_FACTOR) {
            throw fail("integration_factor " + integration + " of " + where + " is outside [1, "
                    + MAX_INTEGRATION_FACTOR + "].");
        }

        if (!entry.hasNonNull(CHANNEL_OFFSET)) {
            entry.put(CHANNEL_OFFSET, DEFAULT_CHANNEL_OFFSET);
        }
        if (requireInt(entry, CHANNEL_OFFSET, where) < 0) {
            throw fail("channel_offset of " + where + " must be >= 0.");
        }

        ArrayNode links = requireArray(entry, OUTPUT_LINK_MAP, where);
        for (JsonNode pair : links) {
            if (!isIntPair(pair)) {
                throw fail("output_link_map of " + where + " must contain pairs of integers.");
            }
        }

        JsonNode averaging = entry.get(CHANNEL_AVERAGING_MAP);
        if (averaging != null && !averaging.isNull()) {
            if (!averaging.isArray() || averaging.size() > BandPlan.CHANNEL_GROUPS) {
                throw fail("channel_averaging_map of " + where + " must have at most "
                        + BandPlan.CHANNEL_GROUPS + " entries.");
            }
            for (int i = 0; i < averaging.size(); i++) {
                JsonNode group = averaging.get(i);
                if (!isIntPair(group)) {
                    throw fail("channel_averaging_map of " + where + " dimensions are not correct.");
                }
                if (group.get(0).asInt() != i * BandPlan.CHANNELS_PER_GROUP) {
                    throw fail("channel_averaging_map[" + i + "][0] of " + where
                            + " is not the first channel of group " + i + ".");
                }
                if (!AVERAGING_FACTORS.contains(group.get(1).asInt())) {
                    throw fail("channel_averaging_map[" + i + "][1] of " + where
                            + " must be one of [0, 1, 2, 3, 4, 6, 8].");
                }
            }
        }
    }

    private void validateSearchBeams(ObjectNode entry, int fspId, ValidationContext context)
            throws ValidationFailedException {
        String where = "fsp " + fspId;
        int window = requireInt(entry, SEARCH_WINDOW_ID, where);
        if (window != 1 && window != 2) {
            throw fail("search_window_id of " + where + " must be 1 or 2.");
        }
        ArrayNode beams = requireArray(entry, SEARCH_BEAM, where);
        if (beams.size() > MAX_SEARCH_BEAMS) {
            throw fail(where + " has " + beams.size() + " search beams; at most " + MAX_SEARCH_BEAMS + " allowed.");
        }
        List<Integer> firstOnly = context.receptors().isEmpty() ? List.of() : List.of(context.receptors().get(0));
        for (JsonNode element : beams) {
            if (!element.isObject()) {
                throw fail("Each search_beam of " + where + " must be an object.");
            }
            ObjectNode beam = (ObjectNode) element;
            int id = requireInt(beam, SEARCH_BEAM_ID, where);
            if (id < 1 || id > MAX_SEARCH_BEAM_ID) {
                throw fail("search_beam_id " + id + " of " + where + " is outside [1, " + MAX_SEARCH_BEAM_ID + "].");
            }
            String beamWhere = "search beam " + id + " of " + where;
            defaultReceptors(beam, RECEPTOR_IDS, firstOnly, context, beamWhere);
            requireBoolean(beam, ENABLE_OUTPUT, beamWhere);
            requireInt(beam, AVERAGING_INTERVAL, beamWhere);
            requireIpv4(beam, SEARCH_BEAM_ADDRESS, beamWhere);
        }
    }

    private void validateTimingBeams(ObjectNode entry, int fspId, ValidationContext context)
            throws ValidationFailedException {
        String where = "fsp " + fspId;
        ArrayNode beams = requireArray(entry, TIMING_BEAM, where);
        if (beams.size() > MAX_TIMING_BEAMS) {
            throw fail(where + " has " + beams.size() + " timing beams; at most " + MAX_TIMING_BEAMS + " allowed.");
        }
        for (JsonNode element : beams) {
            if (!element.isObject()) {
                throw fail("Each timing_beam of " + where + " must be an object.");
            }
            ObjectNode beam = (ObjectNode) element;
            int id = requireInt(beam, TIMING_BEAM_ID, where);
            if (id < 1 || id > MAX_TIMING_BEAMS) {
                throw fail("timing_beam_id " + id + " of " + where + " is outside [1, " + MAX_TIMING_BEAMS + "].");
            }
            String beamWhere = "timing beam " + id + " of " + where;
            defaultReceptors(beam, RECEPTOR_IDS, context.receptors(), context, beamWhere);
            requireBoolean(beam, ENABLE_OUTPUT, beamWhere);
            requireIpv4(beam, TIMING_BEAM_ADDRESS, beamWhere);
        }
    }

    private void defaultReceptors(ObjectNode owner,
                                  String key,
                                  List<Integer> defaults,
                                  ValidationContext context,
                                  String where) throws ValidationFailedException {
        JsonNode node = owner.get(key);
        if (node == null || node.isNull()) {
            ArrayNode filled = owner.putArray(key);
            defaults.forEach(filled::add);
            return;
        }
        if (!node.isArray()) {
            throw fail(key + " of " + where + " must be an array of receptor ids.");
        }
        for (JsonNode id : node) {
            if (!id.isIntegralNumber()) {
                throw fail(key + " of " + where + " must be an array of receptor ids.");
            }
            requireAssigned(id.asInt(), context, where);
        }
    }

    private void requireAssigned(int receptor, ValidationContext context, String where)
            throws ValidationFailedException {
        if (!context.receptors().contains(receptor)) {
            throw fail("Receptor " + receptor + " of " + where + " is not assigned to subarray " + subarrayId + ".");
        }
    }

    // ---------------------------------------------------------------------
    // Field helpers
    // ---------------------------------------------------------------------

    private static ObjectNode requireObject(ObjectNode parent, String key, String where)
            throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isObject()) {
            throw fail(where + " is missing the '" + key + "' section.");
        }
        return (ObjectNode) node;
    }

    private static ArrayNode requireArray(JsonNode parent, String key, String where)
            throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isArray()) {
            throw fail(where + " is missing the '" + key + "' array.");
        }
        return (ArrayNode) node;
    }

    private static String requireText(JsonNode parent, String key, String where) throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isTextual()) {
            throw fail(where + " is missing string field '" + key + "'.");
        }
        return node.asText();
    }

    private static int requireInt(JsonNode parent, String key, String where) throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
            throw fail(where + " is missing integer field '" + key + "'.");
        }
        return node.asInt();
    }

    private static double requireNumber(JsonNode parent, String key, String where) throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isNumber()) {
            throw fail(where + " is missing numeric field '" + key + "'.");
        }
        return node.asDouble();
    }

    private static boolean requireBoolean(JsonNode parent, String key, String where)
            throws ValidationFailedException {
        JsonNode node = parent.get(key);
        if (node == null || !node.isBoolean()) {
            throw fail(where + " is missing boolean field '" + key + "'.");
        }
        return node.asBoolean();
    }

    private static void requireIpv4(JsonNode parent, String key, String where) throws ValidationFailedException {
        String address = requireText(parent, key, where);
        if (!isIpv4(address)) {
            throw fail(key + " '" + address + "' of " + where + " is not a valid IPv4 address.");
        }
    }

    private static boolean isIntPair(JsonNode node) {
        return node.isArray() && node.size() == 2
                && node.get(0).isIntegralNumber() && node.get(1).isIntegralNumber();
    }

    static boolean isIpv4(String address) {
        String[] parts = address.split("\\.", -1);
        if (parts.length != 4) {
            return false;
        }
        for (String part : parts) {
            if (part.isEmpty() || part.length() > 3) {
                return false;
            }
            for (int i = 0; i < part.length(); i++) {
                char c = part.charAt(i);
                if (c < '0' || c > '9') {
                    return false;
                }
            }
            if (Integer.parseInt(part) > 255) {
                return false;
            }
        }
        return true;
    }

    private static ValidationFailedException fail(String reason) {
        return new ValidationFailedException(reason);
    }
}
