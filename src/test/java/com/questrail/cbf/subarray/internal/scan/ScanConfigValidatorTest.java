package com.questrail.cbf.subarray.internal.scan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.cbf.api.FrequencyBand;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.fleet.FleetCommands;
import com.questrail.cbf.fleet.NodeRef;
import com.questrail.cbf.fleet.RecordingFleetGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import static com.questrail.cbf.subarray.test.ScanConfigFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ScanConfigValidatorTest
 * -----------------------------------------------------------------------------
 * Validation and normalization of scan configuration documents against an
 * in-memory fleet. Subarray 1 holds receptors 1 and 2 (VCCs 1 and 2).
 */
class ScanConfigValidatorTest {

    private RecordingFleetGateway gateway;
    private ScanConfigValidator validator;
    private ValidationContext context;

    @BeforeEach
    void setUp() {
        gateway = new RecordingFleetGateway();
        validator = new ScanConfigValidator(1, 4, gateway, MAPPER);
        context = new ValidationContext(List.of(1, 2), List.of(NodeRef.vcc(1), NodeRef.vcc(2)));
    }

    private ScanConfiguration validate(ObjectNode document) throws ValidationFailedException {
        return validator.validate(document.toString(), context);
    }

    private String rejectionOf(ObjectNode document) {
        ValidationFailedException e = assertThrows(ValidationFailedException.class, () -> validate(document));
        assertTrue(e.getMessage().endsWith("Aborting configuration."), e.getMessage());
        return e.reason();
    }

    private static ObjectNode firstFsp(ObjectNode document) {
        return (ObjectNode) document.get("cbf").get("fsp").get(0);
    }

    // ---------------------------------------------------------------------
    // Accepted documents
    // ---------------------------------------------------------------------

    @Test
    void correlationConfigurationIsAcceptedAndNormalized() throws Exception {
        ScanConfiguration config = validate(correlation(1, "cfg-1"));

        assertEquals("cfg-1", config.common().configId());
        assertEquals(FrequencyBand.BAND_1, config.common().band());
        assertEquals(Band5Tuning.UNTUNED, config.common().band5Tuning());
        assertEquals(1, config.fsps().size());
        assertEquals(FunctionMode.CORR, config.fsps().get(0).mode());

        ObjectNode doc = config.document();
        assertEquals("[0,0]", doc.get("common").get("band_5_tuning").toString());
        assertEquals(0, doc.get("cbf").get("frequency_band_offset_stream1").asInt());
        assertEquals(0, doc.get("cbf").get("frequency_band_offset_stream2").asInt());

        JsonNode entry = firstFsp(doc);
        assertEquals("[1,2]", entry.get("receptors").toString());
        assertEquals(1, entry.get("channel_offset").asInt());
    }

    @Test
    void revalidatingANormalizedDocumentYieldsAnEqualDocument() throws Exception {
        ScanConfiguration first = validate(correlation(1, "cfg-1"));

        ScanConfiguration second = validator.validate(first.document().toString(), context);

        assertEquals(first.document(), second.document());
    }

    @Test
    void explicitValuesAreNotOverwritten() throws Exception {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("channel_offset", 7);
        firstFsp(doc).putArray("receptors").add(2);

        ScanConfiguration config = validate(doc);

        assertEquals(7, config.fsps().get(0).entry().get("channel_offset").asInt());
        assertEquals("[2]", config.fsps().get(0).entry().get("receptors").toString());
    }

    @Test
    void validationIssuesOnlyReadOnlyCalls() throws Exception {
        validate(correlation(1, "cfg-1"));

        Set<String> readOnly = Set.of(FleetCommands.QUERY_STATE,
                FleetCommands.GET_FUNCTION_MODE,
                FleetCommands.GET_SUBARRAY_MEMBERSHIP);
        gateway.calls().forEach(c -> assertTrue(readOnly.contains(c.command()), c.toString()));
        assertEquals(2, gateway.callsFor(FleetCommands.QUERY_STATE).size());
    }

    @Test
    void telemetryPointsAreResolved() throws Exception {
        ScanConfiguration config = validate(correlationWithTelemetry(1, "cfg-1"));

        assertEquals(Set.of(ModelType.DELAY, ModelType.JONES), config.modelSubscriptions().keySet());
        assertEquals("delayModel", config.modelSubscriptions().get(ModelType.DELAY).attribute());
        assertEquals("mid_csp/telmodel/delay", config.modelSubscriptions().get(ModelType.DELAY).deviceName());
        assertEquals(DOPPLER_POINT, config.doppler().orElseThrow().toString());
    }

    @Test
    void zoomWindowInsideItsSliceIsAccepted() throws Exception {
        ObjectNode doc = correlation(1, "cfg-1");
        // band 1, slice 1 spans [350, 550] MHz
        firstFsp(doc).put("zoom_factor", 1);
        firstFsp(doc).put("zoom_window_tuning", 450000);

        ScanConfiguration config = validate(doc);

        assertEquals(450e6, config.fsps().get(0).zoomWindowTuningHz(), 1e-3);
    }

    @Test
    void beamformingEntriesDefaultTheirReceptors() throws Exception {
        ObjectNode doc = correlation(1, "cfg-1");
        ArrayNode fsps = (ArrayNode) doc.get("cbf").get("fsp");
        fsps.add(pssEntry(2));
        fsps.add(pstEntry(3));

        ScanConfiguration config = validate(doc);

        assertEquals(List.of(FunctionMode.CORR, FunctionMode.PSS_BF, FunctionMode.PST_BF),
                config.fsps().stream().map(FspConfiguration::mode).toList());
        JsonNode searchBeam = config.fsps().get(1).entry().get("search_beam").get(0);
        assertEquals("[1]", searchBeam.get("receptor_ids").toString());
        JsonNode timingBeam = config.fsps().get(2).entry().get("timing_beam").get(0);
        assertEquals("[1,2]", timingBeam.get("receptor_ids").toString());
    }

    @Test
    void nodeAlreadyBoundToTheSameModeAndSubarrayIsAccepted() throws Exception {
        gateway.setFunctionMode(1, "CORR");
        gateway.addFspOwner(1, 1);

        assertDoesNotThrow(() -> validate(correlation(1, "cfg-1")));
    }

    @Test
    void validAveragingMapIsAccepted() throws Exception {
        ObjectNode doc = correlation(1, "cfg-1");
        ArrayNode map = firstFsp(doc).putArray("channel_averaging_map");
        map.addArray().add(0).add(2);
        map.addArray().add(744).add(0);

        assertDoesNotThrow(() -> validate(doc));
    }

    // ---------------------------------------------------------------------
    // Rejections
    // ---------------------------------------------------------------------

    @Test
    void unsupportedBandIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ObjectNode) doc.get("common")).put("frequency_band", "6");

        assertEquals("frequency_band '6' is not a supported band.", rejectionOf(doc));
    }

    @Test
    void documentForAnotherSubarrayIsRejected() {
        assertTrue(rejectionOf(correlation(2, "cfg-1")).startsWith("subarray_id 2 does not match"));
    }

    @Test
    void malformedJsonIsRejected() {
        ValidationFailedException e = assertThrows(ValidationFailedException.class,
                () -> validator.validate("{\"common\": ", context));
        assertTrue(e.reason().startsWith("Scan configuration is not valid JSON"));
    }

    @Test
    void emptyDocumentIsRejected() {
        ValidationFailedException e = assertThrows(ValidationFailedException.class,
                () -> validator.validate("", context));
        assertEquals("Scan configuration is empty.", e.reason());
    }

    @Test
    void missingConfigIdIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ObjectNode) doc.get("common")).remove("config_id");

        assertTrue(rejectionOf(doc).contains("config_id"));
    }

    @Test
    void zoomWindowOutsideItsSliceIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("zoom_factor", 1);
        firstFsp(doc).put("zoom_window_tuning", 600000);

        assertTrue(rejectionOf(doc).startsWith("zoom_window_tuning of fsp 1 must be within frequency slice 1"));
    }

    @Test
    void zoomWithoutTuningIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("zoom_factor", 2);

        assertTrue(rejectionOf(doc).startsWith("zoom_window_tuning is required"));
    }

    @Test
    void sliceBeyondTheBandIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("frequency_slice_id", 5);

        assertTrue(rejectionOf(doc).contains("outside [1, 4] for band 1"));
    }

    @Test
    void integrationFactorOutOfRangeIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("integration_factor", 11);

        assertTrue(rejectionOf(doc).startsWith("integration_factor 11"));
    }

    @Test
    void streamOffsetBeyondHalfASliceIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ObjectNode) doc.get("cbf")).put("frequency_band_offset_stream1", 100_000_001);

        assertTrue(rejectionOf(doc).contains("exceeds half a frequency slice"));
    }

    @Test
    void negativeStreamOffsetBeyondHalfASliceIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ObjectNode) doc.get("cbf")).put("frequency_band_offset_stream1", Long.MIN_VALUE);

        assertTrue(rejectionOf(doc).contains("exceeds half a frequency slice"));
    }

    @Test
    void streamOffsetBeyondTheRangeOfALongIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ObjectNode) doc.get("cbf")).put("frequency_band_offset_stream2", new BigInteger("99999999999999999999"));

        assertTrue(rejectionOf(doc).startsWith("frequency_band_offset_stream2 99999999999999999999 Hz"));
    }

    @Test
    void band5TuningOutsideTheBandIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ObjectNode common = (ObjectNode) doc.get("common");
        common.put("frequency_band", "5a");
        common.putArray("band_5_tuning").add(6.5).add(8.0);

        assertTrue(rejectionOf(doc).startsWith("band_5_tuning 8.0 GHz is outside"));
    }

    @Test
    void fspOutsideTheFleetIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("fsp_id", 5);

        assertEquals("fsp_id 5 is outside [1, 4].", rejectionOf(doc));
    }

    @Test
    void duplicateFspIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ((ArrayNode) doc.get("cbf").get("fsp")).add(corrEntry(1, 2));

        assertEquals("fsp_id 1 appears more than once.", rejectionOf(doc));
    }

    @Test
    void idleFunctionModeIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).put("function_mode", "IDLE");

        assertTrue(rejectionOf(doc).startsWith("function_mode 'IDLE'"));
    }

    @Test
    void fspOwnedByAnotherSubarrayIsRejected() {
        gateway.addFspOwner(1, 2);

        assertEquals("mid_csp_cbf/fsp/01 is owned by subarray(s) [2].", rejectionOf(correlation(1, "cfg-1")));
    }

    @Test
    void fspBoundToAnotherModeIsRejected() {
        gateway.setFunctionMode(1, "PSS-BF");

        assertEquals("mid_csp_cbf/fsp/01 is bound to PSS-BF, not CORR.", rejectionOf(correlation(1, "cfg-1")));
    }

    @Test
    void assignedNodeThatIsNotOnIsRejected() {
        gateway.setState(NodeRef.vcc(2), "OFF");

        assertEquals("Node mid_csp_cbf/vcc/002 is not ON (reports OFF).", rejectionOf(correlation(1, "cfg-1")));
    }

    @Test
    void unreachableAssignedNodeIsRejected() {
        gateway.failOn(NodeRef.vcc(1).name(), FleetCommands.QUERY_STATE, "timeout");

        assertTrue(rejectionOf(correlation(1, "cfg-1")).startsWith("Node mid_csp_cbf/vcc/001 is unreachable"));
    }

    @Test
    void unreachableSubscriptionPointIsRejected() {
        gateway.markUnreachable(DELAY_POINT);

        assertEquals("delay_model_subscription_point '" + DELAY_POINT + "' is not reachable.",
                rejectionOf(correlationWithTelemetry(1, "cfg-1")));
    }

    @Test
    void receptorNotAssignedToTheSubarrayIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).putArray("receptors").add(1).add(3);

        assertEquals("Receptor 3 of fsp 1 is not assigned to subarray 1.", rejectionOf(doc));
    }

    @Test
    void averagingMapWithMisplacedGroupIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).putArray("channel_averaging_map").addArray().add(1).add(2);

        assertTrue(rejectionOf(doc).contains("is not the first channel of group 0"));
    }

    @Test
    void averagingMapWithUnsupportedFactorIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        firstFsp(doc).putArray("channel_averaging_map").addArray().add(0).add(5);

        assertTrue(rejectionOf(doc).endsWith("must be one of [0, 1, 2, 3, 4, 6, 8]."));
    }

    @Test
    void tooManySearchWindowsAreRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ArrayNode windows = ((ObjectNode) doc.get("cbf")).putArray("search_window");
        for (int i = 0; i < 3; i++) {
            ObjectNode w = windows.addObject();
            w.put("search_window_id", 1);
            w.put("search_window_tuning", 1_000_000_000L);
            w.put("tdc_enable", false);
        }

        assertTrue(rejectionOf(doc).startsWith("At most 2 search windows"));
    }

    @Test
    void tooManySearchBeamsAreRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ObjectNode pss = pssEntry(2);
        ArrayNode beams = (ArrayNode) pss.get("search_beam");
        ObjectNode template = (ObjectNode) beams.get(0);
        beams.removeAll();
        for (int id = 1; id <= 193; id++) {
            beams.add(template.deepCopy().put("search_beam_id", id));
        }
        ((ArrayNode) doc.get("cbf").get("fsp")).add(pss);

        assertTrue(rejectionOf(doc).startsWith("fsp 2 has 193 search beams; at most 192 allowed."));
    }

    @Test
    void tooManyTimingBeamsAreRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ObjectNode pst = pstEntry(2);
        ArrayNode beams = (ArrayNode) pst.get("timing_beam");
        ObjectNode template = (ObjectNode) beams.get(0);
        beams.removeAll();
        for (int id = 1; id <= 17; id++) {
            beams.add(template.deepCopy().put("timing_beam_id", id));
        }
        ((ArrayNode) doc.get("cbf").get("fsp")).add(pst);

        assertTrue(rejectionOf(doc).startsWith("fsp 2 has 17 timing beams; at most 16 allowed."));
    }

    @Test
    void timingBeamWithBadAddressIsRejected() {
        ObjectNode doc = correlation(1, "cfg-1");
        ObjectNode pst = pstEntry(2);
        ((ObjectNode) pst.get("timing_beam").get(0)).put("timing_beam_destination_address", "192.168.0.256");
        ((ArrayNode) doc.get("cbf").get("fsp")).add(pst);

        assertTrue(rejectionOf(doc).contains("is not a valid IPv4 address"));
    }

    @Test
    void ipv4AddressesAreCheckedStrictly() {
        assertTrue(ScanConfigValidator.isIpv4("10.0.0.1"));
        assertTrue(ScanConfigValidator.isIpv4("255.255.255.255"));
        assertFalse(ScanConfigValidator.isIpv4("10.0.0"));
        assertFalse(ScanConfigValidator.isIpv4("10.0.0.1.2"));
        assertFalse(ScanConfigValidator.isIpv4("10.0..1"));
        assertFalse(ScanConfigValidator.isIpv4("10.0.0.a"));
        assertFalse(ScanConfigValidator.isIpv4("1000.0.0.1"));
        assertFalse(ScanConfigValidator.isIpv4("\u0661\u0669\u0662.168.0.1"));
    }
}
