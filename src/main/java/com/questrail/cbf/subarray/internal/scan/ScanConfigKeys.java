package com.questrail.cbf.subarray.internal.scan;

/**
 * Field names of the scan configuration document.
 */
final class ScanConfigKeys
{
    private ScanConfigKeys() {}

    // Sections
    static final String COMMON = "common";
    static final String CBF = "cbf";
    static final String FSP = "fsp";
    static final String SEARCH_WINDOW = "search_window";

    // common
    static final String CONFIG_ID = "config_id";
    static final String SUBARRAY_ID = "subarray_id";
    static final String FREQUENCY_BAND = "frequency_band";
    static final String BAND_5_TUNING = "band_5_tuning";

    // cbf
    static final String OFFSET_STREAM_1 = "frequency_band_offset_stream1";
    static final String OFFSET_STREAM_2 = "frequency_band_offset_stream2";
    static final String DELAY_MODEL_POINT = "delay_model_subscription_point";
    static final String JONES_MATRIX_POINT = "jones_matrix_subscription_point";
    static final String BEAM_WEIGHTS_POINT = "timing_beam_weights_subscription_point";
    static final String DOPPLER_POINT = "doppler_phase_corr_subscription_point";
    static final String RFI_FLAGGING_MASK = "rfi_flagging_mask";

    // search window
    static final String SEARCH_WINDOW_ID = "search_window_id";
    static final String SEARCH_WINDOW_TUNING = "search_window_tuning";
    static final String TDC_ENABLE = "tdc_enable";
    static final String TDC_DESTINATION_ADDRESS = "tdc_destination_address";
    static final String RECEPTOR_ID = "receptor_id";

    // fsp entry
    static final String FSP_ID = "fsp_id";
    static final String FUNCTION_MODE = "function_mode";
    static final String RECEPTORS = "receptors";
    static final String FREQUENCY_SLICE_ID = "frequency_slice_id";
    static final String ZOOM_FACTOR = "zoom_factor";
    static final String ZOOM_WINDOW_TUNING = "zoom_window_tuning";
    static final String INTEGRATION_FACTOR = "integration_factor";
    static final String CHANNEL_OFFSET = "channel_offset";
    static final String OUTPUT_LINK_MAP = "output_link_map";
    static final String CHANNEL_AVERAGING_MAP = "channel_averaging_map";

    // beams
    static final String SEARCH_BEAM = "search_beam";
    static final String SEARCH_BEAM_ID = "search_beam_id";
    static final String SEARCH_BEAM_ADDRESS = "search_beam_destination_address";
    static final String AVERAGING_INTERVAL = "averaging_interval";
    static final String TIMING_BEAM = "timing_beam";
    static final String TIMING_BEAM_ID = "timing_beam_id";
    static final String TIMING_BEAM_ADDRESS = "timing_beam_destination_address";
    static final String RECEPTOR_IDS = "receptor_ids";
    static final String ENABLE_OUTPUT = "enable_output";

    // augmentation added by the distributor
    static final String SUB_ID = "sub_id";
    static final String SUBARRAY_VCC_IDS = "subarray_vcc_ids";
    static final String FS_SAMPLE_RATES = "fs_sample_rates";
    static final String CORR_VCC_IDS = "corr_vcc_ids";
    static final String VCC_ID = "vcc_id";
    static final String FS_SAMPLE_RATE = "fs_sample_rate";
    static final String DISH_SAMPLE_RATE = "dish_sample_rate";
    static final String SAMPLES_PER_FRAME = "samples_per_frame";
}
