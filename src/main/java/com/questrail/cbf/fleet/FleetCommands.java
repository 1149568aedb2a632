package com.questrail.cbf.fleet;

/**
 * Command and attribute names understood by fleet nodes.
 */
public final class FleetCommands
{
    private FleetCommands() {}

    // Attributes
    public static final String STATE = "state";
    public static final String HEALTH_STATE = "healthState";

    // Queries
    /** Returns the node's current operating state name, e.g. {@code ON}. */
    public static final String QUERY_STATE = "State";

    // Ownership and binding
    public static final String GET_SUBARRAY_MEMBERSHIP = "GetSubarrayMembership";
    public static final String SET_SUBARRAY_MEMBERSHIP = "SetSubarrayMembership";
    public static final String ADD_SUBARRAY_MEMBERSHIP = "AddSubarrayMembership";
    public static final String REMOVE_SUBARRAY_MEMBERSHIP = "RemoveSubarrayMembership";
    public static final String GET_FUNCTION_MODE = "GetFunctionMode";
    public static final String SET_FUNCTION_MODE = "SetFunctionMode";

    // Configuration
    public static final String CONFIGURE_BAND = "ConfigureBand";
    public static final String CONFIGURE_SCAN = "ConfigureScan";
    public static final String CONFIGURE_SEARCH_WINDOW = "ConfigureSearchWindow";
    public static final String UPDATE_DOPPLER_PHASE_CORRECTION = "UpdateDopplerPhaseCorrection";

    // Observation lifecycle
    public static final String SCAN = "Scan";
    public static final String END_SCAN = "EndScan";
    public static final String GO_TO_IDLE = "GoToIdle";
    public static final String ABORT = "Abort";
    public static final String OBS_RESET = "ObsReset";
}
