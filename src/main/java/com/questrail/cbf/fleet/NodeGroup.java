package com.questrail.cbf.fleet;

import com.questrail.cbf.api.FunctionMode;

/**
 * Named node groups a subarray addresses with group commands.
 */
public enum NodeGroup
{
    /** Channel-input nodes backing the assigned receptors. */
    VCC,

    /** All function-mode nodes assigned to the subarray, regardless of mode. */
    FSP,

    FSP_CORR,
    FSP_PSS,
    FSP_PST,
    FSP_VLBI;

    /**
     * Returns the per-mode group for a function mode.
     *
     * @throws IllegalArgumentException for {@link FunctionMode#IDLE}
     */
    public static NodeGroup forMode(FunctionMode mode) {
        return switch (mode) {
            case CORR -> FSP_CORR;
            case PSS_BF -> FSP_PSS;
            case PST_BF -> FSP_PST;
            case VLBI -> FSP_VLBI;
            case IDLE -> throw new IllegalArgumentException("IDLE has no node group");
        };
    }
}
