package com.questrail.cbf.api;

/**
 * Outcome class of a lifecycle command.
 */
public enum ResultCode
{
    /** The command completed and the subarray reached its target state. */
    OK,

    /** The command was accepted but did not fully succeed. */
    FAILED,

    /** The command was refused by a state guard; nothing was done. */
    REJECTED
}
