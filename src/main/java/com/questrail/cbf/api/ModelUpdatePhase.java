package com.questrail.cbf.api;

/**
 * Progress of epoch-scheduled updates for one model type.
 */
public enum ModelUpdatePhase
{
    /** Nothing accepted yet, or everything pending was discarded. */
    IDLE,

    /** At least one entry is waiting for its epoch. */
    SCHEDULED,

    /** The last due entry was fanned out and nothing is pending. */
    APPLIED
}
