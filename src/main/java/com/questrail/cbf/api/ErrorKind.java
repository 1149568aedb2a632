package com.questrail.cbf.api;

/**
 * ErrorKind
 * -----------------------------------------------------------------------------
 * Classification of lifecycle failures.
 *
 * <p>Only {@link #INTERNAL_INCONSISTENCY} forces the subarray into
 * {@link ObsState#FAULT}. Every other kind is recovered locally and reported
 * to the caller through a non-OK {@link CommandResult}.</p>
 */
public enum ErrorKind
{
    /** A lifecycle command was issued in a state that does not permit it. */
    REJECTED_BY_STATE,

    /** A scan configuration failed validation. */
    VALIDATION_FAILED,

    /** A receptor is already owned by another subarray. */
    RESOURCE_CONFLICT,

    /** A fleet node was unreachable or returned a failure. */
    REMOTE_CALL_FAILED,

    /** An orchestrator invariant was violated. */
    INTERNAL_INCONSISTENCY
}
