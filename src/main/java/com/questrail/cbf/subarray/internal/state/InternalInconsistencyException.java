package com.questrail.cbf.subarray.internal.state;

/**
 * A subarray invariant no longer holds. Always fatal for the current
 * configuration: the subarray is moved to FAULT and must be restarted.
 */
public final class InternalInconsistencyException extends RuntimeException
{
    public InternalInconsistencyException(String message) {
        super(message);
    }
}
