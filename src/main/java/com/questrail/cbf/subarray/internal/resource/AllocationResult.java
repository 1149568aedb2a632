package com.questrail.cbf.subarray.internal.resource;

import com.questrail.cbf.api.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one allocate or release call.
 *
 * @param assigned  receptors assigned after the call, in assignment order
 * @param errors    per-receptor failure messages; empty when every id succeeded
 * @param errorKind classification of the first failure, or {@code null}
 */
public record AllocationResult(List<Integer> assigned, List<String> errors, ErrorKind errorKind)
{
    public AllocationResult {
        assigned = List.copyOf(assigned);
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public Optional<ErrorKind> failure() {
        return Optional.ofNullable(errorKind);
    }
}
