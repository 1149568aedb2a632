package com.questrail.cbf.subarray.internal.scan;

import com.questrail.cbf.fleet.NodeRef;

import java.util.List;

/**
 * Subarray facts a scan configuration is validated against.
 *
 * @param receptors     receptors assigned to the subarray, in assignment order
 * @param assignedNodes every node currently assigned to the subarray; each must report ON
 */
public record ValidationContext(List<Integer> receptors, List<NodeRef> assignedNodes)
{
    public ValidationContext {
        receptors = List.copyOf(receptors);
        assignedNodes = List.copyOf(assignedNodes);
    }
}
