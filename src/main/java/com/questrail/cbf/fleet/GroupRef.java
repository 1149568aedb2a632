package com.questrail.cbf.fleet;

import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a node group's membership at the time a group command
 * is issued.
 */
public record GroupRef(NodeGroup group, List<NodeRef> members)
{
    public GroupRef {
        Objects.requireNonNull(group, "group");
        members = List.copyOf(members);
    }

    public static GroupRef empty(NodeGroup group) {
        return new GroupRef(group, List.of());
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
