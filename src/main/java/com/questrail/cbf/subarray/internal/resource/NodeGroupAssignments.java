package com.questrail.cbf.subarray.internal.resource;

import com.questrail.cbf.fleet.GroupRef;
import com.questrail.cbf.fleet.NodeGroup;
import com.questrail.cbf.fleet.NodeRef;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * NodeGroupAssignments
 * -----------------------------------------------------------------------------
 * Live membership of every node group the subarray addresses.
 *
 * <h2>Ownership</h2>
 * The {@link NodeGroup#VCC} group is written by the resource allocator; the
 * function-mode groups are written by the configuration distributor. Any
 * component may read a {@link GroupRef} snapshot at any time, in particular
 * the model-update fan-out, which runs on scheduler threads.
 *
 * <p>Members keep their insertion order and are never duplicated.</p>
 */
public final class NodeGroupAssignments
{
    private final Map<NodeGroup, Set<NodeRef>> groups = new EnumMap<>(NodeGroup.class);

    public NodeGroupAssignments() {
        for (NodeGroup group : NodeGroup.values()) {
            groups.put(group, new LinkedHashSet<>());
        }
    }

    public synchronized void add(NodeGroup group, NodeRef node) {
        groups.get(group).add(node);
    }

    public synchronized void remove(NodeGroup group, NodeRef node) {
        groups.get(group).remove(node);
    }

    public synchronized void clear(NodeGroup group) {
        groups.get(group).clear();
    }

    public synchronized GroupRef snapshot(NodeGroup group) {
        return new GroupRef(group, new ArrayList<>(groups.get(group)));
    }

    public synchronized boolean isEmpty(NodeGroup group) {
        return groups.get(group).isEmpty();
    }

    /**
     * Whether any function-mode group (anything other than {@link NodeGroup#VCC})
     * has members.
     */
    public synchronized boolean hasFunctionModeNodes() {
        for (Map.Entry<NodeGroup, Set<NodeRef>> e : groups.entrySet()) {
            if (e.getKey() != NodeGroup.VCC && !e.getValue().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Node ids of a group's members, in membership order. */
    public synchronized List<Integer> memberIds(NodeGroup group) {
        List<Integer> ids = new ArrayList<>();
        for (NodeRef node : groups.get(group)) {
            ids.add(node.id());
        }
        return ids;
    }
}
