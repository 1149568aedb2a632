package com.questrail.cbf.api;

import java.util.List;
import java.util.Map;

/**
 * SubarrayController
 * -----------------------------------------------------------------------------
 * External lifecycle surface of one subarray.
 *
 * <h2>Command contract</h2>
 * Every lifecycle command returns a {@link CommandResult}. Implementations never
 * let an exception escape a command method: remote failures, validation failures
 * and guard violations are all reported through the result code and message.
 * A command refused by a state guard returns {@link ResultCode#REJECTED} and has
 * no side effect.
 *
 * <h2>Read-only attributes</h2>
 * Attribute accessors may be called from any thread at any time and never block
 * on an in-flight lifecycle command.
 */
public interface SubarrayController
{
    // ---------------------------------------------------------------------
    // Lifecycle commands
    // ---------------------------------------------------------------------

    CommandResult addReceptors(List<Integer> receptorIds);

    CommandResult removeReceptors(List<Integer> receptorIds);

    CommandResult removeAllReceptors();

    /**
     * Validates and distributes a scan configuration document.
     *
     * @param configuration JSON scan configuration (common block + per-node array)
     */
    CommandResult configureScan(String configuration);

    CommandResult scan(int scanId);

    CommandResult endScan();

    CommandResult goToIdle();

    CommandResult abort();

    CommandResult obsReset();

    CommandResult restart();

    // ---------------------------------------------------------------------
    // Attributes
    // ---------------------------------------------------------------------

    int subarrayId();

    ObsState obsState();

    /** Active scan id; zero unless {@link ObsState#SCANNING}. */
    int scanId();

    /** Active configuration id; empty when unconfigured. */
    String configId();

    /** Zero-based band index, or zero when unconfigured. */
    int frequencyBand();

    /** Assigned receptors in assignment order. */
    List<Integer> assignedReceptors();

    /** Last-known status of assigned channel-input nodes, keyed by node name in assignment order. */
    Map<String, NodeStatus> vccStatus();

    /** Last-known status of assigned function-mode nodes, keyed by node name in assignment order. */
    Map<String, NodeStatus> fspStatus();

    /** Output-link placement of the active configuration. */
    OutputLinkDistribution outputLinks();

    ModelUpdatePhase modelPhase(ModelType type);
}
