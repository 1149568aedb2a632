package com.questrail.cbf.fleet;

/**
 * DeviceFleetGateway
 * =============================================================================
 * Port through which the orchestrator reaches remote processing nodes.
 *
 * <h2>Architectural role</h2>
 * The gateway is the only boundary between the subarray core and the fleet's
 * RPC / event-bus transport. Everything above it sees node references, group
 * snapshots, string payloads and typed change events; nothing transport
 * specific leaks through.
 *
 * <h2>Failure model</h2>
 * Every operation that talks to a node reports failure with
 * {@link RemoteCallFailedException}. The gateway never retries on its own;
 * retry policy, if any, belongs to the caller.
 *
 * <h2>Threading</h2>
 * Implementations must be safe for concurrent use: lifecycle commands and
 * model-update fan-out call in from different threads. Change-event callbacks
 * are delivered on gateway-owned threads.
 */
public interface DeviceFleetGateway
{
    /**
     * Synchronous command invocation on a single node.
     *
     * @param node    target node
     * @param command command name (see {@link FleetCommands})
     * @param payload command argument; may be {@code null} for argument-less commands
     * @return the command's reply, possibly empty
     */
    String call(NodeRef node, String command, String payload) throws RemoteCallFailedException;

    /**
     * Issues the same command to every member of a group snapshot.
     *
     * <p>Empty groups are a no-op. A failure from any member fails the call;
     * members after the failing one may or may not have received the command.</p>
     */
    void callGroup(GroupRef group, String command, String payload) throws RemoteCallFailedException;

    /**
     * Fire-and-forget invocation: the command is queued for the node and this
     * method returns without waiting for a reply. Transport failures are
     * reported by the gateway's own logging.
     */
    void callAsync(NodeRef node, String command, String payload);

    /**
     * Subscribes to change events of one node attribute.
     */
    SubscriptionId subscribe(NodeRef node, String attribute, ChangeEventCallback callback)
            throws RemoteCallFailedException;

    void unsubscribe(SubscriptionId subscription) throws RemoteCallFailedException;

    /**
     * Single liveness probe of a referenced node or telemetry point. Never retries.
     *
     * @return {@code true} if the reference answered
     */
    boolean probe(String reference);
}
