package com.questrail.cbf.fleet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * RecordingFleetGateway
 * -----------------------------------------------------------------------------
 * In-memory fleet for tests.
 *
 * <p>Simulates the node state the orchestrator depends on:</p>
 * <ul>
 *   <li>VCC ownership (single owner, {@code 0} when free)</li>
 *   <li>FSP ownership (set of subarrays) and function-mode binding</li>
 *   <li>node liveness, reported by {@link FleetCommands#QUERY_STATE}</li>
 *   <li>reachability of telemetry subscription points</li>
 * </ul>
 * Every call is recorded. Failures can be injected per target and command;
 * change events can be pushed to live subscriptions.
 */
public final class RecordingFleetGateway implements DeviceFleetGateway {

    /**
     * One recorded call. {@code target} is a node name or {@code group:<NAME>}.
     */
    public record Call(String target, String command, String payload, List<NodeRef> members) {}

    private record Subscription(NodeRef node, String attribute, ChangeEventCallback callback) {}

    private final List<Call> calls = new ArrayList<>();
    private final Map<String, Integer> vccOwners = new HashMap<>();
    private final Map<String, Set<Integer>> fspOwners = new HashMap<>();
    private final Map<String, String> functionModes = new HashMap<>();
    private final Map<String, String> states = new HashMap<>();
    private final Set<String> unreachable = new HashSet<>();
    private final Map<String, String> failures = new HashMap<>();
    private final Map<SubscriptionId, Subscription> subscriptions = new LinkedHashMap<>();
    private final AtomicLong nextSubscription = new AtomicLong(1);

    // ---------------------------------------------------------------------
    // DeviceFleetGateway
    // ---------------------------------------------------------------------

    @Override
    public synchronized String call(NodeRef node, String command, String payload) throws RemoteCallFailedException {
        calls.add(new Call(node.name(), command, payload, List.of(node)));
        failIfInjected(node.name(), command);

        String name = node.name();
        switch (command) {
            case FleetCommands.QUERY_STATE:
                return states.getOrDefault(name, "ON");
            case FleetCommands.GET_SUBARRAY_MEMBERSHIP:
                if (node.nodeClass() == NodeClass.FSP) {
                    return fspOwners.getOrDefault(name, Set.of()).stream()
                            .sorted()
                            .map(String::valueOf)
                            .collect(Collectors.joining(",", "[", "]"));
                }
                return Integer.toString(vccOwners.getOrDefault(name, 0));
            case FleetCommands.SET_SUBARRAY_MEMBERSHIP:
                vccOwners.put(name, Integer.parseInt(payload));
                return "";
            case FleetCommands.ADD_SUBARRAY_MEMBERSHIP:
                fspOwners.computeIfAbsent(name, n -> new LinkedHashSet<>()).add(Integer.parseInt(payload));
                return "";
            case FleetCommands.REMOVE_SUBARRAY_MEMBERSHIP:
                Set<Integer> owners = fspOwners.getOrDefault(name, new LinkedHashSet<>());
                owners.remove(Integer.parseInt(payload));
                if (owners.isEmpty()) {
                    functionModes.remove(name);
                }
                return "";
            case FleetCommands.GET_FUNCTION_MODE:
                return functionModes.getOrDefault(name, "IDLE");
            case FleetCommands.SET_FUNCTION_MODE:
                functionModes.put(name, payload);
                return "";
            default:
                return "";
        }
    }

    @Override
    public synchronized void callGroup(GroupRef group, String command, String payload) throws RemoteCallFailedException {
        String target = groupTarget(group.group());
        calls.add(new Call(target, command, payload, group.members()));
        failIfInjected(target, command);
    }

    @Override
    public synchronized void callAsync(NodeRef node, String command, String payload) {
        calls.add(new Call(node.name(), command, payload, List.of(node)));
    }

    @Override
    public synchronized SubscriptionId subscribe(NodeRef node, String attribute, ChangeEventCallback callback)
            throws RemoteCallFailedException {
        calls.add(new Call(node.name(), "subscribe:" + attribute, null, List.of(node)));
        failIfInjected(node.name(), "subscribe:" + attribute);
        SubscriptionId id = new SubscriptionId(nextSubscription.getAndIncrement());
        subscriptions.put(id, new Subscription(node, attribute, callback));
        return id;
    }

    @Override
    public synchronized void unsubscribe(SubscriptionId subscription) throws RemoteCallFailedException {
        Subscription removed = subscriptions.remove(subscription);
        String target = removed == null ? "unknown" : removed.node().name();
        calls.add(new Call(target, "unsubscribe", null, List.of()));
    }

    @Override
    public synchronized boolean probe(String reference) {
        return !unreachable.contains(reference);
    }

    // ---------------------------------------------------------------------
    // Fleet setup
    // ---------------------------------------------------------------------

    public synchronized void setVccOwner(int vccId, int subarrayId) {
        vccOwners.put(NodeRef.vcc(vccId).name(), subarrayId);
    }

    public synchronized int vccOwner(int vccId) {
        return vccOwners.getOrDefault(NodeRef.vcc(vccId).name(), 0);
    }

    public synchronized void addFspOwner(int fspId, int subarrayId) {
        fspOwners.computeIfAbsent(NodeRef.fsp(fspId).name(), n -> new LinkedHashSet<>()).add(subarrayId);
    }

    public synchronized Set<Integer> fspOwners(int fspId) {
        return Set.copyOf(fspOwners.getOrDefault(NodeRef.fsp(fspId).name(), Set.of()));
    }

    public synchronized void setFunctionMode(int fspId, String mode) {
        functionModes.put(NodeRef.fsp(fspId).name(), mode);
    }

    public synchronized String functionMode(int fspId) {
        return functionModes.getOrDefault(NodeRef.fsp(fspId).name(), "IDLE");
    }

    public synchronized void setState(NodeRef node, String state) {
        states.put(node.name(), state);
    }

    public synchronized void markUnreachable(String reference) {
        unreachable.add(reference);
    }

    /** Makes every later {@code command} addressed to {@code target} fail. */
    public synchronized void failOn(String target, String command, String message) {
        failures.put(target + "|" + command, message);
    }

    public synchronized void failOnGroup(NodeGroup group, String command, String message) {
        failOn(groupTarget(group), command, message);
    }

    public synchronized void clearFailures() {
        failures.clear();
    }

    // ---------------------------------------------------------------------
    // Change events
    // ---------------------------------------------------------------------

    /**
     * Delivers a value to every subscription on {@code node}/{@code attribute},
     * outside the gateway's lock.
     */
    public void emit(NodeRef node, String attribute, String value) {
        List<ChangeEventCallback> targets;
        synchronized (this) {
            targets = subscriptions.values().stream()
                    .filter(s -> s.node().name().equals(node.name()) && s.attribute().equals(attribute))
                    .map(Subscription::callback)
                    .collect(Collectors.toList());
        }
        ChangeEvent event = ChangeEvent.value(node, attribute, value, Instant.now());
        targets.forEach(cb -> cb.onChange(event));
    }

    public synchronized int subscriptionCount() {
        return subscriptions.size();
    }

    public synchronized boolean isSubscribed(NodeRef node, String attribute) {
        return subscriptions.values().stream()
                .anyMatch(s -> s.node().name().equals(node.name()) && s.attribute().equals(attribute));
    }

    // ---------------------------------------------------------------------
    // Recorded calls
    // ---------------------------------------------------------------------

    public synchronized List<Call> calls() {
        return Collections.unmodifiableList(new ArrayList<>(calls));
    }

    public synchronized List<Call> callsFor(String command) {
        return calls.stream().filter(c -> c.command().equals(command)).collect(Collectors.toList());
    }

    /** Commands sent to a group, in order. */
    public synchronized List<String> groupCommands(NodeGroup group) {
        String target = groupTarget(group);
        return calls.stream()
                .filter(c -> c.target().equals(target))
                .map(Call::command)
                .collect(Collectors.toList());
    }

    /** Commands sent directly to a node, in order; subscription calls excluded. */
    public synchronized List<String> nodeCommands(NodeRef node) {
        return calls.stream()
                .filter(c -> c.target().equals(node.name()))
                .map(Call::command)
                .filter(cmd -> !cmd.startsWith("subscribe:") && !cmd.equals("unsubscribe"))
                .collect(Collectors.toList());
    }

    public synchronized void clearCalls() {
        calls.clear();
    }

    public static String groupTarget(NodeGroup group) {
        return "group:" + group.name();
    }

    private void failIfInjected(String target, String command) throws RemoteCallFailedException {
        String message = failures.get(target + "|" + Objects.requireNonNull(command));
        if (message != null) {
            throw new RemoteCallFailedException(target, message);
        }
    }
}
