package com.questrail.cbf.subarray.internal.model;

import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.api.ModelUpdatePhase;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.fleet.DeviceFleetGateway;
import com.questrail.cbf.fleet.GroupRef;
import com.questrail.cbf.fleet.NodeGroup;
import com.questrail.cbf.fleet.RemoteCallFailedException;
import com.questrail.cbf.subarray.internal.resource.NodeGroupAssignments;
import com.questrail.cbf.subarray.internal.time.Cancellable;
import com.questrail.cbf.subarray.internal.time.MonotonicClock;
import com.questrail.cbf.subarray.internal.time.MonotonicScheduler;
import com.questrail.cbf.subarray.internal.time.WallClock;
import com.questrail.cbf.subarray.observability.ModelUpdateObservabilityEvent;
import com.questrail.cbf.subarray.observability.ModelUpdateObservabilityEvent.Kind;
import com.questrail.cbf.subarray.observability.NullObservabilitySink;
import com.questrail.cbf.subarray.observability.SubarrayErrorEvent;
import com.questrail.cbf.subarray.observability.SubarrayObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * ModelUpdateScheduler
 * =============================================================================
 * Applies epoch-stamped model updates (delay model, Jones matrix, beam
 * weights) to the fleet at the instant each entry names.
 *
 * <h2>Dispatchers</h2>
 * Each {@link ModelType} has its own dispatcher: a priority queue of pending
 * entries ordered by (epoch, arrival) and a single armed wake-up on the
 * {@link MonotonicScheduler} for the earliest deadline. Dispatchers never
 * contend with each other.
 *
 * <h2>Ordering</h2>
 * A wake drains every due entry while holding the dispatcher's fan-out lock,
 * so entries of one type are applied in ascending epoch order. An entry whose
 * epoch is older than the last applied one is dropped as stale.
 *
 * <h2>Gating</h2>
 * Documents are accepted only while the subarray is READY or SCANNING, and
 * the obsState is checked again right before each fan-out. A document equal
 * to the previously accepted one of the same type is dropped.
 *
 * <h2>Failures</h2>
 * A failed fan-out is logged and reported to the observability sink. It is
 * never retried and never stops later entries.
 */
public final class ModelUpdateScheduler
{
    private static final Logger log = LoggerFactory.getLogger(ModelUpdateScheduler.class);

    /**
     * What happened to a submitted document.
     */
    public enum Disposition {
        ACCEPTED,
        REJECTED_BY_STATE,
        DUPLICATE,
        MALFORMED
    }

    private final DeviceFleetGateway gateway;
    private final NodeGroupAssignments groups;
    private final Supplier<ObsState> obsState;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final SubarrayObservabilitySink sink;
    private final ModelDocumentParser parser;

    private final Map<ModelType, Dispatcher> dispatchers = new EnumMap<>(ModelType.class);

    public ModelUpdateScheduler(DeviceFleetGateway gateway,
                                NodeGroupAssignments groups,
                                Supplier<ObsState> obsState,
                                MonotonicClock clock,
                                WallClock wallClock,
                                MonotonicScheduler scheduler,
                                SubarrayObservabilitySink sink,
                                ModelDocumentParser parser) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.obsState = Objects.requireNonNull(obsState, "obsState");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.parser = Objects.requireNonNull(parser, "parser");

        for (ModelType type : ModelType.values()) {
            dispatchers.put(type, new Dispatcher(type));
        }
    }

    /**
     * Submits a raw model document whose type is taken from its top-level key.
     */
    public Disposition onModelDocument(String raw) {
        ModelType type;
        try {
            type = parser.detectType(raw);
        } catch (ModelDocumentException e) {
            log.warn("Dropping model document: {}", e.getMessage());
            emit(null, Kind.MALFORMED, null, e.getMessage());
            return Disposition.MALFORMED;
        }
        return onModelDocument(type, raw);
    }

    /**
     * Submits a raw model document of a known type.
     */
    public Disposition onModelDocument(ModelType type, String raw) {
        Objects.requireNonNull(type, "type");
        ObsState state = obsState.get();
        if (!state.acceptsModelUpdates()) {
            log.warn("{} document rejected in obsState {}", type, state);
            emit(type, Kind.REJECTED_BY_STATE, null, "obsState " + state);
            return Disposition.REJECTED_BY_STATE;
        }
        return dispatchers.get(type).accept(raw);
    }

    public ModelUpdatePhase phase(ModelType type) {
        return dispatchers.get(type).phase();
    }

    /** Number of entries of {@code type} waiting for their epoch. */
    public int pendingCount(ModelType type) {
        return dispatchers.get(type).pendingCount();
    }

    /**
     * Forgets the previously accepted documents, so the next document of any
     * type is accepted even if it repeats the last one.
     */
    public void resetDeduplication() {
        dispatchers.values().forEach(Dispatcher::resetDeduplication);
    }

    /**
     * Cancels every armed wake and discards pending entries. Documents
     * submitted afterwards are rejected.
     */
    public void shutdown() {
        dispatchers.values().forEach(Dispatcher::shutdown);
    }

    private void emit(ModelType type, Kind kind, Instant epoch, String detail) {
        sink.onModelUpdate(new ModelUpdateObservabilityEvent(wallClock.now(), type, kind, epoch, detail));
    }

    /** Monotonic deadline {@code offset} from {@code now}, clamped to the range of a long. */
    static long deadlineNanos(long now, Duration offset) {
        long offsetNanos;
        if (offset.getSeconds() >= Long.MAX_VALUE / 1_000_000_000L) {
            offsetNanos = Long.MAX_VALUE;
        } else if (offset.getSeconds() <= Long.MIN_VALUE / 1_000_000_000L) {
            offsetNanos = Long.MIN_VALUE;
        } else {
            offsetNanos = offset.toNanos();
        }
        long deadline = now + offsetNanos;
        if (((now ^ deadline) & (offsetNanos ^ deadline)) < 0) {
            return offsetNanos > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return deadline;
    }

    // ---------------------------------------------------------------------
    // Per-type dispatcher
    // ---------------------------------------------------------------------

    private record PendingUpdate(Instant epoch, long deadlineNanos, long sequence, String payload) {}

    private static final Comparator<PendingUpdate> BY_EPOCH_THEN_ARRIVAL =
            Comparator.comparing(PendingUpdate::epoch).thenComparingLong(PendingUpdate::sequence);

    private final class Dispatcher {
        private final ModelType type;
        private final ReentrantLock fanoutLock = new ReentrantLock();

        // Guarded by this
        private final PriorityQueue<PendingUpdate> queue = new PriorityQueue<>(BY_EPOCH_THEN_ARRIVAL);
        private String lastAccepted;
        private long nextSequence;
        private Cancellable armed;
        private long armedDeadline;
        private ModelUpdatePhase phase = ModelUpdatePhase.IDLE;
        private boolean appliedSinceScheduled;
        private boolean stopped;

        // Guarded by fanoutLock
        private Instant lastApplied;

        Dispatcher(ModelType type) {
            this.type = type;
        }

        synchronized Disposition accept(String raw) {
            if (stopped) {
                emit(type, Kind.REJECTED_BY_STATE, null, "scheduler stopped");
                return Disposition.REJECTED_BY_STATE;
            }
            if (raw != null && raw.equals(lastAccepted)) {
                log.warn("{} document identical to the previous one; dropped", type);
                emit(type, Kind.DUPLICATE_DROPPED, null, "identical to previous document");
                return Disposition.DUPLICATE;
            }

            ModelUpdateBatch batch;
            try {
                batch = parser.parse(type, raw);
            } catch (ModelDocumentException e) {
                log.warn("Malformed {} document: {}", type, e.getMessage());
                emit(type, Kind.MALFORMED, null, e.getMessage());
                return Disposition.MALFORMED;
            }

            long now = clock.nowNanos();
            Instant wallNow = wallClock.now();
            for (ModelUpdateEntry entry : batch.entries()) {
                long deadline = deadlineNanos(now, Duration.between(wallNow, entry.epoch()));
                queue.add(new PendingUpdate(entry.epoch(), deadline, nextSequence++, entry.payload()));
                emit(type, Kind.ACCEPTED, entry.epoch(), null);
            }
            lastAccepted = raw;
            if (!queue.isEmpty()) {
                if (phase != ModelUpdatePhase.SCHEDULED) {
                    appliedSinceScheduled = false;
                }
                phase = ModelUpdatePhase.SCHEDULED;
            }
            arm();
            return Disposition.ACCEPTED;
        }

        /**
         * Arms a wake for the head of the queue unless one is already armed
         * for an earlier or equal deadline. Caller holds the monitor.
         */
        private void arm() {
            PendingUpdate head = queue.peek();
            if (head == null || stopped) {
                return;
            }
            if (armed != null) {
                if (armedDeadline <= head.deadlineNanos()) {
                    return;
                }
                armed.cancel();
            }
            armedDeadline = head.deadlineNanos();
            armed = scheduler.scheduleAtNanos(armedDeadline, this::drain);
        }

        private void drain() {
            fanoutLock.lock();
            try {
                synchronized (this) {
                    armed = null;
                }
                while (true) {
                    PendingUpdate next;
                    synchronized (this) {
                        next = queue.peek();
                        if (stopped || next == null || next.deadlineNanos() > clock.nowNanos()) {
                            if (queue.isEmpty() && phase == ModelUpdatePhase.SCHEDULED) {
                                phase = appliedSinceScheduled ? ModelUpdatePhase.APPLIED : ModelUpdatePhase.IDLE;
                            }
                            arm();
                            return;
                        }
                        queue.poll();
                    }
                    if (apply(next)) {
                        synchronized (this) {
                            appliedSinceScheduled = true;
                        }
                    }
                }
            } catch (RuntimeException e) {
                sink.onError(new SubarrayErrorEvent(wallClock.now(), type + " dispatcher failed", e));
            } finally {
                fanoutLock.unlock();
            }
        }

        /**
         * @return true if the entry was fanned out to the fleet, false if it
         *         was dropped as stale or skipped by obsState
         */
        private boolean apply(PendingUpdate update) {
            if (lastApplied != null && update.epoch().isBefore(lastApplied)) {
                log.warn("{} entry for epoch {} is older than applied epoch {}; dropped",
                        type, update.epoch(), lastApplied);
                emit(type, Kind.STALE_DROPPED, update.epoch(), "older than " + lastApplied);
                return false;
            }

            ObsState state = obsState.get();
            if (!state.acceptsModelUpdates()) {
                log.info("{} entry for epoch {} skipped in obsState {}", type, update.epoch(), state);
                emit(type, Kind.SKIPPED_BY_STATE, update.epoch(), "obsState " + state);
                return false;
            }

            boolean ok = true;
            if (type.reachesChannelNodes()) {
                ok = fanOut(groups.snapshot(NodeGroup.VCC), update);
            }
            ok &= fanOut(groups.snapshot(NodeGroup.FSP), update);

            lastApplied = update.epoch();
            if (ok) {
                emit(type, Kind.APPLIED, update.epoch(), null);
            }
            return true;
        }

        private boolean fanOut(GroupRef group, PendingUpdate update) {
            if (group.isEmpty()) {
                return true;
            }
            try {
                gateway.callGroup(group, type.command(), update.payload());
                return true;
            } catch (RemoteCallFailedException e) {
                log.error("{} to {} for epoch {} failed: {}",
                        type.command(), group.group(), update.epoch(), e.getMessage());
                emit(type, Kind.FANOUT_FAILED, update.epoch(), group.group() + ": " + e.getMessage());
                return false;
            }
        }

        synchronized ModelUpdatePhase phase() {
            return phase;
        }

        synchronized int pendingCount() {
            return queue.size();
        }

        synchronized void resetDeduplication() {
            lastAccepted = null;
        }

        synchronized void shutdown() {
            stopped = true;
            if (armed != null) {
                armed.cancel();
                armed = null;
            }
            queue.clear();
            phase = ModelUpdatePhase.IDLE;
        }
    }
}
