package com.questrail.cbf.subarray.internal.events;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * LifecycleCommandEvent
 * -----------------------------------------------------------------------------
 * Lifecycle commands issued by external callers, one event type per command.
 */
public sealed interface LifecycleCommandEvent extends SubarrayEvent
        permits LifecycleCommandEvent.AddReceptors,
                LifecycleCommandEvent.RemoveReceptors,
                LifecycleCommandEvent.RemoveAllReceptors,
                LifecycleCommandEvent.ConfigureScan,
                LifecycleCommandEvent.Scan,
                LifecycleCommandEvent.EndScan,
                LifecycleCommandEvent.GoToIdle,
                LifecycleCommandEvent.Abort,
                LifecycleCommandEvent.ObsReset,
                LifecycleCommandEvent.Restart
{
    /** Name used in result and log messages. */
    default String commandName() {
        return getClass().getSimpleName();
    }

    final class AddReceptors extends SubarrayEvent.Base implements LifecycleCommandEvent {
        private final List<Integer> receptorIds;

        public AddReceptors(Instant timestamp, List<Integer> receptorIds) {
            super(timestamp);
            this.receptorIds = List.copyOf(receptorIds);
        }

        public List<Integer> receptorIds() {
            return receptorIds;
        }
    }

    final class RemoveReceptors extends SubarrayEvent.Base implements LifecycleCommandEvent {
        private final List<Integer> receptorIds;

        public RemoveReceptors(Instant timestamp, List<Integer> receptorIds) {
            super(timestamp);
            this.receptorIds = List.copyOf(receptorIds);
        }

        public List<Integer> receptorIds() {
            return receptorIds;
        }
    }

    final class RemoveAllReceptors extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public RemoveAllReceptors(Instant timestamp) {
            super(timestamp);
        }
    }

    final class ConfigureScan extends SubarrayEvent.Base implements LifecycleCommandEvent {
        private final String document;

        public ConfigureScan(Instant timestamp, String document) {
            super(timestamp);
            this.document = Objects.requireNonNull(document, "document");
        }

        public String document() {
            return document;
        }
    }

    final class Scan extends SubarrayEvent.Base implements LifecycleCommandEvent {
        private final int scanId;

        public Scan(Instant timestamp, int scanId) {
            super(timestamp);
            this.scanId = scanId;
        }

        public int scanId() {
            return scanId;
        }
    }

    final class EndScan extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public EndScan(Instant timestamp) {
            super(timestamp);
        }
    }

    final class GoToIdle extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public GoToIdle(Instant timestamp) {
            super(timestamp);
        }
    }

    final class Abort extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public Abort(Instant timestamp) {
            super(timestamp);
        }
    }

    final class ObsReset extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public ObsReset(Instant timestamp) {
            super(timestamp);
        }
    }

    final class Restart extends SubarrayEvent.Base implements LifecycleCommandEvent {
        public Restart(Instant timestamp) {
            super(timestamp);
        }
    }
}
