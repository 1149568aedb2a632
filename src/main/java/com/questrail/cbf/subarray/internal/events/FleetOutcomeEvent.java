package com.questrail.cbf.subarray.internal.events;

import com.questrail.cbf.api.ErrorKind;
import com.questrail.cbf.api.FunctionMode;
import com.questrail.cbf.subarray.internal.scan.ScanConfiguration;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FleetOutcomeEvent
 * -----------------------------------------------------------------------------
 * Completion of fleet work requested through an intent.
 *
 * <p>Outcome events are produced by the intent executor and fed back into the
 * reducer. An outcome may carry a failure; the orchestrator reports the first
 * failure seen while processing a command as that command's result.</p>
 */
public sealed interface FleetOutcomeEvent extends SubarrayEvent
        permits FleetOutcomeEvent.ReceptorsUpdated,
                FleetOutcomeEvent.ConfigurationApplied,
                FleetOutcomeEvent.ConfigurationRejected,
                FleetOutcomeEvent.ConfigurationFaulted,
                FleetOutcomeEvent.Deconfigured,
                FleetOutcomeEvent.ScanStarted,
                FleetOutcomeEvent.ScanEnded,
                FleetOutcomeEvent.FleetAborted,
                FleetOutcomeEvent.FleetReset,
                FleetOutcomeEvent.FleetIdled,
                FleetOutcomeEvent.FleetCommandFailed,
                FleetOutcomeEvent.InconsistencyDetected
{
    /** Failure classification, empty for successful outcomes. */
    default Optional<ErrorKind> failure() {
        return Optional.empty();
    }

    /** Human readable detail; for failures, the reason reported to the caller. */
    default String detail() {
        return "";
    }

    /**
     * Receptor allocation or release finished. {@code assigned} is the full
     * assigned set afterwards, in assignment order.
     */
    final class ReceptorsUpdated extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final List<Integer> assigned;
        private final List<String> errors;
        private final ErrorKind errorKind;

        public ReceptorsUpdated(Instant timestamp, List<Integer> assigned, List<String> errors, ErrorKind errorKind) {
            super(timestamp);
            this.assigned = List.copyOf(assigned);
            this.errors = List.copyOf(errors);
            this.errorKind = errors.isEmpty() ? null : Objects.requireNonNull(errorKind, "errorKind");
        }

        public List<Integer> assigned() {
            return assigned;
        }

        public List<String> errors() {
            return errors;
        }

        @Override
        public Optional<ErrorKind> failure() {
            return Optional.ofNullable(errorKind);
        }

        @Override
        public String detail() {
            return String.join("; ", errors);
        }
    }

    final class ConfigurationApplied extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final ScanConfiguration configuration;
        private final Map<FunctionMode, List<Integer>> assignedNodes;

        public ConfigurationApplied(Instant timestamp,
                                    ScanConfiguration configuration,
                                    Map<FunctionMode, List<Integer>> assignedNodes) {
            super(timestamp);
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            this.assignedNodes = Map.copyOf(assignedNodes);
        }

        public ScanConfiguration configuration() {
            return configuration;
        }

        public Map<FunctionMode, List<Integer>> assignedNodes() {
            return assignedNodes;
        }
    }

    /**
     * The configure attempt failed and was rolled back; recoverable.
     */
    final class ConfigurationRejected extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final ErrorKind kind;
        private final String reason;

        public ConfigurationRejected(Instant timestamp, ErrorKind kind, String reason) {
            super(timestamp);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Optional<ErrorKind> failure() {
            return Optional.of(kind);
        }

        @Override
        public String detail() {
            return reason;
        }
    }

    /**
     * The configure attempt failed in a way the orchestrator cannot reason
     * about; the fleet may hold a partial configuration.
     */
    final class ConfigurationFaulted extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final String reason;

        public ConfigurationFaulted(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Optional<ErrorKind> failure() {
            return Optional.of(ErrorKind.INTERNAL_INCONSISTENCY);
        }

        @Override
        public String detail() {
            return reason;
        }
    }

    final class Deconfigured extends SubarrayEvent.Base implements FleetOutcomeEvent {
        public Deconfigured(Instant timestamp) {
            super(timestamp);
        }
    }

    final class ScanStarted extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final int scanId;

        public ScanStarted(Instant timestamp, int scanId) {
            super(timestamp);
            this.scanId = scanId;
        }

        public int scanId() {
            return scanId;
        }
    }

    final class ScanEnded extends SubarrayEvent.Base implements FleetOutcomeEvent {
        public ScanEnded(Instant timestamp) {
            super(timestamp);
        }
    }

    final class FleetAborted extends SubarrayEvent.Base implements FleetOutcomeEvent {
        public FleetAborted(Instant timestamp) {
            super(timestamp);
        }
    }

    final class FleetReset extends SubarrayEvent.Base implements FleetOutcomeEvent {
        public FleetReset(Instant timestamp) {
            super(timestamp);
        }
    }

    final class FleetIdled extends SubarrayEvent.Base implements FleetOutcomeEvent {
        public FleetIdled(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * A scan-level fleet command failed; the obsState is left where it was.
     */
    final class FleetCommandFailed extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final String command;
        private final String reason;

        public FleetCommandFailed(Instant timestamp, String command, String reason) {
            super(timestamp);
            this.command = Objects.requireNonNull(command, "command");
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public String command() {
            return command;
        }

        @Override
        public Optional<ErrorKind> failure() {
            return Optional.of(ErrorKind.REMOTE_CALL_FAILED);
        }

        @Override
        public String detail() {
            return command + " failed: " + reason;
        }
    }

    final class InconsistencyDetected extends SubarrayEvent.Base implements FleetOutcomeEvent {
        private final String reason;

        public InconsistencyDetected(Instant timestamp, String reason) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Optional<ErrorKind> failure() {
            return Optional.of(ErrorKind.INTERNAL_INCONSISTENCY);
        }

        @Override
        public String detail() {
            return reason;
        }
    }
}
