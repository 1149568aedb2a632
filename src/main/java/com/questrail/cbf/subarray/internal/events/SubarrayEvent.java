package com.questrail.cbf.subarray.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SubarrayEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every input to the subarray state reducer.
 *
 * <h2>Role in the architecture</h2>
 * The orchestrator is event driven. Two families of events exist:
 * <ul>
 *   <li>{@link LifecycleCommandEvent}: a caller asked for a lifecycle operation</li>
 *   <li>{@link FleetOutcomeEvent}: fleet work requested by an intent has finished</li>
 * </ul>
 * State changes happen only when the reducer applies one of these.
 *
 * <h2>Design constraints</h2>
 * Events are immutable and carry only what the reducer needs to decide the
 * next state.
 */
public interface SubarrayEvent
{
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SubarrayEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }
}
