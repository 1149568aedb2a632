package com.questrail.cbf.subarray.internal.exec;

import com.questrail.cbf.subarray.internal.events.FleetOutcomeEvent;
import com.questrail.cbf.subarray.internal.state.SubarrayIntents;

import java.util.List;

/**
 * SubarrayIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary between the pure subarray lifecycle reducer and the
 * fleet.
 *
 * <h2>Role in the architecture</h2>
 * {@code SubarrayIntentExecutor} realizes the intents produced by the
 * {@link com.questrail.cbf.subarray.internal.state.SubarrayStateReducer}. It is
 * the only layer that claims receptors, validates and distributes
 * configurations, and sends observation commands to node groups.
 *
 * <h2>Outcomes</h2>
 * Execution is synchronous. Every executed intent is reported as a
 * {@link FleetOutcomeEvent}, returned in execution order, which the caller
 * feeds back into the reducer. Expected fleet failures are reported as
 * outcomes, not thrown.
 */
public interface SubarrayIntentExecutor
{
    /**
     * Execute the supplied intents in {@link SubarrayIntents.Kind} order.
     *
     * @param intents immutable set of actions to perform
     * @return one or more outcome events per executed intent
     */
    List<FleetOutcomeEvent> execute(SubarrayIntents intents);
}
