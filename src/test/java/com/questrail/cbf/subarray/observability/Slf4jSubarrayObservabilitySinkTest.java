package com.questrail.cbf.subarray.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.cbf.api.ModelType;
import com.questrail.cbf.api.ObsState;
import com.questrail.cbf.subarray.internal.events.LifecycleCommandEvent;
import com.questrail.cbf.subarray.internal.state.SubarrayIntents;
import com.questrail.cbf.subarray.internal.state.SubarrayState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jSubarrayObservabilitySinkTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final Slf4jSubarrayObservabilitySink sink = new Slf4jSubarrayObservabilitySink();
    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jSubarrayObservabilitySink.class);
        logger.setLevel(Level.DEBUG);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(null);
    }

    private List<String> messages(Level level) {
        return appender.list.stream()
                .filter(e -> e.getLevel() == level)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void obsStateAndReceptorChangesAreLogged() {
        SubarrayState before = SubarrayState.initial(3, T0);
        SubarrayState after = before.withReceptors(List.of(1, 2), T0).withObsState(ObsState.IDLE, T0);

        sink.onStateTransition(new SubarrayStateTransitionEvent(T0, before, after,
                new LifecycleCommandEvent.AddReceptors(T0, List.of(1, 2)), SubarrayIntents.none()));

        List<String> info = messages(Level.INFO);
        assertEquals(2, info.size());
        assertTrue(info.get(0).startsWith("Subarray 3 obsState: EMPTY -> IDLE"), info.get(0));
        assertEquals("Subarray 3 receptors: [] -> [1, 2]", info.get(1));
    }

    @Test
    void resultingIntentsAreLoggedAtDebug() {
        SubarrayState state = SubarrayState.initial(1, T0);

        sink.onStateTransition(new SubarrayStateTransitionEvent(T0, state, state,
                new LifecycleCommandEvent.AddReceptors(T0, List.of(4)), SubarrayIntents.allocate(List.of(4))));

        assertTrue(messages(Level.INFO).isEmpty());
        assertEquals(1, messages(Level.DEBUG).size());
    }

    @Test
    void modelUpdateSeverityFollowsTheOutcome() {
        sink.onModelUpdate(new ModelUpdateObservabilityEvent(T0, ModelType.DELAY,
                ModelUpdateObservabilityEvent.Kind.APPLIED, T0, null));
        sink.onModelUpdate(new ModelUpdateObservabilityEvent(T0, ModelType.DELAY,
                ModelUpdateObservabilityEvent.Kind.STALE_DROPPED, T0, "older"));
        sink.onModelUpdate(new ModelUpdateObservabilityEvent(T0, ModelType.JONES,
                ModelUpdateObservabilityEvent.Kind.FANOUT_FAILED, T0, "FSP: timeout"));

        assertEquals(1, messages(Level.DEBUG).size());
        assertEquals(List.of("DELAY update STALE_DROPPED: older"), messages(Level.WARN));
        assertEquals(1, messages(Level.ERROR).size());
    }

    @Test
    void errorsCarryTheirCause() {
        IllegalStateException cause = new IllegalStateException("boom");

        sink.onError(new SubarrayErrorEvent(T0, "dispatcher failed", cause));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("Subarray error: dispatcher failed", event.getFormattedMessage());
        assertEquals("boom", event.getThrowableProxy().getMessage());
    }
}
