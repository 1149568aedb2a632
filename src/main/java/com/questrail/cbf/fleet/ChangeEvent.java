package com.questrail.cbf.fleet;

import java.time.Instant;
import java.util.Objects;

/**
 * ChangeEvent
 * -----------------------------------------------------------------------------
 * Typed change-event payload delivered to a {@link ChangeEventCallback}.
 *
 * <p>The source node carries its {@link NodeClass}, so consumers never have to
 * infer what kind of node produced an event from its name. A non-null
 * {@code error} marks an error event, in which case {@code value} is
 * {@code null}.</p>
 */
public record ChangeEvent(NodeRef source,
                          String attribute,
                          String value,
                          String error,
                          Instant timestamp)
{
    public ChangeEvent {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ChangeEvent value(NodeRef source, String attribute, String value, Instant timestamp) {
        return new ChangeEvent(source, attribute, Objects.requireNonNull(value, "value"), null, timestamp);
    }

    public static ChangeEvent error(NodeRef source, String attribute, String error, Instant timestamp) {
        return new ChangeEvent(source, attribute, null, Objects.requireNonNull(error, "error"), timestamp);
    }

    public boolean isError() {
        return error != null;
    }
}
