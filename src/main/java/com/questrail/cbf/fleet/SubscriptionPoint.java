package com.questrail.cbf.fleet;

import java.util.Objects;

/**
 * Address of an externally published telemetry attribute, written as
 * {@code <device name>/<attribute>}; the device name itself contains slashes,
 * so the attribute is everything after the last one.
 */
public record SubscriptionPoint(String deviceName, String attribute)
{
    public SubscriptionPoint {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(attribute, "attribute");
    }

    /**
     * @throws IllegalArgumentException if the reference has no device or attribute part
     */
    public static SubscriptionPoint parse(String reference) {
        Objects.requireNonNull(reference, "reference");
        int slash = reference.lastIndexOf('/');
        if (slash <= 0 || slash == reference.length() - 1) {
            throw new IllegalArgumentException("Malformed subscription point: " + reference);
        }
        return new SubscriptionPoint(reference.substring(0, slash), reference.substring(slash + 1));
    }

    public NodeRef node() {
        return NodeRef.telemetry(deviceName);
    }

    @Override
    public String toString() {
        return deviceName + "/" + attribute;
    }
}
