package com.questrail.cbf.api;

import java.util.Locale;

/**
 * Health state reported by a fleet node.
 */
public enum HealthState
{
    OK,
    DEGRADED,
    FAILED,
    UNKNOWN;

    public static HealthState parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
