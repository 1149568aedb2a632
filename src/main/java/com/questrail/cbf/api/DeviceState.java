package com.questrail.cbf.api;

import java.util.Locale;

/**
 * Liveness state reported by a fleet node.
 */
public enum DeviceState
{
    ON,
    OFF,
    STANDBY,
    DISABLE,
    FAULT,
    INIT,
    ALARM,
    UNKNOWN;

    /**
     * Lenient decode of a reported value. Unrecognised values map to {@link #UNKNOWN}.
     */
    public static DeviceState parse(String value) {
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
