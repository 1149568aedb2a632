package com.questrail.cbf.api;

import java.util.Optional;

/**
 * Signal-processing role a function-mode node (FSP) can be bound to.
 *
 * <p>The wire names are the ones used in scan configuration documents and in
 * the {@code SetFunctionMode} / {@code GetFunctionMode} fleet commands.</p>
 */
public enum FunctionMode
{
    IDLE("IDLE"),
    CORR("CORR"),
    PSS_BF("PSS-BF"),
    PST_BF("PST-BF"),
    VLBI("VLBI");

    private final String wireName;

    FunctionMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name; {@link #IDLE} is not a mode that can be requested
     * by a configuration but is returned so node state can be decoded too.
     */
    public static Optional<FunctionMode> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (FunctionMode mode : values()) {
            if (mode.wireName.equals(name)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
