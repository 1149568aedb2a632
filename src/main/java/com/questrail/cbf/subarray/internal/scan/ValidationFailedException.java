package com.questrail.cbf.subarray.internal.scan;

/**
 * Raised by {@link ScanConfigValidator} with the first offending reason.
 * The message always ends with "Aborting configuration.".
 */
public final class ValidationFailedException extends Exception
{
    static final String SUFFIX = " Aborting configuration.";

    private final String reason;

    public ValidationFailedException(String reason) {
        super(reason + SUFFIX);
        this.reason = reason;
    }

    /** The offending reason without the trailing abort notice. */
    public String reason() {
        return reason;
    }
}
