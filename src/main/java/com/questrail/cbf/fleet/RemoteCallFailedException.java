package com.questrail.cbf.fleet;

/**
 * Raised by {@link DeviceFleetGateway} when a node is unreachable or a command
 * returned a failure.
 */
public final class RemoteCallFailedException extends Exception
{
    private final String target;

    public RemoteCallFailedException(String target, String message) {
        super(target + ": " + message);
        this.target = target;
    }

    public RemoteCallFailedException(String target, String message, Throwable cause) {
        super(target + ": " + message, cause);
        this.target = target;
    }

    /** Node or group the failed call was addressed to. */
    public String target() {
        return target;
    }
}
