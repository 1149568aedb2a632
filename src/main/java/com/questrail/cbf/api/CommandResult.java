package com.questrail.cbf.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a lifecycle command: a result code, a human readable message and,
 * for non-OK results, the failure classification.
 */
public record CommandResult(ResultCode code, String message, ErrorKind errorKind)
{
    public CommandResult {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        if (code == ResultCode.OK && errorKind != null) {
            throw new IllegalArgumentException("OK results carry no error kind");
        }
        if (code != ResultCode.OK && errorKind == null) {
            throw new IllegalArgumentException("non-OK results require an error kind");
        }
    }

    public static CommandResult ok(String message) {
        return new CommandResult(ResultCode.OK, message, null);
    }

    public static CommandResult failed(ErrorKind kind, String message) {
        return new CommandResult(ResultCode.FAILED, message, kind);
    }

    public static CommandResult rejected(String message) {
        return new CommandResult(ResultCode.REJECTED, message, ErrorKind.REJECTED_BY_STATE);
    }

    public boolean isOk() {
        return code == ResultCode.OK;
    }

    public Optional<ErrorKind> error() {
        return Optional.ofNullable(errorKind);
    }
}
