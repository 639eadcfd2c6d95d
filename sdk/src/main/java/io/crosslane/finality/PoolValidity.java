package io.crosslane.finality;

import io.crosslane.errors.BridgeError;

import java.util.Objects;
import java.util.Optional;

/**
 * Verdict on an unsigned header submission. Invalid submissions ban the header, unknown ones may be retried.
 */
public final class PoolValidity {
    public enum Status { VALID, UNKNOWN, INVALID }

    public static final PoolValidity VALID = new PoolValidity(Status.VALID, null);

    private final Status status;
    private final BridgeError reason;

    private PoolValidity(Status status, BridgeError reason) {
        this.status = status;
        this.reason = reason;
    }

    public static PoolValidity unknown(BridgeError reason) {
        return new PoolValidity(Status.UNKNOWN, reason);
    }

    public static PoolValidity invalid(BridgeError reason) {
        return new PoolValidity(Status.INVALID, reason);
    }

    public Status getStatus() {
        return status;
    }

    public Optional<BridgeError> getReason() {
        return Optional.ofNullable(reason);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public boolean isBanned() {
        return status == Status.INVALID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PoolValidity that = (PoolValidity) o;
        return status == that.status && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, reason);
    }

    @Override
    public String toString() {
        return reason == null ? status.name() : status + "(" + reason + ")";
    }
}
