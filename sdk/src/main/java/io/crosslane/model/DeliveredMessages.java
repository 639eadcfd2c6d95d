package io.crosslane.model;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.json.Views;

/**
 * Inclusive nonce range.
 */
@JsonView(Views.Default.class)
public final class DeliveredMessages {
    private final long begin;
    private final long end;

    public DeliveredMessages(long begin, long end) {
        if (begin < 0 || end < begin)
            throw new IllegalArgumentException(String.format("Invalid nonce range: `%d..=%d`", begin, end));
        this.begin = begin;
        this.end = end;
    }

    public long getBegin() {
        return begin;
    }

    public long getEnd() {
        return end;
    }

    public long totalMessages() {
        return end - begin + 1;
    }

    public boolean contains(long nonce) {
        return nonce >= begin && nonce <= end;
    }

    public DeliveredMessages extendTo(long nonce) {
        return new DeliveredMessages(begin, nonce);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeliveredMessages)) return false;
        DeliveredMessages that = (DeliveredMessages) o;
        return begin == that.begin && end == that.end;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(begin) * 31 + Long.hashCode(end);
    }

    @Override
    public String toString() {
        return begin + "..=" + end;
    }
}
