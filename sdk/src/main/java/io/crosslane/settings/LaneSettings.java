package io.crosslane.settings;

public final class LaneSettings {
    private final long maxPendingMessages;
    private final int maxMessagesToPruneAtOnce;
    private final int maxUnrewardedRelayerEntries;
    private final long maxUnconfirmedMessages;

    public LaneSettings(long maxPendingMessages, int maxMessagesToPruneAtOnce,
                        int maxUnrewardedRelayerEntries, long maxUnconfirmedMessages) {
        if (maxPendingMessages <= 0 || maxMessagesToPruneAtOnce <= 0 || maxUnrewardedRelayerEntries <= 0 || maxUnconfirmedMessages <= 0)
            throw new IllegalArgumentException("Lane limits must be positive.");
        this.maxPendingMessages = maxPendingMessages;
        this.maxMessagesToPruneAtOnce = maxMessagesToPruneAtOnce;
        this.maxUnrewardedRelayerEntries = maxUnrewardedRelayerEntries;
        this.maxUnconfirmedMessages = maxUnconfirmedMessages;
    }

    public long getMaxPendingMessages() {
        return maxPendingMessages;
    }

    public int getMaxMessagesToPruneAtOnce() {
        return maxMessagesToPruneAtOnce;
    }

    public int getMaxUnrewardedRelayerEntries() {
        return maxUnrewardedRelayerEntries;
    }

    public long getMaxUnconfirmedMessages() {
        return maxUnconfirmedMessages;
    }
}
