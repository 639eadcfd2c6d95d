package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.events.BridgeEvent;
import io.crosslane.json.Views;
import io.crosslane.model.AccountId;
import io.crosslane.model.MessageKey;

import java.math.BigInteger;

/**
 * Collateral taken from an assigned relayer for a message it did not deliver in its slot.
 * The amount is what has actually been moved, zero if the transfer failed.
 */
@JsonView(Views.Default.class)
public final class SlashReport extends BridgeEvent {
    private final MessageKey key;
    private final long sentTime;
    private final long confirmTime;
    private final long delayTime;
    private final AccountId account;
    private final BigInteger amount;

    public SlashReport(MessageKey key, long sentTime, long confirmTime, long delayTime, AccountId account, BigInteger amount) {
        this.key = key;
        this.sentTime = sentTime;
        this.confirmTime = confirmTime;
        this.delayTime = delayTime;
        this.account = account;
        this.amount = amount;
    }

    public MessageKey getKey() {
        return key;
    }

    public long getSentTime() {
        return sentTime;
    }

    public long getConfirmTime() {
        return confirmTime;
    }

    public long getDelayTime() {
        return delayTime;
    }

    public AccountId getAccount() {
        return account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public String toString() {
        return "SlashReport{key=" + key + ", sentTime=" + sentTime + ", confirmTime=" + confirmTime
                + ", delayTime=" + delayTime + ", account=" + account + ", amount=" + amount + "}";
    }
}
