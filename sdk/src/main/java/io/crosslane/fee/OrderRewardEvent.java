package io.crosslane.fee;

import com.fasterxml.jackson.annotation.JsonView;
import io.crosslane.events.BridgeEvent;
import io.crosslane.json.Views;
import io.crosslane.model.MessageKey;

@JsonView(Views.Default.class)
public final class OrderRewardEvent extends BridgeEvent {
    private final MessageKey key;
    private final RewardItem reward;

    public OrderRewardEvent(MessageKey key, RewardItem reward) {
        this.key = key;
        this.reward = reward;
    }

    public MessageKey getKey() {
        return key;
    }

    public RewardItem getReward() {
        return reward;
    }

    @Override
    public String toString() {
        return "OrderRewardEvent{key=" + key + ", reward=" + reward + "}";
    }
}
