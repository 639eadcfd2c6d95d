package io.crosslane.dispatch;

import io.crosslane.model.Weight;

import java.util.Optional;

public interface ForwardedMessageWeigher {

    // Empty if the message can not be weighed
    Optional<Weight> weigh(byte[] message);
}
