package io.crosslane.events;

public interface BridgeEventSink {

    void deposit(BridgeEvent event);
}
